package dev.jobmatcher.store.impl;

import dev.jobmatcher.entity.JobPost;
import dev.jobmatcher.model.JobPosting;
import dev.jobmatcher.repository.JobPostRepository;
import dev.jobmatcher.store.JobInventoryStore;
import jakarta.persistence.EntityManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Stream;

/**
 * Reads the inventory with one query inside one read-only transaction.
 * The ingester may truncate and reload the table at any time, so a pass must never see a mix of two loads.
 */
@Slf4j
@Component
public class JpaJobInventoryStore implements JobInventoryStore {

    private final JobPostRepository jobPostRepository;
    private final EntityManager entityManager;
    private final TransactionTemplate snapshotTransaction;

    public JpaJobInventoryStore(JobPostRepository jobPostRepository, EntityManager entityManager,
                                PlatformTransactionManager transactionManager) {
        this.jobPostRepository = jobPostRepository;
        this.entityManager = entityManager;
        this.snapshotTransaction = new TransactionTemplate(transactionManager);
        this.snapshotTransaction.setReadOnly(true);
    }

    @Override
    public Flux<JobPosting> listAllJobs() {
        return Flux.defer(() -> Flux.fromIterable(readSnapshot()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private List<JobPosting> readSnapshot() {
        List<JobPosting> jobs = snapshotTransaction.execute(status -> {
            try (Stream<JobPost> posts = jobPostRepository.streamInventory()) {
                return posts.map(this::detachedPosting).toList();
            }
        });
        if (jobs == null) {
            return List.of();
        }
        log.debug("Loaded inventory snapshot of {} jobs", jobs.size());
        return jobs;
    }

    // Rows are dropped from the persistence context as they are mapped so a large table is not held twice
    private JobPosting detachedPosting(JobPost post) {
        JobPosting posting = toPosting(post);
        entityManager.detach(post);
        return posting;
    }

    static JobPosting toPosting(JobPost post) {
        return JobPosting.builder()
                .id(post.getId())
                .title(post.getTitle())
                .company(post.getCompany())
                .source(post.getSource())
                .createdAt(post.getCreatedAt() != null ? post.getCreatedAt().toInstant(ZoneOffset.UTC) : null)
                .description(post.getDescription())
                .requirements(post.getRequirements())
                .location(post.getLocation())
                .applyLink(post.getApplyLink())
                .build();
    }
}
