package dev.jobmatcher.store.impl;

import dev.jobmatcher.entity.JobPost;
import dev.jobmatcher.model.JobPosting;
import dev.jobmatcher.repository.JobPostRepository;
import jakarta.persistence.EntityManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.AdditionalAnswers.delegatesTo;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;

@DataJpaTest
@ActiveProfiles("test")
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JpaJobInventoryStoreSnapshotTest {

    @Autowired
    private JobPostRepository jobPostRepository;

    @Autowired
    private EntityManager entityManager;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @BeforeEach
    void setUp() {
        jobPostRepository.deleteAllInBatch();
        jobPostRepository.saveAll(IntStream.rangeClosed(1, 5)
                .mapToObj(i -> JobPost.builder()
                        .id("job-" + i)
                        .title("Engineer " + i)
                        .company("Acme")
                        .source("lever")
                        .createdAt(LocalDateTime.of(2026, 1, 15, 12, 0))
                        .build())
                .toList());
    }

    @Test
    @DisplayName("Should read every stored job in id order")
    void shouldReadAllJobs() {
        JpaJobInventoryStore store = new JpaJobInventoryStore(jobPostRepository, entityManager, transactionManager);

        List<String> ids = store.listAllJobs().map(JobPosting::getId).collectList().block();

        assertThat(ids).containsExactly("job-1", "job-2", "job-3", "job-4", "job-5");
    }

    @Test
    @DisplayName("Should return the full load when the ingester truncates the table mid-read")
    void shouldKeepSnapshotWhenTableIsTruncatedDuringRead() {
        AtomicBoolean truncated = new AtomicBoolean();
        EntityManager racing = mock(EntityManager.class, delegatesTo(entityManager));
        doAnswer(invocation -> {
            if (truncated.compareAndSet(false, true)) {
                // Another connection empties the table after the first row has been read
                CompletableFuture.runAsync(jobPostRepository::deleteAllInBatch).get(10, TimeUnit.SECONDS);
            }
            entityManager.detach(invocation.getArgument(0));
            return null;
        }).when(racing).detach(any());
        JpaJobInventoryStore store = new JpaJobInventoryStore(jobPostRepository, racing, transactionManager);

        List<String> ids = store.listAllJobs().map(JobPosting::getId).collectList().block();

        assertThat(truncated).isTrue();
        assertThat(jobPostRepository.count()).isZero();
        assertThat(ids).containsExactly("job-1", "job-2", "job-3", "job-4", "job-5");
    }
}
