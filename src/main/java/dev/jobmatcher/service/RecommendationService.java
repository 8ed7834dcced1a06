package dev.jobmatcher.service;

import dev.jobmatcher.model.JobPosting;
import dev.jobmatcher.model.Subscription;
import dev.jobmatcher.service.ProfileScorer.ProfileMatchDetail;
import dev.jobmatcher.store.JobInventoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * On-demand recommendations: ranks the current inventory for a keyword list.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecommendationService {

    private final JobInventoryStore jobInventoryStore;
    private final ProfileScorer profileScorer;

    public record Recommendation(JobPosting job, ProfileMatchDetail detail) {
    }

    /**
     * Score every job and return the best ones.
     *
     * @param keywords Keywords to rank by
     * @param limit    Maximum number of results
     * @param minScore Minimum 0-100 score to include
     * @return Mono with recommendations, best first
     */
    public Mono<List<Recommendation>> recommend(List<String> keywords, int limit, int minScore) {
        List<String> normalized = Subscription.normalizeKeywords(keywords);
        if (normalized.isEmpty() || limit <= 0) {
            return Mono.just(List.of());
        }

        Comparator<Recommendation> ranking = Comparator
                .comparingInt((Recommendation r) -> r.detail().score()).reversed()
                .thenComparing(r -> r.job().getCreatedAt(), Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
                .thenComparing(r -> r.job().getId(), Comparator.nullsLast(Comparator.<String>naturalOrder()));

        return jobInventoryStore.listAllJobs()
                .map(job -> new Recommendation(job, profileScorer.score(job, normalized)))
                .filter(r -> r.detail().score() > 0 && r.detail().score() >= minScore)
                .sort(ranking)
                .take(limit)
                .collectList()
                .doOnSuccess(results -> log.info("Recommendations for {}: {} results",
                        normalized, results != null ? results.size() : 0));
    }
}
