package dev.jobmatcher.service;

import dev.jobmatcher.config.MatchingConfig;
import dev.jobmatcher.exception.FetchFailureException;
import dev.jobmatcher.metrics.MatchingMetrics;
import dev.jobmatcher.model.DeliveryOutcome;
import dev.jobmatcher.model.InsertOutcome;
import dev.jobmatcher.model.JobPosting;
import dev.jobmatcher.model.LocationFilter;
import dev.jobmatcher.model.MatchPassSummary;
import dev.jobmatcher.model.Subscription;
import dev.jobmatcher.service.KeywordScorer.KeywordScore;
import dev.jobmatcher.store.JobInventoryStore;
import dev.jobmatcher.store.SubscriptionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Runs one matching pass: full inventory against all active subscriptions.
 * Only a {@link FetchFailureException} escapes a pass; every per-pair problem is logged and skipped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MatchingEngine {

    private static final String SEPARATOR = "========================================";

    private final JobInventoryStore jobInventoryStore;
    private final SubscriptionStore subscriptionStore;
    private final KeywordScorer keywordScorer;
    private final MatchLedger matchLedger;
    private final NotificationDispatcher notificationDispatcher;
    private final NotificationRetention notificationRetention;
    private final MatchingMetrics metrics;
    private final MatchingConfig matchingConfig;

    private final AtomicInteger activePasses = new AtomicInteger();
    private final AtomicReference<MatchPassSummary> lastSummary = new AtomicReference<>();

    /**
     * A match written during the scan, waiting for its notification.
     */
    private record CreatedMatch(Subscription subscription, JobPosting job, List<String> matchedKeywords,
                                String matchId) {
    }

    /**
     * Execute one matching pass.
     *
     * @return Mono with the pass summary, or a FetchFailureException if loading failed
     */
    public Mono<MatchPassSummary> process() {
        return Mono.defer(() -> {
            Instant startedAt = Instant.now();
            if (activePasses.incrementAndGet() > 1) {
                log.warn("Another matching pass is in progress - ledger constraints will resolve overlaps");
            }
            log.info(SEPARATOR);
            log.info("Matching Pass Starting");
            log.info(SEPARATOR);

            return loadInventory()
                    .flatMap(jobs -> {
                        if (jobs.isEmpty()) {
                            log.info("No jobs to process");
                            return Mono.just(MatchPassSummary.empty(startedAt, 0, 0));
                        }
                        log.info("Processing {} jobs against subscriptions", jobs.size());
                        return loadSubscriptions().flatMap(subscriptions -> {
                            if (subscriptions.isEmpty()) {
                                log.info("No active subscriptions found");
                                return Mono.just(MatchPassSummary.empty(startedAt, jobs.size(), 0));
                            }
                            log.info("Found {} active subscriptions", subscriptions.size());
                            return scan(jobs, subscriptions, startedAt);
                        });
                    })
                    .flatMap(summary -> Mono.fromRunnable(this::purgeNotificationHistory)
                            .subscribeOn(Schedulers.boundedElastic())
                            .thenReturn(summary))
                    .doOnSuccess(this::completePass)
                    .doOnError(e -> {
                        metrics.recordPassFailure();
                        log.error("Matching pass aborted: {}", e.getMessage(), e);
                    })
                    .doFinally(signal -> activePasses.decrementAndGet());
        });
    }

    private Mono<List<JobPosting>> loadInventory() {
        return jobInventoryStore.listAllJobs()
                .collectList()
                .onErrorMap(e -> !(e instanceof FetchFailureException),
                        e -> new FetchFailureException("Failed to load job inventory: " + e.getMessage(), e));
    }

    private Mono<List<Subscription>> loadSubscriptions() {
        return subscriptionStore.listActiveSubscriptions()
                .collectList()
                .onErrorMap(e -> !(e instanceof FetchFailureException),
                        e -> new FetchFailureException("Failed to load subscriptions: " + e.getMessage(), e));
    }

    private Mono<MatchPassSummary> scan(List<JobPosting> jobs, List<Subscription> subscriptions, Instant startedAt) {
        PassStats stats = new PassStats();
        SubscriptionIndex index = SubscriptionIndex.of(subscriptions);
        int workers = Math.max(1, matchingConfig.getScan().getWorkerThreads());

        return Mono.fromCallable(() -> cleanOrphans(jobs))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(stats.orphansRemoved::set)
                .thenMany(Flux.fromIterable(jobs)
                        .flatMap(job -> Mono.fromCallable(() -> evaluateJob(job, index, stats))
                                .subscribeOn(Schedulers.boundedElastic())
                                .flatMapMany(Flux::fromIterable)
                                .concatMap(created -> dispatch(created, stats)), workers))
                .then(Mono.fromCallable(() -> stats.toSummary(startedAt, jobs.size(), index.size())));
    }

    /**
     * Remove matches for jobs that left the inventory. Failure here does not abort the pass.
     */
    private int cleanOrphans(List<JobPosting> jobs) {
        Set<String> currentIds = jobs.stream()
                .map(JobPosting::getId)
                .collect(Collectors.toSet());
        try {
            return matchLedger.deleteWhereJobNotIn(currentIds);
        } catch (Exception e) {
            log.error("Error cleaning up orphaned matches: {}", e.getMessage(), e);
            return 0;
        }
    }

    /**
     * Retention runs after every successful pass. Failure here does not abort the pass.
     */
    private void purgeNotificationHistory() {
        try {
            notificationRetention.purgeExpired();
        } catch (Exception e) {
            log.error("Error purging notification history: {}", e.getMessage(), e);
        }
    }

    /**
     * Evaluate one job against every candidate subscription.
     *
     * @return Matches created for this job
     */
    private List<CreatedMatch> evaluateJob(JobPosting job, SubscriptionIndex index, PassStats stats) {
        List<CreatedMatch> created = new ArrayList<>();
        Set<String> matchedSubscribers = new HashSet<>();
        int progressInterval = Math.max(1, matchingConfig.getScan().getProgressLogInterval());

        for (Subscription subscription : index.candidatesFor(job.getSource())) {
            long evaluated = stats.pairsEvaluated.incrementAndGet();
            if (evaluated % progressInterval == 0) {
                log.info("Evaluated {} pairs, created {} matches", evaluated, stats.matchesCreated.get());
            }

            String subscriberId = subscription.getSubscriberId();
            if (matchedSubscribers.contains(subscriberId)) {
                continue;
            }
            if (!passesLocationFilter(job, subscription.getLocationFilter())) {
                continue;
            }
            if (alreadyMatched(subscriberId, job.getId())) {
                continue;
            }

            KeywordScore score;
            try {
                score = keywordScorer.score(job, subscription.getKeywords());
            } catch (Exception e) {
                stats.scoringFailures.incrementAndGet();
                metrics.recordScoringFailure();
                log.warn("Skipping job {} for subscription {}: scoring failed: {}",
                        job.getId(), subscription.getSubscriptionId(), e.getMessage());
                continue;
            }

            if (!score.accepted()) {
                continue;
            }

            InsertOutcome outcome = persist(subscriberId, job, score);
            if (outcome.isCreated()) {
                stats.matchesCreated.incrementAndGet();
                metrics.recordMatchCreated();
                matchedSubscribers.add(subscriberId);
                created.add(new CreatedMatch(subscription, job, score.matchedKeywords(), outcome.matchId()));
                log.info("Match created: job {} -> subscriber {} (score: {})",
                        job.getId(), subscriberId, String.format("%.2f", score.relevance()));
            } else if (outcome.status() == InsertOutcome.Status.ALREADY_EXISTS) {
                stats.duplicates.incrementAndGet();
                metrics.recordDuplicate();
                matchedSubscribers.add(subscriberId);
                log.debug("Match for job {} and subscriber {} already recorded", job.getId(), subscriberId);
            } else {
                stats.persistenceFailures.incrementAndGet();
                metrics.recordPersistenceFailure();
                log.error("Error storing match for job {} and subscriber {}: {}",
                        job.getId(), subscriberId, outcome.reason());
            }
        }
        return created;
    }

    /**
     * The insert decides duplicates, so a failed lookup only means the insert has to.
     */
    private boolean alreadyMatched(String subscriberId, String jobId) {
        try {
            return matchLedger.exists(subscriberId, jobId);
        } catch (Exception e) {
            log.warn("Error checking existing match for job {} and subscriber {}: {}",
                    jobId, subscriberId, e.getMessage());
            return false;
        }
    }

    private InsertOutcome persist(String subscriberId, JobPosting job, KeywordScore score) {
        try {
            return matchLedger.insert(subscriberId, job.getId(), score.matchedKeywords(), score.relevance());
        } catch (Exception e) {
            return InsertOutcome.failed(e.getMessage());
        }
    }

    /**
     * Location preferences are recorded but not enforced yet: every job passes.
     */
    boolean passesLocationFilter(JobPosting job, LocationFilter locationFilter) {
        return true;
    }

    private Mono<DeliveryOutcome> dispatch(CreatedMatch created, PassStats stats) {
        return Mono.defer(() -> notificationDispatcher.dispatch(
                        created.subscription().getTarget(), created.job(), created.matchedKeywords(), created.matchId()))
                .doOnNext(outcome -> {
                    if (outcome.isSent()) {
                        stats.notificationsSent.incrementAndGet();
                    } else {
                        stats.notificationsFailed.incrementAndGet();
                    }
                })
                .onErrorResume(e -> {
                    stats.notificationsFailed.incrementAndGet();
                    log.error("Notification for match {} failed: {}", created.matchId(), e.getMessage());
                    return Mono.empty();
                });
    }

    private void completePass(MatchPassSummary summary) {
        if (summary == null) {
            return;
        }
        lastSummary.set(summary);
        metrics.recordPairsEvaluated(summary.pairsEvaluated());
        metrics.recordOrphansRemoved(summary.orphansRemoved());
        metrics.recordPass(summary);

        log.info(SEPARATOR);
        log.info("PASS SUMMARY: {} jobs x {} subscriptions, {} pairs evaluated",
                summary.jobsScanned(), summary.subscriptions(), summary.pairsEvaluated());
        log.info("Matches created: {}, duplicates: {}, orphans removed: {}",
                summary.matchesCreated(), summary.duplicates(), summary.orphansRemoved());
        log.info("Notifications sent: {}, failed: {}", summary.notificationsSent(), summary.notificationsFailed());
        if (summary.scoringFailures() > 0 || summary.persistenceFailures() > 0) {
            log.warn("Skipped pairs: {} scoring failures, {} persistence failures",
                    summary.scoringFailures(), summary.persistenceFailures());
        }
        log.info("Completed in {} ms", summary.duration().toMillis());
        log.info(SEPARATOR);
    }

    /**
     * Summary of the most recent successful pass.
     */
    public Optional<MatchPassSummary> getLastSummary() {
        return Optional.ofNullable(lastSummary.get());
    }

    public boolean isPassRunning() {
        return activePasses.get() > 0;
    }

    private static final class PassStats {
        private final AtomicLong pairsEvaluated = new AtomicLong();
        private final AtomicInteger matchesCreated = new AtomicInteger();
        private final AtomicInteger duplicates = new AtomicInteger();
        private final AtomicInteger scoringFailures = new AtomicInteger();
        private final AtomicInteger persistenceFailures = new AtomicInteger();
        private final AtomicInteger notificationsSent = new AtomicInteger();
        private final AtomicInteger notificationsFailed = new AtomicInteger();
        private final AtomicInteger orphansRemoved = new AtomicInteger();

        MatchPassSummary toSummary(Instant startedAt, int jobs, int subscriptions) {
            return new MatchPassSummary(
                    startedAt,
                    Duration.between(startedAt, Instant.now()),
                    jobs,
                    subscriptions,
                    pairsEvaluated.get(),
                    matchesCreated.get(),
                    duplicates.get(),
                    scoringFailures.get(),
                    persistenceFailures.get(),
                    notificationsSent.get(),
                    notificationsFailed.get(),
                    orphansRemoved.get());
        }
    }
}
