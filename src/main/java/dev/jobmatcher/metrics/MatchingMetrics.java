package dev.jobmatcher.metrics;

import dev.jobmatcher.model.MatchPassSummary;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for matching passes and push delivery.
 */
@Component
public class MatchingMetrics {

    private static final String TAG_OUTCOME = "outcome";
    private final MeterRegistry registry;

    // Counters
    private final Counter passesCounter;
    private final Counter passFailuresCounter;
    private final Counter pairsEvaluatedCounter;
    private final Counter matchesCreatedCounter;
    private final Counter duplicatesCounter;
    private final Counter scoringFailuresCounter;
    private final Counter persistenceFailuresCounter;
    private final Counter orphansRemovedCounter;

    private final Timer passTimer;

    // Gauges
    private final AtomicInteger lastRunJobs = new AtomicInteger(0);
    private final AtomicInteger lastRunSubscriptions = new AtomicInteger(0);
    private final AtomicInteger lastRunMatches = new AtomicInteger(0);

    public MatchingMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.passesCounter = Counter.builder("job_matcher_passes_total")
                .description("Total matching passes completed")
                .register(registry);

        this.passFailuresCounter = Counter.builder("job_matcher_pass_failures_total")
                .description("Total matching passes aborted by a fetch failure")
                .register(registry);

        this.pairsEvaluatedCounter = Counter.builder("job_matcher_pairs_evaluated_total")
                .description("Total (job, subscription) pairs evaluated")
                .register(registry);

        this.matchesCreatedCounter = Counter.builder("job_matcher_matches_created_total")
                .description("Total matches written to the ledger")
                .register(registry);

        this.duplicatesCounter = Counter.builder("job_matcher_duplicate_matches_total")
                .description("Total inserts rejected as already present")
                .register(registry);

        this.scoringFailuresCounter = Counter.builder("job_matcher_scoring_failures_total")
                .description("Total pairs skipped because scoring failed")
                .register(registry);

        this.persistenceFailuresCounter = Counter.builder("job_matcher_persistence_failures_total")
                .description("Total pairs skipped because the ledger write failed")
                .register(registry);

        this.orphansRemovedCounter = Counter.builder("job_matcher_orphans_removed_total")
                .description("Total matches removed because their job left the inventory")
                .register(registry);

        this.passTimer = Timer.builder("job_matcher_pass_duration")
                .description("Duration of a matching pass")
                .register(registry);

        Gauge.builder("job_matcher_last_run_jobs", lastRunJobs, AtomicInteger::get)
                .description("Jobs scanned in last pass")
                .register(registry);

        Gauge.builder("job_matcher_last_run_subscriptions", lastRunSubscriptions, AtomicInteger::get)
                .description("Active subscriptions in last pass")
                .register(registry);

        Gauge.builder("job_matcher_last_run_matches", lastRunMatches, AtomicInteger::get)
                .description("Matches created in last pass")
                .register(registry);
    }

    public void recordPairsEvaluated(long count) {
        pairsEvaluatedCounter.increment(count);
    }

    public void recordMatchCreated() {
        matchesCreatedCounter.increment();
    }

    public void recordDuplicate() {
        duplicatesCounter.increment();
    }

    public void recordScoringFailure() {
        scoringFailuresCounter.increment();
    }

    public void recordPersistenceFailure() {
        persistenceFailuresCounter.increment();
    }

    public void recordOrphansRemoved(int count) {
        orphansRemovedCounter.increment(count);
    }

    public void recordNotificationsPurged(int count) {
        Counter.builder("job_matcher_notifications_purged_total")
                .description("Notification records removed by retention")
                .register(registry)
                .increment(count);
    }

    public void recordPassFailure() {
        passFailuresCounter.increment();
    }

    /**
     * Record a push attempt by outcome ("sent", "failed", "unregistered").
     */
    public void recordNotification(String outcome) {
        Counter.builder("job_matcher_notifications_total")
                .description("Push notifications by outcome")
                .tag(TAG_OUTCOME, outcome)
                .register(registry)
                .increment();
    }

    /**
     * Record a completed pass and update last run statistics.
     */
    public void recordPass(MatchPassSummary summary) {
        passesCounter.increment();
        passTimer.record(summary.duration());
        lastRunJobs.set(summary.jobsScanned());
        lastRunSubscriptions.set(summary.subscriptions());
        lastRunMatches.set(summary.matchesCreated());
    }
}
