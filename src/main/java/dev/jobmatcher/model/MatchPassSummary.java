package dev.jobmatcher.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Counters collected over one matching pass.
 */
public record MatchPassSummary(
        Instant startedAt,
        Duration duration,
        int jobsScanned,
        int subscriptions,
        long pairsEvaluated,
        int matchesCreated,
        int duplicates,
        int scoringFailures,
        int persistenceFailures,
        int notificationsSent,
        int notificationsFailed,
        int orphansRemoved) {

    public static MatchPassSummary empty(Instant startedAt, int jobsScanned, int subscriptions) {
        return new MatchPassSummary(startedAt, Duration.between(startedAt, Instant.now()),
                jobsScanned, subscriptions, 0, 0, 0, 0, 0, 0, 0, 0);
    }
}
