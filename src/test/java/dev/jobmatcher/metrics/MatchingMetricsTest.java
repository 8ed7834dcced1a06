package dev.jobmatcher.metrics;

import dev.jobmatcher.model.MatchPassSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class MatchingMetricsTest {

    private MeterRegistry meterRegistry;
    private MatchingMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new MatchingMetrics(meterRegistry);
    }

    @Nested
    @DisplayName("Pair counters")
    class PairCounterTests {

        @Test
        @DisplayName("Should record evaluated pairs")
        void shouldRecordPairsEvaluated() {
            metrics.recordPairsEvaluated(1500);

            assertThat(meterRegistry.counter("job_matcher_pairs_evaluated_total").count()).isEqualTo(1500.0);
        }

        @Test
        @DisplayName("Should record created matches and duplicates separately")
        void shouldRecordMatchesAndDuplicates() {
            metrics.recordMatchCreated();
            metrics.recordMatchCreated();
            metrics.recordDuplicate();

            assertThat(meterRegistry.counter("job_matcher_matches_created_total").count()).isEqualTo(2.0);
            assertThat(meterRegistry.counter("job_matcher_duplicate_matches_total").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should record skipped pairs by cause")
        void shouldRecordFailures() {
            metrics.recordScoringFailure();
            metrics.recordPersistenceFailure();
            metrics.recordPersistenceFailure();

            assertThat(meterRegistry.counter("job_matcher_scoring_failures_total").count()).isEqualTo(1.0);
            assertThat(meterRegistry.counter("job_matcher_persistence_failures_total").count()).isEqualTo(2.0);
        }
    }

    @Nested
    @DisplayName("Notifications")
    class NotificationTests {

        @Test
        @DisplayName("Should tag notifications by outcome")
        void shouldTagByOutcome() {
            metrics.recordNotification("sent");
            metrics.recordNotification("sent");
            metrics.recordNotification("unregistered");

            assertThat(meterRegistry.counter("job_matcher_notifications_total", "outcome", "sent").count())
                    .isEqualTo(2.0);
            assertThat(meterRegistry.counter("job_matcher_notifications_total", "outcome", "unregistered").count())
                    .isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Pass results")
    class PassTests {

        @Test
        @DisplayName("Should update last run gauges and the pass timer")
        void shouldRecordPass() {
            MatchPassSummary summary = new MatchPassSummary(Instant.now(), Duration.ofSeconds(3),
                    120, 8, 960, 5, 1, 0, 0, 5, 0, 2);

            metrics.recordPass(summary);
            metrics.recordOrphansRemoved(summary.orphansRemoved());

            assertThat(meterRegistry.counter("job_matcher_passes_total").count()).isEqualTo(1.0);
            assertThat(meterRegistry.get("job_matcher_last_run_jobs").gauge().value()).isEqualTo(120.0);
            assertThat(meterRegistry.get("job_matcher_last_run_subscriptions").gauge().value()).isEqualTo(8.0);
            assertThat(meterRegistry.get("job_matcher_last_run_matches").gauge().value()).isEqualTo(5.0);
            assertThat(meterRegistry.timer("job_matcher_pass_duration").count()).isEqualTo(1);
            assertThat(meterRegistry.counter("job_matcher_orphans_removed_total").count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("Should count aborted passes")
        void shouldRecordPassFailure() {
            metrics.recordPassFailure();

            assertThat(meterRegistry.counter("job_matcher_pass_failures_total").count()).isEqualTo(1.0);
        }
    }
}
