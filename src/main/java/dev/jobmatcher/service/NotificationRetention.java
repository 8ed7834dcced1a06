package dev.jobmatcher.service;

import dev.jobmatcher.config.PushConfig;
import dev.jobmatcher.metrics.MatchingMetrics;
import dev.jobmatcher.repository.PushNotificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Deletes notification records older than the configured retention.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationRetention {

    private final PushNotificationRepository pushNotificationRepository;
    private final PushConfig pushConfig;
    private final MatchingMetrics metrics;
    private final Clock clock;

    /**
     * @return Number of records deleted
     */
    public int purgeExpired() {
        Duration retention = pushConfig.getNotificationRetention();
        if (retention == null || retention.isZero() || retention.isNegative()) {
            return 0;
        }

        LocalDateTime cutoff = LocalDateTime.now(clock).minus(retention);
        int deleted = pushNotificationRepository.deleteCreatedBefore(cutoff);
        if (deleted > 0) {
            metrics.recordNotificationsPurged(deleted);
            log.info("Purged {} notification records created before {}", deleted, cutoff);
        }
        return deleted;
    }
}
