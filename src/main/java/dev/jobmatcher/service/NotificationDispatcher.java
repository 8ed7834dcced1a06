package dev.jobmatcher.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobmatcher.config.PushConfig;
import dev.jobmatcher.entity.PushNotification;
import dev.jobmatcher.metrics.MatchingMetrics;
import dev.jobmatcher.model.DeliveryOutcome;
import dev.jobmatcher.model.DeliveryStatus;
import dev.jobmatcher.model.JobPosting;
import dev.jobmatcher.model.NotificationTarget;
import dev.jobmatcher.push.PushPayload;
import dev.jobmatcher.push.PushProvider;
import dev.jobmatcher.push.PushResponse;
import dev.jobmatcher.repository.PushNotificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Sends a push notification per new match and records the delivery outcome.
 * Delivery is best-effort: every failure ends up as a FAILED record, never as an error signal.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationDispatcher {

    static final String NOTIFICATION_TYPE = "job_match";
    private static final int MAX_TITLE_LENGTH = 50;
    private static final int MAX_COMPANY_LENGTH = 30;
    private static final int MAX_KEYWORDS_SHOWN = 3;

    private final PushProvider pushProvider;
    private final PushNotificationRepository pushNotificationRepository;
    private final PushConfig pushConfig;
    private final ObjectMapper objectMapper;
    private final MatchingMetrics metrics;
    private final Clock clock;

    /**
     * Send a job match notification.
     *
     * @param target          Delivery target of the subscriber
     * @param job             The matched job
     * @param matchedKeywords Keywords that matched
     * @param matchId         Ledger id of the match
     * @return Mono with the recorded outcome
     */
    public Mono<DeliveryOutcome> dispatch(NotificationTarget target, JobPosting job,
                                          List<String> matchedKeywords, String matchId) {
        PushPayload payload = buildPayload(job, matchedKeywords, matchId);

        return Mono.fromCallable(() -> storePending(target, payload, matchId))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(record -> pushProvider.send(target, payload)
                        .onErrorResume(e -> Mono.just(PushResponse.rejected("provider_error", e.getMessage())))
                        .defaultIfEmpty(PushResponse.rejected("provider_error", "No response"))
                        .publishOn(Schedulers.boundedElastic())
                        .map(response -> complete(record, response, target)))
                .onErrorResume(e -> {
                    log.error("Failed to dispatch notification for match {}: {}", matchId, e.getMessage());
                    metrics.recordNotification("failed");
                    return Mono.just(DeliveryOutcome.failed(null, "dispatch_error", e.getMessage()));
                });
    }

    /**
     * Create the push payload for a job match.
     */
    PushPayload buildPayload(JobPosting job, List<String> matchedKeywords, String matchId) {
        String title = truncate(job.getTitle() != null ? job.getTitle() : "New Job", MAX_TITLE_LENGTH);
        String company = truncate(job.getCompany() != null ? job.getCompany() : "Unknown Company", MAX_COMPANY_LENGTH);
        String keywordsText = String.join(", ",
                matchedKeywords.subList(0, Math.min(MAX_KEYWORDS_SHOWN, matchedKeywords.size())));

        PushPayload.Aps aps = new PushPayload.Aps(
                new PushPayload.Alert("New Job Match!", title + " at " + company,
                        "Matches your keywords: " + keywordsText),
                1,
                "default",
                "JOB_MATCH",
                "job-matches");

        PushPayload.CustomData customData = new PushPayload.CustomData(
                NOTIFICATION_TYPE,
                matchId,
                job.getId(),
                List.copyOf(matchedKeywords),
                pushConfig.getDeepLinkScheme() + "://job/" + job.getId());

        return new PushPayload(aps, customData);
    }

    private PushNotification storePending(NotificationTarget target, PushPayload payload, String matchId)
            throws JsonProcessingException {
        PushNotification record = PushNotification.builder()
                .matchId(matchId)
                .targetId(target.getTargetId())
                .notificationType(NOTIFICATION_TYPE)
                .payload(objectMapper.writeValueAsString(payload))
                .status(DeliveryStatus.PENDING)
                .createdAt(LocalDateTime.now(clock))
                .build();
        return pushNotificationRepository.save(record);
    }

    private DeliveryOutcome complete(PushNotification record, PushResponse response, NotificationTarget target) {
        DeliveryStatus status = response.delivered() ? DeliveryStatus.SENT : DeliveryStatus.FAILED;
        record.setStatus(status);
        record.setProviderCode(response.providerCode());
        record.setProviderMessage(truncate(response.providerMessage(), 1000));
        record.setSentAt(LocalDateTime.now(clock));
        pushNotificationRepository.save(record);

        boolean retired = response.isUnregistered();
        if (response.delivered()) {
            log.info("Push notification sent to target {} for match {}", target.getTargetId(), record.getMatchId());
            metrics.recordNotification("sent");
        } else if (retired) {
            // Retirement itself belongs to device lifecycle management
            log.warn("Target {} is no longer registered ({} {}), flagging for retirement",
                    target.getTargetId(), response.providerCode(), response.providerMessage());
            metrics.recordNotification("unregistered");
        } else {
            log.warn("Push notification failed for target {}: {} {}",
                    target.getTargetId(), response.providerCode(), response.providerMessage());
            metrics.recordNotification("failed");
        }

        return new DeliveryOutcome(record.getId(), status, response.providerCode(), response.providerMessage(), retired);
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
