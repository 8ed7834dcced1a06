package dev.jobmatcher.push;

import dev.jobmatcher.model.NotificationTarget;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Development provider that only logs what would be sent.
 * Used when no real push provider is configured.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "push.provider", havingValue = "log", matchIfMissing = true)
public class LoggingPushProvider implements PushProvider {

    public LoggingPushProvider() {
        log.info("Push delivery disabled - using logging provider");
    }

    @Override
    public String getName() {
        return "log";
    }

    @Override
    public Mono<PushResponse> send(NotificationTarget target, PushPayload payload) {
        log.info("Mock push to target {}: {}", target.getTargetId(), payload.aps().alert().subtitle());
        return Mono.just(PushResponse.delivered("mock", UUID.randomUUID().toString()));
    }
}
