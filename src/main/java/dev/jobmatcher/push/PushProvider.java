package dev.jobmatcher.push;

import dev.jobmatcher.model.NotificationTarget;
import reactor.core.publisher.Mono;

/**
 * Interface for push delivery providers.
 * Provider-side failures are returned as data, never as error signals.
 */
public interface PushProvider {

    /**
     * Get the name of this provider (e.g., "apns", "log").
     */
    String getName();

    /**
     * Deliver a payload to a single target.
     *
     * @param target  The device to notify
     * @param payload The provider payload
     * @return Mono with the provider's answer
     */
    Mono<PushResponse> send(NotificationTarget target, PushPayload payload);
}
