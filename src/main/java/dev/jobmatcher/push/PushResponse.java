package dev.jobmatcher.push;

import java.util.Set;

/**
 * Provider answer for a single push.
 *
 * @param delivered       true if the provider accepted the notification
 * @param providerCode    HTTP status or a transport error code
 * @param providerMessage provider reason or id
 */
public record PushResponse(boolean delivered, String providerCode, String providerMessage) {

    private static final Set<String> UNREGISTERED_REASONS = Set.of(
            "BadDeviceToken", "Unregistered", "DeviceTokenNotForTopic", "ExpiredToken");

    public static PushResponse delivered(String providerCode, String providerMessage) {
        return new PushResponse(true, providerCode, providerMessage);
    }

    public static PushResponse rejected(String providerCode, String providerMessage) {
        return new PushResponse(false, providerCode, providerMessage);
    }

    /**
     * True when the provider says the target is no longer registered.
     */
    public boolean isUnregistered() {
        return !delivered && ("410".equals(providerCode)
                || (providerMessage != null && UNREGISTERED_REASONS.contains(providerMessage)));
    }
}
