package dev.jobmatcher.model;

/**
 * Outcome of a single push attempt as recorded on its notification record.
 *
 * @param targetRetired true when the provider reported the target as no longer registered
 */
public record DeliveryOutcome(
        String notificationId,
        DeliveryStatus status,
        String providerCode,
        String providerMessage,
        boolean targetRetired) {

    public boolean isSent() {
        return status == DeliveryStatus.SENT;
    }

    public static DeliveryOutcome failed(String notificationId, String providerCode, String providerMessage) {
        return new DeliveryOutcome(notificationId, DeliveryStatus.FAILED, providerCode, providerMessage, false);
    }
}
