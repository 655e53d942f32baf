package com.freelance.jobalerts.pipeline.model;

/**
 * Outcome of one delivery. {@code skipRecipient} is set when the recipient itself cannot be
 * reached this cycle; a rejected message leaves the recipient open for its other jobs.
 */
public record DeliveryResult(
    boolean delivered,
    String reason,
    int attempts,
    boolean skipRecipient
) {
    public static DeliveryResult delivered(int attempts) {
        return new DeliveryResult(true, null, attempts, false);
    }

    public static DeliveryResult failed(String reason, int attempts) {
        return new DeliveryResult(false, reason, attempts, true);
    }

    public static DeliveryResult rejected(String reason, int attempts) {
        return new DeliveryResult(false, reason, attempts, false);
    }
}
