package com.freelance.jobalerts.pipeline.model;

/**
 * Granularity of the sent-job key.
 *
 * <p>{@code GLOBAL} suppresses a job for every recipient once any recipient received it.
 * {@code RECIPIENT} tracks each recipient separately, so new subscribers still get jobs
 * other people already saw.
 */
public enum KeyScope {
    RECIPIENT,
    GLOBAL;

    public String key(long recipientId, String fingerprint) {
        if (this == GLOBAL) {
            return fingerprint;
        }
        return recipientId + ":" + fingerprint;
    }
}
