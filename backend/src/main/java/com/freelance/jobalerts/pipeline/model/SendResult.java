package com.freelance.jobalerts.pipeline.model;

public record SendResult(
    Status status,
    Integer retryAfterSeconds,
    String reason
) {
    public enum Status {
        OK,
        RATE_LIMITED,
        TRANSIENT_FAILURE,
        PERMANENT_FAILURE,
        RECIPIENT_UNREACHABLE
    }

    public static SendResult ok() {
        return new SendResult(Status.OK, null, null);
    }

    public static SendResult rateLimited(int retryAfterSeconds) {
        return new SendResult(Status.RATE_LIMITED, Math.max(0, retryAfterSeconds), "rate_limited");
    }

    public static SendResult transientFailure(String reason) {
        return new SendResult(Status.TRANSIENT_FAILURE, null, reason);
    }

    public static SendResult permanentFailure(String reason) {
        return new SendResult(Status.PERMANENT_FAILURE, null, reason);
    }

    public static SendResult recipientUnreachable(String reason) {
        return new SendResult(Status.RECIPIENT_UNREACHABLE, null, reason);
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
