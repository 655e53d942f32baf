package com.freelance.jobalerts.pipeline.http;

import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    int statusCode,
    String body,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public String failureCode() {
        if (errorCode != null) {
            return errorCode;
        }
        return "http_" + statusCode;
    }
}
