package com.freelance.jobalerts.pipeline.model;

public record FingerprintedJob(
    JobRecord job,
    String fingerprint
) {
}
