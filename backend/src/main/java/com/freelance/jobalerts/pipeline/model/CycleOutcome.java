package com.freelance.jobalerts.pipeline.model;

public enum CycleOutcome {
    COMPLETED,
    ABORTED,
    SKIPPED
}
