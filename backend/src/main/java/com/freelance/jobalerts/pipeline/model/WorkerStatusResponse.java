package com.freelance.jobalerts.pipeline.model;

public record WorkerStatusResponse(
    boolean running,
    CycleState state,
    CycleStats lastCycle
) {
}
