package com.freelance.jobalerts.pipeline.model;

public enum CycleState {
    IDLE,
    FETCHING,
    NORMALIZING,
    FILTERING,
    NOTIFYING,
    PUBLISHING
}
