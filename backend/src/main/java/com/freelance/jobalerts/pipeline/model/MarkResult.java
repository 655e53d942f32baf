package com.freelance.jobalerts.pipeline.model;

public enum MarkResult {
    FRESH,
    ALREADY_EXISTS
}
