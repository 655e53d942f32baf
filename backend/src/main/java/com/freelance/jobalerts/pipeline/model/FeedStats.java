package com.freelance.jobalerts.pipeline.model;

public record FeedStats(
    int count,
    String error
) {
}
