package com.freelance.jobalerts.pipeline.model;

public record ActionLink(
    String label,
    String url
) {
}
