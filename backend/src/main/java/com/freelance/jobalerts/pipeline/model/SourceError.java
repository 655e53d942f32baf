package com.freelance.jobalerts.pipeline.model;

public record SourceError(
    String code,
    String message
) {
    public String describe() {
        if (message == null || message.isBlank()) {
            return code;
        }
        return code + ": " + message;
    }
}
