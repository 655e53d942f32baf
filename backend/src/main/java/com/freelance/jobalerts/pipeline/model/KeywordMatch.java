package com.freelance.jobalerts.pipeline.model;

public record KeywordMatch(
    boolean matched,
    String firstKeyword,
    int hits
) {
    public static final KeywordMatch NONE = new KeywordMatch(false, null, 0);
}
