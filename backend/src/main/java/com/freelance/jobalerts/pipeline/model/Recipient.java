package com.freelance.jobalerts.pipeline.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

public record Recipient(
    long id,
    Set<String> keywords,
    boolean active,
    boolean blocked,
    Instant accessExpiresAt
) {
    public Recipient {
        keywords = normalizeKeywords(keywords);
    }

    public boolean isEligible(Instant now) {
        if (!active || blocked) {
            return false;
        }
        return accessExpiresAt == null || accessExpiresAt.isAfter(now);
    }

    public static Set<String> normalizeKeywords(Collection<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return Set.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String keyword : raw) {
            if (keyword == null) {
                continue;
            }
            String value = keyword.trim().toLowerCase(Locale.ROOT);
            if (!value.isEmpty()) {
                normalized.add(value);
            }
        }
        return Collections.unmodifiableSet(normalized);
    }
}
