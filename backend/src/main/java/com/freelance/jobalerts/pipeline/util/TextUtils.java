package com.freelance.jobalerts.pipeline.util;

import java.util.Locale;
import java.util.regex.Pattern;

public final class TextUtils {
    public static final String TRUNCATION_MARKER = "…";

    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");

    private TextUtils() {
    }

    public static String collapseWhitespace(String value) {
        if (value == null) {
            return "";
        }
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }

    /**
     * Lowercase, trim and collapse internal whitespace. Used for both fingerprinting and
     * in-cycle duplicate collapsing, so both agree on what "the same title" means.
     */
    public static String normalizeTitle(String title) {
        return collapseWhitespace(title).toLowerCase(Locale.ROOT);
    }

    public static String truncate(String value, int maxChars) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        if (trimmed.length() <= maxChars) {
            return trimmed;
        }
        int cut = Math.max(0, maxChars - TRUNCATION_MARKER.length());
        return trimmed.substring(0, cut).stripTrailing() + TRUNCATION_MARKER;
    }

    public static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static String firstNonBlank(String... values) {
        if (values == null) {
            return null;
        }
        for (String value : values) {
            String candidate = blankToNull(value);
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }
}
