package com.freelance.jobalerts.pipeline.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

public final class JobUrlUtils {
    private JobUrlUtils() {
    }

    public static String sanitizeListingUrl(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return null;
        }
        String trimmed = candidate.trim();
        URI uri = safeUri(trimmed);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        String scheme = uri.getScheme();
        if (scheme == null || (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme))) {
            return null;
        }
        return trimmed;
    }

    public static String wrapAffiliate(String prefix, String url) {
        if (prefix == null || prefix.isBlank() || url == null || url.isBlank()) {
            return null;
        }
        return prefix.trim() + URLEncoder.encode(url, StandardCharsets.UTF_8);
    }

    public static String resolve(String baseUrl, String path) {
        if (path == null || path.isBlank()) {
            return null;
        }
        URI base = safeUri(baseUrl);
        if (base == null) {
            return null;
        }
        try {
            return base.resolve(path.trim()).toString();
        } catch (IllegalArgumentException ignored) {
            return null;
        }
    }

    public static URI safeUri(String url) {
        try {
            return new URI(url);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }
}
