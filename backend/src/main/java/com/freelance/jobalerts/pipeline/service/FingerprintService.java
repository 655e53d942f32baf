package com.freelance.jobalerts.pipeline.service;

import com.freelance.jobalerts.pipeline.model.JobRecord;
import com.freelance.jobalerts.pipeline.util.TextUtils;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 over {@code normalizedTitle | source | identity}, hex encoded.
 *
 * <p>Identity is the listing URL. When a record has no URL it falls back to
 * {@code id:<externalId>}, and when that is missing too, to {@code title:<raw title>}.
 * The prefixes keep a fallback identity from ever colliding with a real URL, but they also
 * mean a listing that later gains a URL gets a new fingerprint and may be delivered again.
 */
@Component
public class FingerprintService {
    static final char SEPARATOR = '\u001F';

    public String fingerprint(JobRecord job) {
        String payload = TextUtils.normalizeTitle(job.title())
            + SEPARATOR
            + (job.source() == null ? "" : job.source())
            + SEPARATOR
            + identity(job);
        return sha256Hex(payload);
    }

    /**
     * Listing identity without the source. Two sources syndicating the same posting share it.
     */
    public String listingIdentity(JobRecord job) {
        return TextUtils.normalizeTitle(job.title()) + SEPARATOR + identity(job);
    }

    private String identity(JobRecord job) {
        if (job.url() != null && !job.url().isBlank()) {
            return job.url().trim();
        }
        if (job.externalId() != null && !job.externalId().isBlank()) {
            return "id:" + job.externalId().trim();
        }
        return "title:" + (job.title() == null ? "" : job.title());
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder out = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                out.append(String.format("%02x", b));
            }
            return out.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
