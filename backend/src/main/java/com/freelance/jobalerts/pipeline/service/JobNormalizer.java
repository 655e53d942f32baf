package com.freelance.jobalerts.pipeline.service;

import com.freelance.jobalerts.config.AlertsProperties;
import com.freelance.jobalerts.pipeline.model.JobRecord;
import com.freelance.jobalerts.pipeline.model.RawListing;
import com.freelance.jobalerts.pipeline.util.JobUrlUtils;
import com.freelance.jobalerts.pipeline.util.TextUtils;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

@Component
public class JobNormalizer {
    private static final String UNKNOWN_SOURCE = "unknown";
    private static final long EPOCH_MILLIS_THRESHOLD = 100_000_000_000L;

    private final AlertsProperties properties;

    public JobNormalizer(AlertsProperties properties) {
        this.properties = properties;
    }

    /**
     * Maps a raw listing onto the canonical record. Empty when the listing has neither a
     * title nor a usable URL, since such a record can never be delivered.
     */
    public Optional<JobRecord> normalize(RawListing raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String title = TextUtils.collapseWhitespace(raw.title());
        String url = JobUrlUtils.sanitizeListingUrl(raw.url());
        if (title.isEmpty() && url == null) {
            return Optional.empty();
        }

        String source = TextUtils.blankToNull(raw.source());
        source = source == null ? UNKNOWN_SOURCE : source.toLowerCase(Locale.ROOT);

        BigDecimal budgetMin = raw.budgetMin();
        BigDecimal budgetMax = raw.budgetMax();
        if (budgetMin != null && budgetMax != null && budgetMin.compareTo(budgetMax) > 0) {
            BigDecimal swap = budgetMin;
            budgetMin = budgetMax;
            budgetMax = swap;
        }
        String currency = TextUtils.blankToNull(raw.currency());

        return Optional.of(new JobRecord(
            source,
            TextUtils.blankToNull(raw.externalId()),
            title,
            plainText(raw.description()),
            url,
            JobUrlUtils.wrapAffiliate(properties.source(source).getAffiliatePrefix(), url),
            budgetMin,
            budgetMax,
            currency == null ? null : currency.toUpperCase(Locale.ROOT),
            parsePostedAt(raw.postedAt())
        ));
    }

    /**
     * Records without a posting date are never considered stale.
     */
    public boolean isStale(JobRecord job, Instant now) {
        if (job.postedAt() == null) {
            return false;
        }
        Instant cutoff = now.minus(Duration.ofHours(properties.getDelivery().getFreshWindowHours()));
        return job.postedAt().isBefore(cutoff);
    }

    static Instant parsePostedAt(String value) {
        String candidate = TextUtils.blankToNull(value);
        if (candidate == null) {
            return null;
        }
        if (candidate.chars().allMatch(ch -> Character.isDigit(ch) || ch == '.')) {
            try {
                double numeric = Double.parseDouble(candidate);
                long whole = (long) numeric;
                return whole >= EPOCH_MILLIS_THRESHOLD ? Instant.ofEpochMilli(whole) : Instant.ofEpochSecond(whole);
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        try {
            return OffsetDateTime.parse(candidate.replace(" ", "T")).toInstant();
        } catch (DateTimeParseException ignored) {
            // fall through to the next format
        }
        try {
            return LocalDateTime.parse(candidate.replace(" ", "T")).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // fall through to the next format
        }
        try {
            return ZonedDateTime.parse(candidate, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    private String plainText(String description) {
        if (description == null || description.isBlank()) {
            return "";
        }
        return TextUtils.collapseWhitespace(Jsoup.parse(description).text());
    }
}
