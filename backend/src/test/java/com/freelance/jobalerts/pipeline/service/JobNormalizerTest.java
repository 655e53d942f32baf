package com.freelance.jobalerts.pipeline.service;

import com.freelance.jobalerts.config.AlertsProperties;
import com.freelance.jobalerts.pipeline.model.JobRecord;
import com.freelance.jobalerts.pipeline.model.RawListing;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class JobNormalizerTest {

    @Test
    void dropsListingsWithoutTitleAndUrl() {
        JobNormalizer normalizer = new JobNormalizer(new AlertsProperties());

        assertThat(normalizer.normalize(raw("  ", "not a url", null))).isEmpty();
        assertThat(normalizer.normalize(raw(null, "ftp://x/1", null))).isEmpty();
        assertThat(normalizer.normalize(raw("Logo design", null, null))).isPresent();
    }

    @Test
    void stripsHtmlAndNormalizesFields() {
        JobNormalizer normalizer = new JobNormalizer(new AlertsProperties());
        RawListing raw = new RawListing(
            "Freelancer",
            " 77 ",
            "  Logo   design ",
            "<p>Need a <b>logo</b></p>\n<p>asap</p>",
            "https://x/1",
            new BigDecimal("250"),
            new BigDecimal("100"),
            "usd",
            "1735725600"
        );

        JobRecord job = normalizer.normalize(raw).orElseThrow();

        assertThat(job.source()).isEqualTo("freelancer");
        assertThat(job.externalId()).isEqualTo("77");
        assertThat(job.title()).isEqualTo("Logo design");
        assertThat(job.description()).isEqualTo("Need a logo asap");
        assertThat(job.budgetMin()).isEqualByComparingTo("100");
        assertThat(job.budgetMax()).isEqualByComparingTo("250");
        assertThat(job.currency()).isEqualTo("USD");
        assertThat(job.postedAt()).isEqualTo(Instant.parse("2025-01-01T10:00:00Z"));
        assertThat(job.isAffiliate()).isFalse();
        assertThat(job.preferredUrl()).isEqualTo("https://x/1");
    }

    @Test
    void wrapsUrlWithConfiguredAffiliatePrefix() {
        AlertsProperties properties = new AlertsProperties();
        AlertsProperties.Source source = new AlertsProperties.Source();
        source.setAffiliatePrefix("https://aff.example/track?u=");
        properties.getSources().put("freelancer", source);
        JobNormalizer normalizer = new JobNormalizer(properties);

        JobRecord job = normalizer.normalize(raw("Logo design", "https://x/1?a=b", null)).orElseThrow();

        assertThat(job.isAffiliate()).isTrue();
        assertThat(job.proposalUrl()).isEqualTo("https://aff.example/track?u=https%3A%2F%2Fx%2F1%3Fa%3Db");
        assertThat(job.preferredUrl()).isEqualTo(job.proposalUrl());
    }

    @Test
    void staleWindowUsesPostedAt() {
        AlertsProperties properties = new AlertsProperties();
        properties.getDelivery().setFreshWindowHours(48);
        JobNormalizer normalizer = new JobNormalizer(properties);
        Instant now = Instant.parse("2025-03-10T12:00:00Z");

        JobRecord old = withPostedAt(now.minus(Duration.ofHours(49)));
        JobRecord recent = withPostedAt(now.minus(Duration.ofHours(2)));
        JobRecord undated = withPostedAt(null);

        assertThat(normalizer.isStale(old, now)).isTrue();
        assertThat(normalizer.isStale(recent, now)).isFalse();
        assertThat(normalizer.isStale(undated, now)).isFalse();
    }

    @Test
    void parsesCommonDateFormats() {
        Instant expected = Instant.parse("2025-01-01T10:00:00Z");

        assertThat(JobNormalizer.parsePostedAt("1735725600")).isEqualTo(expected);
        assertThat(JobNormalizer.parsePostedAt("1735725600000")).isEqualTo(expected);
        assertThat(JobNormalizer.parsePostedAt("2025-01-01T10:00:00Z")).isEqualTo(expected);
        assertThat(JobNormalizer.parsePostedAt("2025-01-01T12:00:00+02:00")).isEqualTo(expected);
        assertThat(JobNormalizer.parsePostedAt("2025-01-01 10:00:00")).isEqualTo(expected);
        assertThat(JobNormalizer.parsePostedAt("Wed, 01 Jan 2025 10:00:00 GMT")).isEqualTo(expected);
        assertThat(JobNormalizer.parsePostedAt("yesterday")).isNull();
        assertThat(JobNormalizer.parsePostedAt(" ")).isNull();
    }

    private RawListing raw(String title, String url, String postedAt) {
        return new RawListing("freelancer", null, title, null, url, null, null, null, postedAt);
    }

    private JobRecord withPostedAt(Instant postedAt) {
        return new JobRecord("freelancer", null, "Logo design", "", "https://x/1", null, null, null, null, postedAt);
    }
}
