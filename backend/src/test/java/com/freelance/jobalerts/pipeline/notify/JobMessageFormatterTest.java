package com.freelance.jobalerts.pipeline.notify;

import com.freelance.jobalerts.config.AlertsProperties;
import com.freelance.jobalerts.pipeline.model.ActionLink;
import com.freelance.jobalerts.pipeline.model.JobRecord;
import com.freelance.jobalerts.pipeline.model.KeywordMatch;
import com.freelance.jobalerts.pipeline.model.OutboundMessage;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class JobMessageFormatterTest {
    private static final Instant NOW = Instant.parse("2025-03-10T12:00:00Z");

    private final JobMessageFormatter formatter = new JobMessageFormatter(new AlertsProperties());

    @Test
    void rendersEscapedSummaryLines() {
        JobRecord job = job("Fix <div> & CSS", "short text", null, new BigDecimal("100"), new BigDecimal("250.00"));

        OutboundMessage message = formatter.format(job, new KeywordMatch(true, "css", 1), NOW);

        assertThat(message.text())
            .contains("<b>Fix &lt;div&gt; &amp; CSS</b>")
            .contains("100–250 USD")
            .contains("<b>Source:</b> freelancer")
            .contains("<b>Keyword:</b> css")
            .contains("<b>Posted:</b> 5 minutes ago")
            .endsWith("short text");
    }

    @Test
    void truncatesLongDescriptionWithMarker() {
        JobRecord job = job("Logo design", "a".repeat(500), null, null, null);

        OutboundMessage message = formatter.format(job, KeywordMatch.NONE, NOW);

        assertThat(message.text()).contains("a".repeat(399) + "…");
        assertThat(message.text()).doesNotContain("a".repeat(400));
    }

    @Test
    void truncatesLongTitle() {
        JobRecord job = job("T".repeat(5000), "short text", null, null, null);

        OutboundMessage message = formatter.format(job, KeywordMatch.NONE, NOW);

        assertThat(message.text()).startsWith("<b>" + "T".repeat(199) + "…</b>");
        assertThat(message.text().length()).isLessThan(4096);
    }

    @Test
    void affiliateJobGetsBothLinks() {
        JobRecord affiliate = job("Logo design", "", "https://aff.example/?u=1", null, null);
        JobRecord plain = job("Logo design", "", null, null, null);

        assertThat(formatter.format(affiliate, KeywordMatch.NONE, NOW).links()).containsExactly(
            new ActionLink("View Job", "https://aff.example/?u=1"),
            new ActionLink("Original", "https://x/1")
        );
        assertThat(formatter.format(plain, KeywordMatch.NONE, NOW).links()).containsExactly(
            new ActionLink("View Job", "https://x/1")
        );
    }

    @Test
    void budgetVariants() {
        assertThat(JobMessageFormatter.formatBudget(job("t", "", null, new BigDecimal("100"), null))).isEqualTo("100 USD");
        assertThat(JobMessageFormatter.formatBudget(job("t", "", null, new BigDecimal("50"), new BigDecimal("50.0")))).isEqualTo("50 USD");
        assertThat(JobMessageFormatter.formatBudget(job("t", "", null, null, null))).isEqualTo("Not specified");
    }

    @Test
    void relativeTimeVariants() {
        assertThat(JobMessageFormatter.relativeTime(NOW.minusSeconds(20), NOW)).isEqualTo("just now");
        assertThat(JobMessageFormatter.relativeTime(NOW.minus(Duration.ofMinutes(1)), NOW)).isEqualTo("1 minute ago");
        assertThat(JobMessageFormatter.relativeTime(NOW.minus(Duration.ofHours(3)), NOW)).isEqualTo("3 hours ago");
        assertThat(JobMessageFormatter.relativeTime(NOW.minus(Duration.ofDays(2)), NOW)).isEqualTo("2 days ago");
        assertThat(JobMessageFormatter.relativeTime(null, NOW)).isNull();
    }

    private JobRecord job(String title, String description, String proposalUrl, BigDecimal min, BigDecimal max) {
        return new JobRecord(
            "freelancer",
            "1",
            title,
            description,
            "https://x/1",
            proposalUrl,
            min,
            max,
            "USD",
            NOW.minus(Duration.ofMinutes(5))
        );
    }
}
