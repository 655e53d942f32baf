package com.freelance.jobalerts.pipeline.notify;

import com.freelance.jobalerts.config.AlertsProperties;
import com.freelance.jobalerts.pipeline.model.ActionLink;
import com.freelance.jobalerts.pipeline.model.JobRecord;
import com.freelance.jobalerts.pipeline.model.KeywordMatch;
import com.freelance.jobalerts.pipeline.model.OutboundMessage;
import com.freelance.jobalerts.pipeline.util.TextUtils;
import org.jsoup.nodes.Entities;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Component
public class JobMessageFormatter {
    static final String VIEW_JOB_LABEL = "View Job";
    static final String ORIGINAL_LABEL = "Original";

    private final AlertsProperties properties;

    public JobMessageFormatter(AlertsProperties properties) {
        this.properties = properties;
    }

    public OutboundMessage format(JobRecord job, KeywordMatch match, Instant now) {
        StringBuilder text = new StringBuilder();
        String title = TextUtils.truncate(job.title(), properties.getDelivery().getTitleMaxChars());
        text.append("<b>").append(escape(title)).append("</b>\n");
        text.append("<b>Budget:</b> ").append(escape(formatBudget(job))).append('\n');
        text.append("<b>Source:</b> ").append(escape(job.source())).append('\n');
        if (match != null && match.firstKeyword() != null) {
            text.append("<b>Keyword:</b> ").append(escape(match.firstKeyword())).append('\n');
        }
        String posted = relativeTime(job.postedAt(), now);
        if (posted != null) {
            text.append("<b>Posted:</b> ").append(posted).append('\n');
        }
        String description = TextUtils.truncate(job.description(), properties.getDelivery().getDescriptionMaxChars());
        if (!description.isEmpty()) {
            text.append('\n').append(escape(description));
        }
        return new OutboundMessage(text.toString().stripTrailing(), links(job));
    }

    static String formatBudget(JobRecord job) {
        BigDecimal min = job.budgetMin();
        BigDecimal max = job.budgetMax();
        String amount;
        if (min != null && max != null && min.compareTo(max) != 0) {
            amount = plain(min) + "–" + plain(max);
        } else if (min != null || max != null) {
            amount = plain(min != null ? min : max);
        } else {
            return "Not specified";
        }
        return job.currency() == null ? amount : amount + " " + job.currency();
    }

    static String relativeTime(Instant postedAt, Instant now) {
        if (postedAt == null || now == null) {
            return null;
        }
        long minutes = Math.max(0, Duration.between(postedAt, now).toMinutes());
        if (minutes < 1) {
            return "just now";
        }
        if (minutes < 60) {
            return plural(minutes, "minute") + " ago";
        }
        long hours = minutes / 60;
        if (hours < 24) {
            return plural(hours, "hour") + " ago";
        }
        return plural(hours / 24, "day") + " ago";
    }

    private List<ActionLink> links(JobRecord job) {
        List<ActionLink> links = new ArrayList<>();
        String preferred = job.preferredUrl();
        if (preferred != null) {
            links.add(new ActionLink(VIEW_JOB_LABEL, preferred));
        }
        if (job.url() != null && !job.url().equals(preferred)) {
            links.add(new ActionLink(ORIGINAL_LABEL, job.url()));
        }
        return links;
    }

    private static String plural(long value, String unit) {
        return value + " " + unit + (value == 1 ? "" : "s");
    }

    private static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }

    private static String escape(String value) {
        return value == null ? "" : Entities.escape(value);
    }
}
