package com.freelance.jobalerts.pipeline.model;

import java.math.BigDecimal;
import java.time.Instant;

public record JobRecord(
    String source,
    String externalId,
    String title,
    String description,
    String url,
    String proposalUrl,
    BigDecimal budgetMin,
    BigDecimal budgetMax,
    String currency,
    Instant postedAt
) {
    public boolean isAffiliate() {
        return proposalUrl != null && !proposalUrl.isBlank();
    }

    public String preferredUrl() {
        return isAffiliate() ? proposalUrl : url;
    }
}
