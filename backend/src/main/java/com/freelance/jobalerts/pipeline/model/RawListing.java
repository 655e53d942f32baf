package com.freelance.jobalerts.pipeline.model;

import java.math.BigDecimal;

public record RawListing(
    String source,
    String externalId,
    String title,
    String description,
    String url,
    BigDecimal budgetMin,
    BigDecimal budgetMax,
    String currency,
    String postedAt
) {
}
