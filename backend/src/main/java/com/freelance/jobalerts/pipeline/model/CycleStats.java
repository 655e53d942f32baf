package com.freelance.jobalerts.pipeline.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record CycleStats(
    @JsonProperty("status") CycleOutcome status,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("cycle_seconds") double cycleSeconds,
    @JsonProperty("sent_this_cycle") int sentThisCycle,
    @JsonProperty("feeds") Map<String, FeedStats> feeds,
    @JsonProperty("normalization_dropped") int normalizationDropped,
    @JsonProperty("stale_dropped") int staleDropped,
    @JsonProperty("duplicates_collapsed") int duplicatesCollapsed,
    @JsonProperty("already_sent") int alreadySent,
    @JsonProperty("failed_deliveries") int failedDeliveries,
    @JsonProperty("mark_conflicts") int markConflicts,
    @JsonProperty("abort_reason") String abortReason
) {
}
