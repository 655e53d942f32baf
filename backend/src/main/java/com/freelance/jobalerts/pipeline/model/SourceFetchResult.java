package com.freelance.jobalerts.pipeline.model;

import java.util.List;

public record SourceFetchResult(
    String sourceId,
    List<RawListing> listings,
    SourceError error
) {
    public SourceFetchResult {
        listings = listings == null ? List.of() : List.copyOf(listings);
    }

    public static SourceFetchResult success(String sourceId, List<RawListing> listings) {
        return new SourceFetchResult(sourceId, listings, null);
    }

    public static SourceFetchResult failure(String sourceId, String code, String message) {
        return new SourceFetchResult(sourceId, List.of(), new SourceError(code, message));
    }

    public boolean isSuccessful() {
        return error == null;
    }
}
