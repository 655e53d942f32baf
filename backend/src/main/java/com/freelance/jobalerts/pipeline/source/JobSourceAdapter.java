package com.freelance.jobalerts.pipeline.source;

import com.freelance.jobalerts.pipeline.model.SourceFetchResult;

import java.util.List;

/**
 * One job platform. Implementations report expected failures (HTTP errors, unparsable
 * payloads, timeouts) through {@link SourceFetchResult#failure} instead of throwing.
 */
public interface JobSourceAdapter {

    String sourceId();

    /**
     * @param keywords keyword union of all eligible recipients; empty means "an unfiltered page"
     */
    SourceFetchResult fetch(List<String> keywords);
}
