package com.freelance.jobalerts.pipeline.service;

import com.freelance.jobalerts.pipeline.model.MarkResult;

import java.util.Collection;
import java.util.Set;

/**
 * Durable set of delivered keys. Every method throws {@link StoreUnavailableException} when
 * the backing store cannot be reached; callers must not treat that as "not sent".
 */
public interface IdempotencyStore {

    boolean alreadySent(String key);

    /**
     * Subset of {@code keys} already recorded as sent.
     */
    Set<String> findSent(Collection<String> keys);

    /**
     * Atomic insert-if-absent. Exactly one concurrent caller for a key sees {@link MarkResult#FRESH}.
     */
    MarkResult markSent(String key, String fingerprint, Long recipientId, String source);
}
