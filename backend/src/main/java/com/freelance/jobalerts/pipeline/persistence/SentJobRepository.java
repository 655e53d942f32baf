package com.freelance.jobalerts.pipeline.persistence;

import com.freelance.jobalerts.pipeline.model.MarkResult;
import com.freelance.jobalerts.pipeline.service.IdempotencyStore;
import com.freelance.jobalerts.pipeline.service.StoreUnavailableException;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Repository
public class SentJobRepository implements IdempotencyStore {
    private static final int LOOKUP_BATCH_SIZE = 500;

    private final NamedParameterJdbcTemplate jdbc;

    public SentJobRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public boolean alreadySent(String key) {
        return !findSent(List.of(key)).isEmpty();
    }

    @Override
    public Set<String> findSent(Collection<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return Set.of();
        }
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(keys));
        Set<String> found = new HashSet<>();
        try {
            for (int start = 0; start < distinct.size(); start += LOOKUP_BATCH_SIZE) {
                List<String> batch = distinct.subList(start, Math.min(distinct.size(), start + LOOKUP_BATCH_SIZE));
                found.addAll(jdbc.queryForList(
                    """
                        SELECT dedup_key
                        FROM sent_jobs
                        WHERE dedup_key IN (:keys)
                        """,
                    new MapSqlParameterSource().addValue("keys", batch),
                    String.class
                ));
            }
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to read sent_jobs", e);
        }
        return found;
    }

    @Override
    public MarkResult markSent(String key, String fingerprint, Long recipientId, String source) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("key", key)
            .addValue("fingerprint", fingerprint)
            .addValue("recipientId", recipientId)
            .addValue("source", source)
            .addValue("sentAt", Timestamp.from(Instant.now()));
        int inserted;
        try {
            inserted = jdbc.update(
                """
                    INSERT INTO sent_jobs (dedup_key, fingerprint, recipient_id, source, sent_at)
                    VALUES (:key, :fingerprint, :recipientId, :source, :sentAt)
                    ON CONFLICT DO NOTHING
                    """,
                params
            );
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to record sent job " + key, e);
        }
        return inserted == 1 ? MarkResult.FRESH : MarkResult.ALREADY_EXISTS;
    }

    public long countSent() {
        Long value = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM sent_jobs", Long.class);
        return value == null ? 0L : value;
    }
}
