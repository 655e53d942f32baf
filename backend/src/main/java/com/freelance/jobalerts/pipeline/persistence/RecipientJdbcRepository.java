package com.freelance.jobalerts.pipeline.persistence;

import com.freelance.jobalerts.pipeline.model.Recipient;
import com.freelance.jobalerts.pipeline.service.RecipientDirectory;
import com.freelance.jobalerts.pipeline.service.StoreUnavailableException;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
public class RecipientJdbcRepository implements RecipientDirectory {
    private final NamedParameterJdbcTemplate jdbc;

    public RecipientJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public List<Recipient> listEligibleRecipients() {
        Map<Long, RecipientRow> rows = new LinkedHashMap<>();
        try {
            jdbc.query(
                """
                    SELECT r.id,
                           r.active,
                           r.blocked,
                           r.access_expires_at,
                           k.keyword
                    FROM recipients r
                    LEFT JOIN recipient_keywords k ON k.recipient_id = r.id
                    WHERE r.active = TRUE
                      AND r.blocked = FALSE
                    ORDER BY r.id, k.id
                    """,
                new MapSqlParameterSource(),
                rs -> {
                    long id = rs.getLong("id");
                    RecipientRow row = rows.get(id);
                    if (row == null) {
                        Timestamp expiresAt = rs.getTimestamp("access_expires_at");
                        row = new RecipientRow(
                            id,
                            rs.getBoolean("active"),
                            rs.getBoolean("blocked"),
                            expiresAt == null ? null : expiresAt.toInstant()
                        );
                        rows.put(id, row);
                    }
                    String keyword = rs.getString("keyword");
                    if (keyword != null) {
                        row.keywords.add(keyword);
                    }
                }
            );
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to load recipients", e);
        }
        List<Recipient> recipients = new ArrayList<>(rows.size());
        for (RecipientRow row : rows.values()) {
            recipients.add(new Recipient(row.id, Recipient.normalizeKeywords(row.keywords), row.active, row.blocked, row.expiresAt));
        }
        return recipients;
    }

    private static final class RecipientRow {
        private final long id;
        private final boolean active;
        private final boolean blocked;
        private final Instant expiresAt;
        private final List<String> keywords = new ArrayList<>();

        private RecipientRow(long id, boolean active, boolean blocked, Instant expiresAt) {
            this.id = id;
            this.active = active;
            this.blocked = blocked;
            this.expiresAt = expiresAt;
        }
    }
}
