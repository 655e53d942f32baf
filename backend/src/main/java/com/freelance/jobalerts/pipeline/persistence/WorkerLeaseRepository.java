package com.freelance.jobalerts.pipeline.persistence;

import com.freelance.jobalerts.pipeline.service.StoreUnavailableException;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;

/**
 * Named lease with a TTL, claimed through a single conditional UPDATE so two processes can
 * never hold it at once. A holder that dies keeps it only until {@code locked_until} passes.
 */
@Repository
public class WorkerLeaseRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public WorkerLeaseRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean tryAcquire(String leaseName, String owner, long ttlSeconds) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("leaseName", leaseName)
            .addValue("owner", safeOwner(owner))
            .addValue("now", Timestamp.from(now))
            .addValue("lockedUntil", Timestamp.from(now.plusSeconds(Math.max(1, ttlSeconds))));
        try {
            jdbc.update(
                """
                    INSERT INTO worker_leases (lease_name, owner, locked_until, updated_at)
                    VALUES (:leaseName, NULL, NULL, :now)
                    ON CONFLICT DO NOTHING
                    """,
                params
            );
            int updated = jdbc.update(
                """
                    UPDATE worker_leases
                    SET owner = :owner,
                        locked_until = :lockedUntil,
                        updated_at = :now
                    WHERE lease_name = :leaseName
                      AND (locked_until IS NULL OR locked_until < :now OR owner = :owner)
                    """,
                params
            );
            return updated == 1;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to acquire worker lease " + leaseName, e);
        }
    }

    /**
     * Pushes {@code locked_until} forward for a lease this owner still holds. Returns false once
     * another owner has taken it over.
     */
    public boolean renew(String leaseName, String owner, long ttlSeconds) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("leaseName", leaseName)
            .addValue("owner", safeOwner(owner))
            .addValue("now", Timestamp.from(now))
            .addValue("lockedUntil", Timestamp.from(now.plusSeconds(Math.max(1, ttlSeconds))));
        try {
            int updated = jdbc.update(
                """
                    UPDATE worker_leases
                    SET locked_until = :lockedUntil,
                        updated_at = :now
                    WHERE lease_name = :leaseName
                      AND owner = :owner
                    """,
                params
            );
            return updated == 1;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to renew worker lease " + leaseName, e);
        }
    }

    public void release(String leaseName, String owner) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("leaseName", leaseName)
            .addValue("owner", safeOwner(owner))
            .addValue("now", Timestamp.from(Instant.now()));
        try {
            jdbc.update(
                """
                    UPDATE worker_leases
                    SET owner = NULL,
                        locked_until = NULL,
                        updated_at = :now
                    WHERE lease_name = :leaseName
                      AND owner = :owner
                    """,
                params
            );
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to release worker lease " + leaseName, e);
        }
    }

    private String safeOwner(String owner) {
        return (owner == null || owner.isBlank()) ? "unknown" : owner.trim();
    }
}
