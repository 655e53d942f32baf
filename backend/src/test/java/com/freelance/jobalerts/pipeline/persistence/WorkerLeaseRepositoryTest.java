package com.freelance.jobalerts.pipeline.persistence;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class WorkerLeaseRepositoryTest {

    @Autowired
    private WorkerLeaseRepository repository;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @Test
    void onlyOneOwnerHoldsTheLease() {
        String lease = "lease-" + UUID.randomUUID();

        assertTrue(repository.tryAcquire(lease, "worker-a", 60));
        assertFalse(repository.tryAcquire(lease, "worker-b", 60));
        assertTrue(repository.tryAcquire(lease, "worker-a", 60));

        repository.release(lease, "worker-a");
        assertTrue(repository.tryAcquire(lease, "worker-b", 60));
    }

    @Test
    void releaseByNonOwnerIsIgnored() {
        String lease = "lease-" + UUID.randomUUID();
        assertTrue(repository.tryAcquire(lease, "worker-a", 60));

        repository.release(lease, "worker-b");

        assertFalse(repository.tryAcquire(lease, "worker-b", 60));
    }

    @Test
    void expiredLeaseCanBeTakenOver() {
        String lease = "lease-" + UUID.randomUUID();
        assertTrue(repository.tryAcquire(lease, "worker-a", 60));
        jdbc.update(
            "UPDATE worker_leases SET locked_until = :past WHERE lease_name = :lease",
            new MapSqlParameterSource()
                .addValue("past", Timestamp.from(Instant.now().minusSeconds(5)))
                .addValue("lease", lease)
        );

        assertTrue(repository.tryAcquire(lease, "worker-b", 60));
        assertFalse(repository.tryAcquire(lease, "worker-a", 60));
    }

    @Test
    void renewSucceedsOnlyForCurrentOwner() {
        String lease = "lease-" + UUID.randomUUID();
        assertTrue(repository.tryAcquire(lease, "worker-a", 60));

        assertTrue(repository.renew(lease, "worker-a", 60));
        assertFalse(repository.renew(lease, "worker-b", 60));

        jdbc.update(
            "UPDATE worker_leases SET locked_until = :past WHERE lease_name = :lease",
            new MapSqlParameterSource()
                .addValue("past", Timestamp.from(Instant.now().minusSeconds(5)))
                .addValue("lease", lease)
        );
        assertTrue(repository.tryAcquire(lease, "worker-b", 60));
        assertFalse(repository.renew(lease, "worker-a", 60));
    }
}
