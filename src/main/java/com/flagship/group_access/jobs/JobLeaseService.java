package com.flagship.group_access.jobs;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Database leases that keep a job to one running instance.
 *
 * A lease is taken with a single upsert that only overwrites an expired holder, so two instances
 * racing for the same job cannot both win. A crashed holder blocks the job until its lease ends.
 * A long run renews its lease as it goes; a failed renewal means the lease passed to someone else.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobLeaseService {

    private static final String ACQUIRE_SQL = """
        INSERT INTO job_leases (job_name, owner, lease_until, acquired_at)
        VALUES (?, ?, ?, ?)
        ON CONFLICT (job_name) DO UPDATE
            SET owner = EXCLUDED.owner,
                lease_until = EXCLUDED.lease_until,
                acquired_at = EXCLUDED.acquired_at
            WHERE job_leases.lease_until < EXCLUDED.acquired_at
        """;

    private final JdbcTemplate jdbcTemplate;

    /**
     * @return true if this owner now holds the lease
     */
    public boolean tryAcquire(String jobName, String owner, Duration ttl, Instant now) {
        int updated = jdbcTemplate.update(ACQUIRE_SQL,
                jobName, owner, Timestamp.from(now.plus(ttl)), Timestamp.from(now));
        if (updated == 1) {
            log.debug("Lease acquired: job={}, owner={}, until={}", jobName, owner, now.plus(ttl));
        }
        return updated == 1;
    }

    /**
     * Extends a lease this owner still holds.
     *
     * @return false if the lease is gone or held by another owner
     */
    public boolean renew(String jobName, String owner, Duration ttl, Instant now) {
        int updated = jdbcTemplate.update(
                "UPDATE job_leases SET lease_until = ? WHERE job_name = ? AND owner = ?",
                Timestamp.from(now.plus(ttl)), jobName, owner);
        if (updated == 1) {
            log.debug("Lease renewed: job={}, owner={}, until={}", jobName, owner, now.plus(ttl));
        } else {
            log.warn("Lease renewal failed, lease no longer held: job={}, owner={}", jobName, owner);
        }
        return updated == 1;
    }

    /**
     * Ends the lease early. Does nothing if the lease has since passed to another owner.
     */
    public void release(String jobName, String owner) {
        jdbcTemplate.update("DELETE FROM job_leases WHERE job_name = ? AND owner = ?", jobName, owner);
    }

    public Optional<String> currentOwner(String jobName) {
        List<String> owners = jdbcTemplate.queryForList(
                "SELECT owner FROM job_leases WHERE job_name = ?", String.class, jobName);
        return owners.stream().findFirst();
    }
}
