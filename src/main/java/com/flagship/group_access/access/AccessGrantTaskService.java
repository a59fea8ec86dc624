package com.flagship.group_access.access;

import com.flagship.group_access.config.MembershipProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for access grant tasks. Each method is its own short transaction;
 * platform calls happen between them, never inside one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccessGrantTaskService {

    private final AccessGrantTaskRepository repository;
    private final JdbcTemplate jdbcTemplate;
    private final MembershipProperties properties;

    /**
     * Starts a fresh schedule for the user, due at {@code dueAt}.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public AccessGrantTask restart(long userId, Instant dueAt) {
        AccessGrantTask task = repository.findById(userId)
            .map(entity -> {
                AccessGrantTask restarted = entity.toDomain().restart(dueAt);
                entity.updateFromDomain(restarted);
                return restarted;
            })
            .orElseGet(() -> {
                AccessGrantTask created = AccessGrantTask.create(userId, dueAt);
                repository.save(AccessGrantTaskEntity.fromDomain(created));
                return created;
            });
        log.debug("Access grant task scheduled: userId={}, dueAt={}", userId, dueAt);
        return task;
    }

    @Transactional
    public AccessGrantTask restartNow(long userId, Instant dueAt) {
        return restart(userId, dueAt);
    }

    /**
     * Claims due tasks for this worker by pushing their next attempt out by the claim lease.
     * Rows locked by another worker are skipped, so two instances never claim the same task.
     */
    @Transactional
    public List<Long> claimDue(Instant now, int limit) {
        Instant leaseUntil = now.plus(properties.getAccess().getClaimLease());
        return jdbcTemplate.query(
            "UPDATE access_grant_tasks SET next_attempt_at = ?, updated_at = ? " +
            "WHERE user_id IN (" +
            "  SELECT user_id FROM access_grant_tasks " +
            "  WHERE status = 'PENDING' AND next_attempt_at <= ? " +
            "  ORDER BY next_attempt_at " +
            "  LIMIT ? " +
            "  FOR UPDATE SKIP LOCKED" +
            ") RETURNING user_id",
            (rs, rowNum) -> rs.getLong("user_id"),
            Timestamp.from(leaseUntil),
            Timestamp.from(now),
            Timestamp.from(now),
            limit
        );
    }

    @Transactional(readOnly = true)
    public Optional<AccessGrantTask> find(long userId) {
        return repository.findById(userId).map(AccessGrantTaskEntity::toDomain);
    }

    /**
     * Stores the outcome of an attempt, unless the task was restarted or finished meanwhile.
     */
    @Transactional
    public AccessGrantTask save(AccessGrantTask before, AccessGrantTask after) {
        AccessGrantTaskEntity entity = repository.findById(after.getUserId())
            .orElseThrow(() -> new IllegalStateException("No access grant task for user " + after.getUserId()));
        AccessGrantTask current = entity.toDomain();
        if (current.getStatus() != AccessGrantStatus.PENDING || current.getAttemptCount() != before.getAttemptCount()) {
            log.info("Access grant task changed during attempt, keeping newer state: userId={}, status={}, attempts={}",
                    current.getUserId(), current.getStatus(), current.getAttemptCount());
            return current;
        }
        entity.updateFromDomain(after);
        return after;
    }
}
