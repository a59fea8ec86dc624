package com.flagship.group_access.access;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Persisted progress of granting one user access to the group.
 *
 * Replaces a sleeping retry loop: the attempt count and next attempt time live in the
 * database, so a restart resumes the schedule where it stopped.
 */
@Value
public class AccessGrantTask {
    long userId;
    AccessGrantStatus status;
    int attemptCount;
    Instant lastAttemptAt;
    Instant nextAttemptAt;
    String lastError;

    public static AccessGrantTask create(long userId, Instant nextAttemptAt) {
        return new AccessGrantTask(userId, AccessGrantStatus.PENDING, 0, null, nextAttemptAt, null);
    }

    /**
     * Starts a fresh schedule, e.g. after a new payment.
     */
    public AccessGrantTask restart(Instant nextAttemptAt) {
        return new AccessGrantTask(userId, AccessGrantStatus.PENDING, 0, lastAttemptAt, nextAttemptAt, null);
    }

    public AccessGrantTask granted(Instant now) {
        return new AccessGrantTask(userId, AccessGrantStatus.GRANTED, attemptCount + 1, now, null, null);
    }

    public AccessGrantTask failed(String error, Instant now) {
        return new AccessGrantTask(userId, AccessGrantStatus.FAILED, attemptCount + 1, now, null, error);
    }

    /**
     * Consumes one backoff slot. Ends as EXHAUSTED when the schedule has no slot left.
     */
    public AccessGrantTask retryLater(String error, Duration retryAfter, BackoffSchedule schedule, Instant now) {
        int attempts = attemptCount + 1;
        return schedule.nextAttemptAt(now, attempts, retryAfter)
            .map(next -> new AccessGrantTask(userId, AccessGrantStatus.PENDING, attempts, now, next, error))
            .orElseGet(() -> new AccessGrantTask(userId, AccessGrantStatus.EXHAUSTED, attempts, now, null, error));
    }

    public boolean isTerminal() {
        return status != AccessGrantStatus.PENDING;
    }
}
