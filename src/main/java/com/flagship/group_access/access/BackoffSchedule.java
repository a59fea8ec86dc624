package com.flagship.group_access.access;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Explicit retry delays for access grants. The n-th retryable failure waits {@code delays[n-1]};
 * a failure beyond the last entry ends the task.
 */
public final class BackoffSchedule {

    private final List<Duration> delays;

    public BackoffSchedule(List<Duration> delays) {
        if (delays == null || delays.isEmpty()) {
            throw new IllegalArgumentException("Backoff schedule needs at least one delay");
        }
        if (delays.stream().anyMatch(d -> d == null || d.isNegative())) {
            throw new IllegalArgumentException("Backoff delays must be non-negative: " + delays);
        }
        this.delays = List.copyOf(delays);
    }

    /**
     * @param failedAttempts retryable failures so far, including the one just seen
     * @return when to try next, or empty when the schedule is used up
     */
    public Optional<Instant> nextAttemptAt(Instant now, int failedAttempts, Duration retryAfter) {
        if (failedAttempts < 1 || failedAttempts > delays.size()) {
            return Optional.empty();
        }
        Duration delay = delays.get(failedAttempts - 1);
        if (retryAfter != null && retryAfter.compareTo(delay) > 0) {
            delay = retryAfter;
        }
        return Optional.of(now.plus(delay));
    }

    public int maxRetries() {
        return delays.size();
    }

    public Duration totalDelay() {
        return delays.stream().reduce(Duration.ZERO, Duration::plus);
    }
}
