package com.flagship.group_access.access;

import lombok.Value;

import java.time.Instant;

/**
 * Outcome of one finalization attempt.
 *
 * PENDING covers both "retry scheduled" ({@code nextAttemptAt} set) and "retries used up"
 * (no next attempt). Neither takes paid access away.
 */
@Value
public class FinalizationResult {

    public enum Outcome {
        GRANTED,
        PENDING,
        FAILED
    }

    public static final String NO_ACTIVE_ACCESS = "NO_ACTIVE_ACCESS";

    Outcome outcome;
    String reason;
    Instant nextAttemptAt;

    public static FinalizationResult granted() {
        return new FinalizationResult(Outcome.GRANTED, null, null);
    }

    public static FinalizationResult pending(String reason, Instant nextAttemptAt) {
        return new FinalizationResult(Outcome.PENDING, reason, nextAttemptAt);
    }

    public static FinalizationResult failed(String reason) {
        return new FinalizationResult(Outcome.FAILED, reason, null);
    }

    static FinalizationResult from(AccessGrantTask task) {
        return switch (task.getStatus()) {
            case GRANTED -> granted();
            case FAILED -> failed(task.getLastError());
            case PENDING, EXHAUSTED -> pending(task.getLastError(), task.getNextAttemptAt());
        };
    }
}
