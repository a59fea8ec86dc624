package com.flagship.group_access.access;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AccessGrantTaskTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
    private final BackoffSchedule schedule = new BackoffSchedule(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)));

    @Test
    @DisplayName("Retryable failures walk the schedule, then the task is exhausted")
    void retriesUntilExhausted() {
        AccessGrantTask task = AccessGrantTask.create(7L, NOW);

        task = task.retryLater("RATE_LIMITED", null, schedule, NOW);
        assertEquals(AccessGrantStatus.PENDING, task.getStatus());
        assertEquals(1, task.getAttemptCount());
        assertEquals(NOW.plusSeconds(1), task.getNextAttemptAt());

        task = task.retryLater("RATE_LIMITED", null, schedule, NOW);
        assertEquals(NOW.plusSeconds(2), task.getNextAttemptAt());

        task = task.retryLater("RATE_LIMITED", null, schedule, NOW);
        assertEquals(AccessGrantStatus.EXHAUSTED, task.getStatus());
        assertEquals(3, task.getAttemptCount());
        assertNull(task.getNextAttemptAt());
        assertTrue(task.isTerminal());
    }

    @Test
    @DisplayName("Restart resets the attempt count and error")
    void restart() {
        AccessGrantTask exhausted = AccessGrantTask.create(7L, NOW)
            .failed("BAD_REQUEST", NOW);

        AccessGrantTask restarted = exhausted.restart(NOW.plusSeconds(5));

        assertEquals(AccessGrantStatus.PENDING, restarted.getStatus());
        assertEquals(0, restarted.getAttemptCount());
        assertNull(restarted.getLastError());
        assertEquals(NOW.plusSeconds(5), restarted.getNextAttemptAt());
        assertFalse(restarted.isTerminal());
    }

    @Test
    @DisplayName("Granting counts the attempt and clears the schedule")
    void granted() {
        AccessGrantTask granted = AccessGrantTask.create(7L, NOW)
            .retryLater("UPSTREAM_502", null, schedule, NOW)
            .granted(NOW.plusSeconds(1));

        assertEquals(AccessGrantStatus.GRANTED, granted.getStatus());
        assertEquals(2, granted.getAttemptCount());
        assertNull(granted.getNextAttemptAt());
        assertNull(granted.getLastError());
    }
}
