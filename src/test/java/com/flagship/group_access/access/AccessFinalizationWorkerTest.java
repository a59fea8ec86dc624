package com.flagship.group_access.access;

import com.flagship.group_access.config.MembershipProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AccessFinalizationWorkerTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private final AccessGrantTaskService taskService = mock(AccessGrantTaskService.class);
    private final AccessFinalizer finalizer = mock(AccessFinalizer.class);
    private final MembershipProperties properties = new MembershipProperties();
    private final AccessFinalizationWorker worker = new AccessFinalizationWorker(
            taskService, finalizer, properties, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    @DisplayName("Claims due tasks with the configured batch size and attempts each")
    void attemptsClaimedTasks() {
        when(taskService.claimDue(NOW, properties.getAccess().getWorkerBatchSize())).thenReturn(List.of(1L, 2L));

        worker.processDueTasks();

        verify(finalizer).attemptClaimed(1L);
        verify(finalizer).attemptClaimed(2L);
    }

    @Test
    @DisplayName("One crashing attempt does not stop the rest of the batch")
    void isolatesFailures() {
        when(taskService.claimDue(any(), anyInt())).thenReturn(List.of(1L, 2L));
        when(finalizer.attemptClaimed(1L)).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(worker::processDueTasks);
        verify(finalizer).attemptClaimed(2L);
    }

    @Test
    @DisplayName("Nothing due means no attempts")
    void idle() {
        when(taskService.claimDue(any(), anyInt())).thenReturn(List.of());

        worker.processDueTasks();

        verify(finalizer, never()).attemptClaimed(1L);
    }
}
