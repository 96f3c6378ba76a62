package com.appforge.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskStateTest {

    @Test
    @DisplayName("pending may only start or be skipped")
    void pendingTransitions() {
        assertTrue(TaskState.PENDING.canTransitionTo(TaskState.RUNNING));
        assertTrue(TaskState.PENDING.canTransitionTo(TaskState.SKIPPED));
        assertFalse(TaskState.PENDING.canTransitionTo(TaskState.SUCCEEDED));
        assertFalse(TaskState.PENDING.canTransitionTo(TaskState.FAILED));
        assertFalse(TaskState.PENDING.canTransitionTo(TaskState.RETRYING));
    }

    @Test
    @DisplayName("running may finish, retry, fail or be aborted back to pending")
    void runningTransitions() {
        assertTrue(TaskState.RUNNING.canTransitionTo(TaskState.SUCCEEDED));
        assertTrue(TaskState.RUNNING.canTransitionTo(TaskState.RETRYING));
        assertTrue(TaskState.RUNNING.canTransitionTo(TaskState.FAILED));
        assertTrue(TaskState.RUNNING.canTransitionTo(TaskState.PENDING));
        assertFalse(TaskState.RUNNING.canTransitionTo(TaskState.SKIPPED));
    }

    @Test
    @DisplayName("retrying may run again, fail or be aborted")
    void retryingTransitions() {
        assertTrue(TaskState.RETRYING.canTransitionTo(TaskState.RUNNING));
        assertTrue(TaskState.RETRYING.canTransitionTo(TaskState.FAILED));
        assertTrue(TaskState.RETRYING.canTransitionTo(TaskState.PENDING));
        assertFalse(TaskState.RETRYING.canTransitionTo(TaskState.SUCCEEDED));
    }

    @ParameterizedTest
    @EnumSource(value = TaskState.class, names = {"SUCCEEDED", "FAILED", "SKIPPED"})
    @DisplayName("terminal states have no outgoing transitions")
    void terminalStatesAreFinal(TaskState terminal) {
        assertTrue(terminal.isTerminal());
        for (TaskState next : TaskState.values()) {
            assertFalse(terminal.canTransitionTo(next), terminal + " -> " + next);
        }
    }

    @Test
    @DisplayName("only running and retrying are in flight")
    void inFlight() {
        assertTrue(TaskState.RUNNING.isInFlight());
        assertTrue(TaskState.RETRYING.isInFlight());
        assertFalse(TaskState.PENDING.isInFlight());
        assertFalse(TaskState.SUCCEEDED.isInFlight());
    }

    @Test
    @DisplayName("withAttempt counts attempts and keeps the first start time")
    void withAttemptCountsAttempts() {
        Instant first = Instant.parse("2026-01-01T00:00:00Z");
        Instant second = first.plusSeconds(5);
        Task task = Task.pending("backend", TaskKind.BACKEND, Map.of(), List.of(), first);

        Task once = task.withAttempt("openai", first);
        Task twice = once.withState(TaskState.RETRYING).withAttempt("anthropic", second);

        assertEquals(TaskState.RUNNING, twice.state());
        assertEquals(2, twice.attempts());
        assertEquals("anthropic", twice.assignedProvider());
        assertEquals(first, twice.startedAt());
    }

    @Test
    @DisplayName("task kinds resolve case-insensitively and reject unknown names")
    void taskKindFromName() {
        assertEquals(TaskKind.FRONTEND, TaskKind.fromName(" Frontend "));
        assertEquals("auth", TaskKind.AUTH.id());
        assertFalse(TaskKind.INTEGRATION.isModule());
        assertThrows(IllegalArgumentException.class, () -> TaskKind.fromName("mobile"));
        assertThrows(IllegalArgumentException.class, () -> TaskKind.fromName(" "));
    }

    @Test
    @DisplayName("only permanent errors are not retryable")
    void errorKindRetryability() {
        assertFalse(ErrorKind.PERMANENT.isRetryable());
        assertTrue(ErrorKind.TRANSIENT.isRetryable());
        assertTrue(ErrorKind.RATE_LIMITED.isRetryable());
        assertEquals("rate_limited", ErrorKind.RATE_LIMITED.id());
    }
}
