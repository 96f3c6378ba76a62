package com.appforge.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A single unit of generation work inside a generation graph. Immutable: every
 * state change produces a new instance owned by the graph.
 *
 * @param id               unique identifier within the graph (e.g. "backend")
 * @param kind             category of work
 * @param input            generator input payload (requirement, framework, features, context)
 * @param dependencies     ids of tasks that must succeed before this one may run
 * @param state            current lifecycle state
 * @param attempts         number of times the task entered RUNNING
 * @param lastError        last classified error, null if none
 * @param assignedProvider provider used for the current or last attempt
 * @param result           generated output once SUCCEEDED
 * @param createdAt        when the task was planned
 * @param startedAt        when the first attempt started
 * @param completedAt      when the task reached a terminal state
 */
public record Task(
    String id,
    TaskKind kind,
    Map<String, Object> input,
    List<String> dependencies,
    TaskState state,
    int attempts,
    TaskError lastError,
    String assignedProvider,
    TaskResult result,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt
) implements Serializable {

    public Task {
        input = input == null ? Map.of() : Map.copyOf(input);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public static Task pending(String id, TaskKind kind, Map<String, Object> input,
                               List<String> dependencies, Instant createdAt) {
        return new Task(id, kind, input, dependencies, TaskState.PENDING, 0,
                null, null, null, createdAt, null, null);
    }

    public Task withState(TaskState newState) {
        return new Task(id, kind, input, dependencies, newState, attempts,
                lastError, assignedProvider, result, createdAt, startedAt, completedAt);
    }

    public Task withAttempt(String provider, Instant now) {
        return new Task(id, kind, input, dependencies, TaskState.RUNNING, attempts + 1,
                lastError, provider, result, createdAt, startedAt == null ? now : startedAt, completedAt);
    }

    public Task withError(TaskError error) {
        return new Task(id, kind, input, dependencies, state, attempts,
                error, assignedProvider, result, createdAt, startedAt, completedAt);
    }

    public Task withResult(TaskResult newResult) {
        return new Task(id, kind, input, dependencies, state, attempts,
                lastError, assignedProvider, newResult, createdAt, startedAt, completedAt);
    }

    public Task withCompletedAt(Instant when) {
        return new Task(id, kind, input, dependencies, state, attempts,
                lastError, assignedProvider, result, createdAt, startedAt, when);
    }
}
