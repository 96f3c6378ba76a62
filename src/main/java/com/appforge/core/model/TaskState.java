package com.appforge.core.model;

/**
 * Lifecycle state of a task inside a generation graph.
 * <p>
 * Allowed transitions:
 * <pre>
 * PENDING  -&gt; RUNNING | SKIPPED
 * RUNNING  -&gt; SUCCEEDED | RETRYING | FAILED | PENDING
 * RETRYING -&gt; RUNNING | FAILED | PENDING
 * </pre>
 * The transitions back to PENDING are only taken when a run is cancelled or a
 * checkpoint is restored after an unclean shutdown.
 */
public enum TaskState {
    PENDING,
    RUNNING,
    RETRYING,
    SUCCEEDED,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }

    public boolean isInFlight() {
        return this == RUNNING || this == RETRYING;
    }

    public boolean canTransitionTo(TaskState next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == SKIPPED;
            case RUNNING -> next == SUCCEEDED || next == RETRYING || next == FAILED || next == PENDING;
            case RETRYING -> next == RUNNING || next == FAILED || next == PENDING;
            case SUCCEEDED, FAILED, SKIPPED -> false;
        };
    }
}
