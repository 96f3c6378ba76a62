package com.appforge.core.engine;

import com.appforge.core.events.EventBus;
import com.appforge.core.events.GenerationEvent;
import com.appforge.core.graph.TaskTransition;
import com.appforge.core.graph.TransitionListener;
import com.appforge.core.model.Task;
import com.appforge.core.model.TaskState;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publishes a progress event for every task transition.
 */
class TaskEventPublisher implements TransitionListener {

    private final EventBus eventBus;

    TaskEventPublisher(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @Override
    public void onTransition(TaskTransition transition) {
        Task before = transition.before();
        Task after = transition.after();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("kind", after.kind().id());
        payload.put("from", before.state().name());
        payload.put("to", after.state().name());
        payload.put("attempts", after.attempts());
        payload.put("sequence", transition.sequence());
        if (after.assignedProvider() != null) {
            payload.put("provider", after.assignedProvider());
        }
        if (after.lastError() != null && after.state() != TaskState.SUCCEEDED) {
            payload.put("error", after.lastError().kind().id());
            payload.put("message", after.lastError().message());
        }
        if (after.state() == TaskState.SUCCEEDED && after.result() != null) {
            payload.put("files", after.result().paths());
        }
        eventBus.publish(new GenerationEvent(eventType(before.state(), after.state()),
                transition.generationId(), after.id(), payload, Instant.now()));
    }

    private static String eventType(TaskState from, TaskState to) {
        return switch (to) {
            case RUNNING -> from == TaskState.RETRYING ? "task.resumed" : "task.started";
            case RETRYING -> "task.retrying";
            case SUCCEEDED -> "task.succeeded";
            case FAILED -> "task.failed";
            case SKIPPED -> "task.skipped";
            case PENDING -> "task.aborted";
        };
    }
}
