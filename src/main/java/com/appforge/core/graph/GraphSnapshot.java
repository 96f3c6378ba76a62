package com.appforge.core.graph;

import com.appforge.core.model.Task;
import com.appforge.core.model.TaskState;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable copy of a generation graph at a given transition sequence. This is the
 * unit persisted by the checkpoint store.
 *
 * @param generationId generation this snapshot belongs to
 * @param requirement  original requirement text
 * @param sequence     monotonically increasing transition number
 * @param tasks        every task in plan order
 * @param capturedAt   when the snapshot was taken
 */
public record GraphSnapshot(
    String generationId,
    String requirement,
    long sequence,
    List<Task> tasks,
    Instant capturedAt
) {

    public GraphSnapshot {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    /**
     * Rejects snapshots that record a task as succeeded while one of its
     * dependencies is missing or not succeeded.
     *
     * @throws GraphIntegrityException if the snapshot is inconsistent
     */
    public void verifyDependencies() {
        Map<String, Task> byId = new HashMap<>();
        for (Task t : tasks) {
            byId.put(t.id(), t);
        }
        for (Task t : tasks) {
            if (t.state() != TaskState.SUCCEEDED) {
                continue;
            }
            for (String dep : t.dependencies()) {
                Task d = byId.get(dep);
                if (d == null) {
                    throw new GraphIntegrityException(
                            "Task '%s' succeeded but dependency '%s' is missing".formatted(t.id(), dep));
                }
                if (d.state() != TaskState.SUCCEEDED) {
                    throw new GraphIntegrityException(
                            "Task '%s' succeeded but dependency '%s' is %s".formatted(t.id(), dep, d.state()));
                }
            }
        }
    }
}
