package com.appforge.core.graph;

import com.appforge.core.model.Task;

/**
 * A single recorded state change.
 *
 * @param before   task before the change
 * @param after    task after the change
 * @param snapshot whole-graph snapshot including the change
 */
public record TaskTransition(Task before, Task after, GraphSnapshot snapshot) {

    public long sequence() {
        return snapshot.sequence();
    }

    public String generationId() {
        return snapshot.generationId();
    }
}
