package com.appforge.core.graph;

/**
 * Observer of task transitions. Invoked synchronously while the graph lock is held,
 * so invocations for one graph are strictly ordered by sequence.
 */
@FunctionalInterface
public interface TransitionListener {

    void onTransition(TaskTransition transition);
}
