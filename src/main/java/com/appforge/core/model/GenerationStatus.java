package com.appforge.core.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Point-in-time view of a generation, served from the live run or the latest checkpoint.
 *
 * @param generationId       generation identifier
 * @param requirement        the original requirement text
 * @param tasks              task snapshots in plan order
 * @param running            whether the graph is currently executing in this process
 * @param outcome            overall outcome, null while running or when never finished
 * @param degradedDurability true if a checkpoint write was lost for this generation
 * @param sequence           sequence number of the latest recorded transition
 */
public record GenerationStatus(
    String generationId,
    String requirement,
    List<Task> tasks,
    boolean running,
    GenerationOutcome outcome,
    boolean degradedDurability,
    long sequence
) {

    public Map<String, TaskState> taskStates() {
        return tasks.stream().collect(Collectors.toMap(Task::id, Task::state,
                (a, b) -> a, LinkedHashMap::new));
    }
}
