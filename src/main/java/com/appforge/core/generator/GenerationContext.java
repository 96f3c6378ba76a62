package com.appforge.core.generator;

import com.appforge.core.model.TaskError;
import com.appforge.core.model.TaskResult;

import java.util.Map;

/**
 * Inputs a generator may draw on besides the task itself.
 *
 * @param dependencyResults results of the task's succeeded dependencies, keyed by task id
 * @param previousError     error of the previous attempt, used to revise the prompt; null on first attempt
 */
public record GenerationContext(Map<String, TaskResult> dependencyResults, TaskError previousError) {

    public GenerationContext {
        dependencyResults = dependencyResults == null ? Map.of() : Map.copyOf(dependencyResults);
    }
}
