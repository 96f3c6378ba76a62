package com.appforge.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Output of a successfully generated task.
 *
 * @param provider   provider that produced the output
 * @param files      generated files keyed by relative path
 * @param notes      free-form notes returned alongside the files
 * @param producedAt when the output was accepted
 */
public record TaskResult(
    String provider,
    Map<String, String> files,
    String notes,
    Instant producedAt
) implements Serializable {

    public TaskResult {
        files = files == null ? Map.of() : Map.copyOf(files);
    }

    /** Relative paths of the generated files, sorted. */
    public List<String> paths() {
        return files.keySet().stream().sorted().toList();
    }
}
