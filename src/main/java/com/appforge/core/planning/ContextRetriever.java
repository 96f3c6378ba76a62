package com.appforge.core.planning;

import java.util.List;

/**
 * Supplies reference snippets for a module's prompt (similar past generations,
 * framework documentation). Results are attached to the task input at planning time.
 */
@FunctionalInterface
public interface ContextRetriever {

    List<String> retrieve(String requirement, String moduleKind);

    static ContextRetriever none() {
        return (requirement, moduleKind) -> List.of();
    }
}
