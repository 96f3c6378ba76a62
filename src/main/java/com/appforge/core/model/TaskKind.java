package com.appforge.core.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * Category of work a task performs. The first four are module kinds a caller may
 * request explicitly; integration and deployment are synthesized by the planner.
 */
public enum TaskKind {
    FRONTEND(true),
    BACKEND(true),
    DATABASE(true),
    AUTH(true),
    INTEGRATION(false),
    DEPLOYMENT(false);

    private final boolean module;

    TaskKind(boolean module) {
        this.module = module;
    }

    public boolean isModule() {
        return module;
    }

    /** Lowercase identifier used for task ids, prompts and configuration keys. */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a kind from its case-insensitive name.
     *
     * @throws IllegalArgumentException if the name matches no kind
     */
    public static TaskKind fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Task kind must not be blank");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(k -> k.name().equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown task kind: " + name));
    }
}
