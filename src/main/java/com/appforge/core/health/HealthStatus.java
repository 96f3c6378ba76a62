package com.appforge.core.health;

import java.util.Map;

/**
 * Result of checking one component: the checkpoint store, the provider set, or a
 * single provider circuit ({@code provider:<name>}).
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DOWN, DEGRADED }

    public HealthStatus {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public boolean isUp() {
        return status == Status.UP;
    }
}
