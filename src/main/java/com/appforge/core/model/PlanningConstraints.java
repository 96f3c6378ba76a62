package com.appforge.core.model;

import java.util.Map;
import java.util.Set;

/**
 * Caller-supplied constraints for planning.
 *
 * @param modules           module kinds to build; empty lets the planner decide from the requirement
 * @param frameworks        framework overrides keyed by task kind id (e.g. "frontend" -&gt; "vue")
 * @param includeDeployment whether a deployment task is appended after integration
 * @param appName           application name passed to generators, null to derive one
 */
public record PlanningConstraints(
    Set<String> modules,
    Map<String, String> frameworks,
    boolean includeDeployment,
    String appName
) {

    public PlanningConstraints {
        modules = modules == null ? Set.of() : Set.copyOf(modules);
        frameworks = frameworks == null ? Map.of() : Map.copyOf(frameworks);
    }

    public static PlanningConstraints defaults() {
        return new PlanningConstraints(Set.of(), Map.of(), true, null);
    }
}
