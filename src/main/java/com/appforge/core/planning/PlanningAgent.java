package com.appforge.core.planning;

import com.appforge.core.config.AppforgeProperties;
import com.appforge.core.graph.GraphIntegrityException;
import com.appforge.core.graph.TaskGraph;
import com.appforge.core.metrics.AppforgeMetrics;
import com.appforge.core.model.PlanningConstraints;
import com.appforge.core.model.Task;
import com.appforge.core.model.TaskKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a natural-language requirement into a validated task graph.
 * <p>
 * Backend and database modules are always planned; frontend and auth are added when
 * the requirement asks for them, unless the caller lists modules explicitly. An
 * integration task follows every module and an optional deployment task follows
 * integration. Edges: database before backend and auth, backend and auth before
 * frontend.
 */
public class PlanningAgent {

    private static final Logger log = LoggerFactory.getLogger(PlanningAgent.class);

    private static final Map<TaskKind, Set<String>> SUPPORTED_FRAMEWORKS = Map.of(
            TaskKind.FRONTEND, Set.of("react", "vue", "angular"),
            TaskKind.BACKEND, Set.of("fastapi", "express"),
            TaskKind.DATABASE, Set.of("postgresql", "cloud_sql", "firestore"),
            TaskKind.AUTH, Set.of("jwt", "oauth", "session"),
            TaskKind.INTEGRATION, Set.of("rest", "event_driven", "bff", "cqrs", "microservices"),
            TaskKind.DEPLOYMENT, Set.of("cloud_run", "docker"));

    /** Plan order; dependencies always precede dependents. */
    private static final List<TaskKind> MODULE_ORDER =
            List.of(TaskKind.DATABASE, TaskKind.BACKEND, TaskKind.AUTH, TaskKind.FRONTEND);

    private final ContextRetriever contextRetriever;
    private final AppforgeProperties.Planning properties;
    private final AppforgeMetrics metrics;
    private final Clock clock;

    public PlanningAgent(ContextRetriever contextRetriever, AppforgeProperties.Planning properties,
                         AppforgeMetrics metrics, Clock clock) {
        this.contextRetriever = contextRetriever;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Plans a graph for the requirement.
     *
     * @param generationId id the graph is created under
     * @param requirement  natural-language description of the application
     * @param constraints  caller constraints
     * @return a validated, acyclic graph with every task PENDING
     * @throws PlanningException if the requirement is empty or too vague, or a constraint is unsupported
     */
    public TaskGraph plan(String generationId, String requirement, PlanningConstraints constraints) {
        long start = System.currentTimeMillis();
        if (requirement == null || requirement.isBlank()) {
            throw new PlanningException("Requirement is empty");
        }
        List<String> terms = ModuleKeywordDetector.significantTerms(requirement);
        if (terms.size() < properties.getMinimumTerms()) {
            throw new PlanningException("Requirement is too vague to plan: '" + requirement.trim() + "'");
        }

        Set<TaskKind> modules = resolveModules(requirement, constraints);
        Map<TaskKind, String> frameworks = resolveFrameworks(constraints);
        boolean includeDeployment = constraints.includeDeployment() && properties.isIncludeDeployment();
        String appName = constraints.appName() != null && !constraints.appName().isBlank()
                ? constraints.appName().trim()
                : deriveAppName(terms);
        List<String> features = extractFeatures(requirement);

        Instant now = clock.instant();
        List<Task> tasks = new ArrayList<>();
        for (TaskKind kind : MODULE_ORDER) {
            if (modules.contains(kind)) {
                tasks.add(Task.pending(kind.id(), kind,
                        input(requirement, appName, kind, frameworks, features),
                        moduleDependencies(kind, modules), now));
            }
        }
        List<String> moduleIds = tasks.stream().map(Task::id).toList();
        tasks.add(Task.pending(TaskKind.INTEGRATION.id(), TaskKind.INTEGRATION,
                input(requirement, appName, TaskKind.INTEGRATION, frameworks, features), moduleIds, now));
        if (includeDeployment) {
            tasks.add(Task.pending(TaskKind.DEPLOYMENT.id(), TaskKind.DEPLOYMENT,
                    input(requirement, appName, TaskKind.DEPLOYMENT, frameworks, features),
                    List.of(TaskKind.INTEGRATION.id()), now));
        }

        TaskGraph graph;
        try {
            graph = new TaskGraph(generationId, requirement.trim(), tasks, clock);
        } catch (GraphIntegrityException e) {
            throw new PlanningException("Planned graph is invalid: " + e.getMessage());
        }

        long elapsed = System.currentTimeMillis() - start;
        metrics.recordPlanningDuration(elapsed);
        metrics.recordPlannedTasks(tasks.size());
        log.info("Planned {} task(s) for generation {}: {}", tasks.size(), generationId,
                tasks.stream().map(Task::id).collect(Collectors.joining(", ")));
        return graph;
    }

    private Set<TaskKind> resolveModules(String requirement, PlanningConstraints constraints) {
        Set<TaskKind> modules = EnumSet.noneOf(TaskKind.class);
        if (!constraints.modules().isEmpty()) {
            for (String name : constraints.modules()) {
                TaskKind kind = parseKind(name);
                if (!kind.isModule()) {
                    throw new PlanningException("Unsupported module kind '" + name + "', expected one of "
                            + supportedModules());
                }
                modules.add(kind);
            }
            return modules;
        }
        modules.add(TaskKind.BACKEND);
        modules.add(TaskKind.DATABASE);
        modules.addAll(ModuleKeywordDetector.detectModules(requirement));
        return modules;
    }

    private Map<TaskKind, String> resolveFrameworks(PlanningConstraints constraints) {
        Map<TaskKind, String> frameworks = new LinkedHashMap<>();
        properties.getDefaultFrameworks().forEach((kind, framework) ->
                frameworks.put(parseKind(kind), framework.toLowerCase(Locale.ROOT)));
        constraints.frameworks().forEach((kind, framework) -> {
            TaskKind taskKind = parseKind(kind);
            String normalized = framework == null ? "" : framework.trim().toLowerCase(Locale.ROOT);
            if (!SUPPORTED_FRAMEWORKS.get(taskKind).contains(normalized)) {
                throw new PlanningException("Unsupported framework '%s' for %s, expected one of %s"
                        .formatted(framework, taskKind.id(), SUPPORTED_FRAMEWORKS.get(taskKind)));
            }
            frameworks.put(taskKind, normalized);
        });
        return frameworks;
    }

    private static List<String> moduleDependencies(TaskKind kind, Set<TaskKind> modules) {
        List<TaskKind> deps = switch (kind) {
            case BACKEND, AUTH -> List.of(TaskKind.DATABASE);
            case FRONTEND -> List.of(TaskKind.BACKEND, TaskKind.AUTH);
            default -> List.of();
        };
        return deps.stream().filter(modules::contains).map(TaskKind::id).toList();
    }

    private Map<String, Object> input(String requirement, String appName, TaskKind kind,
                                      Map<TaskKind, String> frameworks, List<String> features) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("requirement", requirement.trim());
        input.put("appName", appName);
        input.put("framework", frameworks.getOrDefault(kind, ""));
        input.put("features", features);
        input.put("context", List.copyOf(contextRetriever.retrieve(requirement, kind.id())));
        return input;
    }

    /**
     * Clauses after the leading description, split on commas, "and" and "with".
     * "todo app with auth and reminders" yields [auth, reminders].
     */
    static List<String> extractFeatures(String requirement) {
        String[] clauses = requirement.trim().split("(?i)\\s*(?:,|;|\\bwith\\b|\\band\\b|\\bincluding\\b)\\s*");
        return Arrays.stream(clauses)
                .skip(1)
                .map(String::trim)
                .filter(c -> !c.isEmpty())
                .distinct()
                .toList();
    }

    private static String deriveAppName(List<String> terms) {
        return String.join("-", terms.subList(0, Math.min(2, terms.size())));
    }

    private static TaskKind parseKind(String name) {
        try {
            return TaskKind.fromName(name);
        } catch (IllegalArgumentException e) {
            throw new PlanningException("Unsupported module kind '" + name + "', expected one of "
                    + supportedModules());
        }
    }

    private static List<String> supportedModules() {
        return Arrays.stream(TaskKind.values()).filter(TaskKind::isModule).map(TaskKind::id).toList();
    }
}
