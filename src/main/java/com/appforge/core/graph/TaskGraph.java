package com.appforge.core.graph;

import com.appforge.core.model.GenerationOutcome;
import com.appforge.core.model.Task;
import com.appforge.core.model.TaskError;
import com.appforge.core.model.TaskResult;
import com.appforge.core.model.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

/**
 * Directed acyclic graph of generation tasks for one generation.
 * <p>
 * All mutation goes through the {@code mark*} methods, which validate the transition,
 * bump the transition sequence and notify listeners while holding the graph lock.
 * Reads return immutable task records, so callers never observe a half-applied change.
 */
public class TaskGraph {

    private static final Logger log = LoggerFactory.getLogger(TaskGraph.class);

    private final String generationId;
    private final String requirement;
    private final Clock clock;
    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final Map<String, List<String>> dependents = new HashMap<>();
    private final List<TransitionListener> listeners = new CopyOnWriteArrayList<>();
    private long sequence;

    public TaskGraph(String generationId, String requirement, List<Task> plannedTasks, Clock clock) {
        this(generationId, requirement, plannedTasks, 0L, clock);
    }

    private TaskGraph(String generationId, String requirement, List<Task> plannedTasks,
                      long sequence, Clock clock) {
        this.generationId = generationId;
        this.requirement = requirement;
        this.clock = clock;
        this.sequence = sequence;
        for (Task task : plannedTasks) {
            if (task.id() == null || task.id().isBlank()) {
                throw new GraphIntegrityException("Task id must not be blank");
            }
            if (tasks.putIfAbsent(task.id(), task) != null) {
                throw new GraphIntegrityException("Duplicate task id: " + task.id());
            }
        }
        validateStructure();
    }

    /**
     * Rebuilds a graph from a checkpoint. Tasks recorded as RUNNING or RETRYING were
     * interrupted and go back to PENDING; the sequence continues from the snapshot.
     */
    public static TaskGraph restore(GraphSnapshot snapshot, Clock clock) {
        snapshot.verifyDependencies();
        List<Task> restored = new ArrayList<>();
        for (Task task : snapshot.tasks()) {
            if (task.state().isInFlight()) {
                log.info("Task {} was {} at checkpoint {}, resetting to PENDING",
                        task.id(), task.state(), snapshot.sequence());
                restored.add(task.withState(TaskState.PENDING));
            } else {
                restored.add(task);
            }
        }
        TaskGraph graph = new TaskGraph(snapshot.generationId(), snapshot.requirement(), restored,
                snapshot.sequence(), clock);
        graph.settleBlockedTasks();
        return graph;
    }

    public String generationId() {
        return generationId;
    }

    public String requirement() {
        return requirement;
    }

    public synchronized long sequence() {
        return sequence;
    }

    public void addListener(TransitionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(TransitionListener listener) {
        listeners.remove(listener);
    }

    // ── Queries ───────────────────────────────────────────────────────────

    public synchronized Task task(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null) {
            throw new GraphIntegrityException("Unknown task: " + taskId);
        }
        return task;
    }

    public synchronized List<Task> tasks() {
        return List.copyOf(tasks.values());
    }

    /**
     * Returns PENDING tasks whose dependencies have all SUCCEEDED, in plan order.
     */
    public synchronized List<Task> readyTasks() {
        List<Task> ready = new ArrayList<>();
        for (Task task : tasks.values()) {
            if (task.state() == TaskState.PENDING && dependenciesSucceeded(task)) {
                ready.add(task);
            }
        }
        return ready;
    }

    /**
     * True when every task is terminal, or when nothing is in flight and nothing is
     * ready so no path to completion remains.
     */
    public synchronized boolean isTerminal() {
        boolean allTerminal = true;
        for (Task task : tasks.values()) {
            if (task.state().isInFlight()) {
                return false;
            }
            if (!task.state().isTerminal()) {
                allTerminal = false;
            }
        }
        return allTerminal || readyTasks().isEmpty();
    }

    /**
     * Outcome of the graph as it currently stands. FAILED when a root task failed or
     * nothing succeeded, PARTIAL when some tasks failed or were skipped.
     */
    public synchronized GenerationOutcome outcome() {
        int succeeded = 0;
        boolean anyUnsuccessful = false;
        boolean rootFailed = false;
        for (Task task : tasks.values()) {
            if (task.state() == TaskState.SUCCEEDED) {
                succeeded++;
            } else {
                anyUnsuccessful = true;
                if (task.state() == TaskState.FAILED && task.dependencies().isEmpty()) {
                    rootFailed = true;
                }
            }
        }
        if (!anyUnsuccessful) {
            return GenerationOutcome.COMPLETED;
        }
        if (rootFailed || succeeded == 0) {
            return GenerationOutcome.FAILED;
        }
        return GenerationOutcome.PARTIAL;
    }

    public synchronized GraphSnapshot snapshot() {
        return new GraphSnapshot(generationId, requirement, sequence,
                List.copyOf(tasks.values()), clock.instant());
    }

    // ── Transitions ───────────────────────────────────────────────────────

    /**
     * Starts an attempt: PENDING or RETRYING to RUNNING, incrementing the attempt count.
     *
     * @param provider provider selected for this attempt, null if none is callable
     */
    public synchronized Task markRunning(String taskId, String provider) {
        Task current = task(taskId);
        if (current.state() == TaskState.PENDING && !dependenciesSucceeded(current)) {
            throw new GraphIntegrityException(
                    "Task '%s' dispatched before its dependencies succeeded".formatted(taskId));
        }
        return transition(taskId, TaskState.RUNNING, t -> t.withAttempt(provider, clock.instant()));
    }

    public synchronized Task markSucceeded(String taskId, TaskResult result) {
        Task current = task(taskId);
        if (!dependenciesSucceeded(current)) {
            throw new GraphIntegrityException(
                    "Task '%s' cannot succeed while a dependency has not succeeded".formatted(taskId));
        }
        return transition(taskId, TaskState.SUCCEEDED,
                t -> t.withResult(result).withCompletedAt(clock.instant()));
    }

    public synchronized Task markRetrying(String taskId, TaskError error) {
        return transition(taskId, TaskState.RETRYING, t -> t.withError(error));
    }

    /**
     * Fails a task and transitively skips every PENDING dependent.
     */
    public synchronized Task markFailed(String taskId, TaskError error) {
        Task failed = transition(taskId, TaskState.FAILED,
                t -> t.withError(error).withCompletedAt(clock.instant()));
        skipDependents(taskId);
        return failed;
    }

    /**
     * Skips a PENDING task and transitively skips its PENDING dependents.
     */
    public synchronized Task markSkipped(String taskId) {
        Task skipped = transition(taskId, TaskState.SKIPPED, t -> t.withCompletedAt(clock.instant()));
        skipDependents(taskId);
        return skipped;
    }

    /**
     * Returns an in-flight task to PENDING without consuming its result. Used on cancellation.
     */
    public synchronized Task abort(String taskId) {
        return transition(taskId, TaskState.PENDING, UnaryOperator.identity());
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private Task transition(String taskId, TaskState next, UnaryOperator<Task> change) {
        Task before = task(taskId);
        if (!before.state().canTransitionTo(next)) {
            throw new GraphIntegrityException("Illegal transition for task '%s': %s -> %s"
                    .formatted(taskId, before.state(), next));
        }
        Task after = change.apply(before).withState(next);
        tasks.put(taskId, after);
        sequence++;
        log.debug("Task {} {} -> {} (seq {})", taskId, before.state(), next, sequence);

        TaskTransition transition = new TaskTransition(before, after, snapshot());
        for (TransitionListener listener : listeners) {
            listener.onTransition(transition);
        }
        return after;
    }

    private void skipDependents(String taskId) {
        Deque<String> queue = new ArrayDeque<>(dependents.getOrDefault(taskId, List.of()));
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (tasks.get(id).state() == TaskState.PENDING) {
                transition(id, TaskState.SKIPPED, t -> t.withCompletedAt(clock.instant()));
                queue.addAll(dependents.getOrDefault(id, List.of()));
            }
        }
    }

    /**
     * A checkpoint may have been taken between a failure and the skip of its dependents.
     * Those dependents can never run, so they are skipped without recording a transition.
     */
    private void settleBlockedTasks() {
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Task task : List.copyOf(tasks.values())) {
                if (task.state() == TaskState.PENDING && dependencyBlocked(task)) {
                    tasks.put(task.id(), task.withState(TaskState.SKIPPED).withCompletedAt(clock.instant()));
                    changed = true;
                }
            }
        }
    }

    private boolean dependencyBlocked(Task task) {
        for (String dep : task.dependencies()) {
            TaskState depState = tasks.get(dep).state();
            if (depState == TaskState.FAILED || depState == TaskState.SKIPPED) {
                return true;
            }
        }
        return false;
    }

    private boolean dependenciesSucceeded(Task task) {
        for (String dep : task.dependencies()) {
            if (tasks.get(dep).state() != TaskState.SUCCEEDED) {
                return false;
            }
        }
        return true;
    }

    private void validateStructure() {
        Map<String, Integer> inDegree = new HashMap<>();
        for (Task task : tasks.values()) {
            inDegree.put(task.id(), task.dependencies().size());
            Set<String> seen = new HashSet<>();
            for (String dep : task.dependencies()) {
                if (!tasks.containsKey(dep)) {
                    throw new GraphIntegrityException(
                            "Task '%s' depends on unknown task '%s'".formatted(task.id(), dep));
                }
                if (dep.equals(task.id())) {
                    throw new GraphIntegrityException("Task '%s' depends on itself".formatted(task.id()));
                }
                if (!seen.add(dep)) {
                    throw new GraphIntegrityException(
                            "Task '%s' lists dependency '%s' twice".formatted(task.id(), dep));
                }
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(task.id());
            }
        }

        // Kahn's algorithm: every task must be reachable in a topological order
        Deque<String> queue = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                queue.add(id);
            }
        });
        int visited = 0;
        while (!queue.isEmpty()) {
            String id = queue.poll();
            visited++;
            for (String dependent : dependents.getOrDefault(id, List.of())) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    queue.add(dependent);
                }
            }
        }
        if (visited != tasks.size()) {
            throw new GraphIntegrityException("Task graph for generation " + generationId + " contains a cycle");
        }
    }
}
