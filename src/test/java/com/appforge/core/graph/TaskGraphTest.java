package com.appforge.core.graph;

import com.appforge.core.model.ErrorKind;
import com.appforge.core.model.GenerationOutcome;
import com.appforge.core.model.Task;
import com.appforge.core.model.TaskError;
import com.appforge.core.model.TaskKind;
import com.appforge.core.model.TaskResult;
import com.appforge.core.model.TaskState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskGraphTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    private static Task task(String id, TaskKind kind, String... deps) {
        return Task.pending(id, kind, Map.of(), List.of(deps), CLOCK.instant());
    }

    private static TaskResult result(String provider) {
        return new TaskResult(provider, Map.of("README.md", "# app"), "ok", CLOCK.instant());
    }

    private static TaskError permanent(String message) {
        return new TaskError(ErrorKind.PERMANENT, message, "openai", CLOCK.instant());
    }

    /** database -> {backend, auth} -> frontend -> integration. */
    private static TaskGraph appGraph() {
        return new TaskGraph("GEN-1", "todo app with auth", List.of(
                task("database", TaskKind.DATABASE),
                task("backend", TaskKind.BACKEND, "database"),
                task("auth", TaskKind.AUTH, "database"),
                task("frontend", TaskKind.FRONTEND, "backend", "auth"),
                task("integration", TaskKind.INTEGRATION, "database", "backend", "auth", "frontend")
        ), CLOCK);
    }

    private static void succeed(TaskGraph graph, String id) {
        graph.markRunning(id, "openai");
        graph.markSucceeded(id, result("openai"));
    }

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("rejects a dependency on an unknown task")
        void rejectsUnknownDependency() {
            var ex = assertThrows(GraphIntegrityException.class, () -> new TaskGraph("GEN-1", "r",
                    List.of(task("backend", TaskKind.BACKEND, "database")), CLOCK));
            assertTrue(ex.getMessage().contains("unknown task 'database'"));
        }

        @Test
        @DisplayName("rejects duplicate task ids")
        void rejectsDuplicateIds() {
            assertThrows(GraphIntegrityException.class, () -> new TaskGraph("GEN-1", "r",
                    List.of(task("backend", TaskKind.BACKEND), task("backend", TaskKind.BACKEND)), CLOCK));
        }

        @Test
        @DisplayName("rejects self dependencies")
        void rejectsSelfDependency() {
            assertThrows(GraphIntegrityException.class, () -> new TaskGraph("GEN-1", "r",
                    List.of(task("backend", TaskKind.BACKEND, "backend")), CLOCK));
        }

        @Test
        @DisplayName("rejects cycles")
        void rejectsCycles() {
            var ex = assertThrows(GraphIntegrityException.class, () -> new TaskGraph("GEN-1", "r", List.of(
                    task("a", TaskKind.BACKEND, "c"),
                    task("b", TaskKind.DATABASE, "a"),
                    task("c", TaskKind.AUTH, "b")), CLOCK));
            assertTrue(ex.getMessage().contains("cycle"));
        }

        @Test
        @DisplayName("starts with every task pending at sequence zero")
        void startsPending() {
            TaskGraph graph = appGraph();
            assertEquals(0, graph.sequence());
            assertTrue(graph.tasks().stream().allMatch(t -> t.state() == TaskState.PENDING));
        }
    }

    @Nested
    @DisplayName("scheduling")
    class Scheduling {

        @Test
        @DisplayName("only tasks whose dependencies succeeded are ready")
        void readyTasksRespectDependencies() {
            TaskGraph graph = appGraph();
            assertEquals(List.of("database"), ids(graph.readyTasks()));

            succeed(graph, "database");
            assertEquals(List.of("backend", "auth"), ids(graph.readyTasks()));

            succeed(graph, "backend");
            assertEquals(List.of("auth"), ids(graph.readyTasks()));
        }

        @Test
        @DisplayName("starting a task before its dependencies succeed is an integrity violation")
        void earlyDispatchIsRejected() {
            TaskGraph graph = appGraph();
            assertThrows(GraphIntegrityException.class, () -> graph.markRunning("frontend", "openai"));
            assertEquals(TaskState.PENDING, graph.task("frontend").state());
            assertEquals(0, graph.sequence());
        }

        @Test
        @DisplayName("illegal transitions are rejected")
        void illegalTransition() {
            TaskGraph graph = appGraph();
            assertThrows(GraphIntegrityException.class,
                    () -> graph.markSucceeded("database", result("openai")));
            assertThrows(GraphIntegrityException.class, () -> graph.task("mobile"));
        }

        @Test
        @DisplayName("every transition bumps the sequence and notifies listeners with a snapshot")
        void transitionsNotifyListeners() {
            TaskGraph graph = appGraph();
            List<TaskTransition> seen = new ArrayList<>();
            graph.addListener(seen::add);

            graph.markRunning("database", "openai");
            graph.markRetrying("database", new TaskError(ErrorKind.TRANSIENT, "timeout", "openai", CLOCK.instant()));
            graph.markRunning("database", "openai");
            graph.markSucceeded("database", result("openai"));

            assertEquals(4, graph.sequence());
            assertEquals(List.of(1L, 2L, 3L, 4L), seen.stream().map(TaskTransition::sequence).toList());
            TaskTransition last = seen.get(3);
            assertEquals(TaskState.RUNNING, last.before().state());
            assertEquals(TaskState.SUCCEEDED, last.after().state());
            assertEquals(2, last.after().attempts());
            assertEquals(TaskState.SUCCEEDED, last.snapshot().tasks().get(0).state());
        }
    }

    @Nested
    @DisplayName("failure propagation")
    class FailurePropagation {

        @Test
        @DisplayName("a failed task transitively skips its dependents")
        void failureSkipsDependents() {
            TaskGraph graph = appGraph();
            succeed(graph, "database");
            succeed(graph, "backend");
            graph.markRunning("auth", "openai");
            graph.markFailed("auth", permanent("invalid api key"));

            assertEquals(TaskState.FAILED, graph.task("auth").state());
            assertEquals(TaskState.SKIPPED, graph.task("frontend").state());
            assertEquals(TaskState.SKIPPED, graph.task("integration").state());
            assertTrue(graph.isTerminal());
            assertEquals(GenerationOutcome.PARTIAL, graph.outcome());
        }

        @Test
        @DisplayName("a failed root task fails the whole generation")
        void rootFailureFailsGeneration() {
            TaskGraph graph = appGraph();
            graph.markRunning("database", "openai");
            graph.markFailed("database", permanent("bad request"));

            assertTrue(graph.tasks().stream().skip(1).allMatch(t -> t.state() == TaskState.SKIPPED));
            assertTrue(graph.isTerminal());
            assertEquals(GenerationOutcome.FAILED, graph.outcome());
        }

        @Test
        @DisplayName("all tasks succeeded means completed")
        void allSucceeded() {
            TaskGraph graph = appGraph();
            for (String id : List.of("database", "backend", "auth", "frontend", "integration")) {
                succeed(graph, id);
            }
            assertTrue(graph.isTerminal());
            assertEquals(GenerationOutcome.COMPLETED, graph.outcome());
        }
    }

    @Nested
    @DisplayName("restore")
    class Restore {

        @Test
        @DisplayName("in-flight tasks return to pending and the sequence continues")
        void inFlightTasksRestart() {
            TaskGraph graph = appGraph();
            succeed(graph, "database");
            graph.markRunning("backend", "openai");
            GraphSnapshot snapshot = graph.snapshot();

            TaskGraph restored = TaskGraph.restore(snapshot, CLOCK);

            assertEquals(TaskState.SUCCEEDED, restored.task("database").state());
            assertEquals(TaskState.PENDING, restored.task("backend").state());
            assertEquals(1, restored.task("backend").attempts());
            assertEquals(snapshot.sequence(), restored.sequence());
            assertEquals(List.of("backend", "auth"), ids(restored.readyTasks()));
        }

        @Test
        @DisplayName("a snapshot claiming success over an unsucceeded dependency is rejected")
        void inconsistentSnapshotIsRejected() {
            TaskGraph graph = appGraph();
            List<Task> tasks = new ArrayList<>(graph.tasks());
            tasks.set(1, tasks.get(1).withState(TaskState.SUCCEEDED));
            GraphSnapshot forged = new GraphSnapshot("GEN-1", "r", 7, tasks, CLOCK.instant());

            assertThrows(GraphIntegrityException.class, () -> TaskGraph.restore(forged, CLOCK));
        }

        @Test
        @DisplayName("pending dependents of a failed task are skipped on restore")
        void blockedTasksAreSettled() {
            TaskGraph graph = appGraph();
            List<Task> tasks = new ArrayList<>(graph.tasks());
            tasks.set(0, tasks.get(0).withState(TaskState.FAILED));
            GraphSnapshot snapshot = new GraphSnapshot("GEN-1", "r", 2, tasks, CLOCK.instant());

            TaskGraph restored = TaskGraph.restore(snapshot, CLOCK);

            assertEquals(TaskState.SKIPPED, restored.task("backend").state());
            assertEquals(TaskState.SKIPPED, restored.task("integration").state());
            assertTrue(restored.isTerminal());
            assertEquals(GenerationOutcome.FAILED, restored.outcome());
        }
    }

    private static List<String> ids(List<Task> tasks) {
        return tasks.stream().map(Task::id).toList();
    }
}
