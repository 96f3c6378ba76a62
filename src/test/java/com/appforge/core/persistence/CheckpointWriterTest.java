package com.appforge.core.persistence;

import com.appforge.core.events.EventBus;
import com.appforge.core.events.GenerationEvent;
import com.appforge.core.graph.GraphIntegrityException;
import com.appforge.core.graph.GraphSnapshot;
import com.appforge.core.graph.TaskGraph;
import com.appforge.core.metrics.AppforgeMetrics;
import com.appforge.core.model.ErrorKind;
import com.appforge.core.model.Task;
import com.appforge.core.model.TaskState;
import com.appforge.core.resilience.RetryPolicy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static com.appforge.core.persistence.CheckpointFixtures.NOW;
import static com.appforge.core.persistence.CheckpointFixtures.chain;
import static com.appforge.core.persistence.CheckpointFixtures.result;
import static org.junit.jupiter.api.Assertions.*;

class CheckpointWriterTest {

    private SimpleMeterRegistry meters;
    private EventBus eventBus;
    private RetryPolicy writeRetry;

    @BeforeEach
    void setUp() {
        meters = new SimpleMeterRegistry();
        eventBus = new EventBus();
        writeRetry = new RetryPolicy(Duration.ofMillis(1), Duration.ofMillis(5), Duration.ofSeconds(10),
                Map.of(ErrorKind.TRANSIENT, 3), new Random(1));
    }

    @AfterEach
    void tearDown() {
        eventBus.shutdown();
    }

    /** Store that fails a configurable number of writes before recovering. */
    private static final class FlakyStore implements CheckpointStore {
        private final InMemoryCheckpointStore delegate = new InMemoryCheckpointStore(new SnapshotCodec());
        private final AtomicInteger failuresLeft;
        private final AtomicInteger attempts = new AtomicInteger();

        FlakyStore(int failures) {
            this.failuresLeft = new AtomicInteger(failures);
        }

        @Override
        public void save(String generationId, GraphSnapshot snapshot, long sequence) {
            attempts.incrementAndGet();
            if (failuresLeft.getAndDecrement() > 0) {
                throw new CheckpointException("store unreachable");
            }
            delegate.save(generationId, snapshot, sequence);
        }

        @Override
        public Optional<GraphSnapshot> load(String generationId) {
            return delegate.load(generationId);
        }

        @Override
        public Optional<GraphSnapshot> load(String generationId, long sequence) {
            return delegate.load(generationId, sequence);
        }

        @Override
        public List<Long> listSequences(String generationId) {
            return delegate.listSequences(generationId);
        }

        @Override
        public List<String> listGenerationIds() {
            return delegate.listGenerationIds();
        }
    }

    @Test
    @DisplayName("writes a checkpoint for every transition")
    void writesEveryTransition() {
        var store = new FlakyStore(0);
        var writer = new CheckpointWriter(store, writeRetry, eventBus, new AppforgeMetrics(meters));
        TaskGraph graph = chain("GEN-W");
        writer.write(graph.snapshot());
        graph.addListener(writer);

        graph.markRunning("database", "openai");
        graph.markSucceeded("database", result("openai", "schema.sql"));

        assertEquals(List.of(0L, 1L, 2L), store.listSequences("GEN-W"));
        assertFalse(writer.isDegraded());
        assertEquals(3.0, meters.find("appforge.checkpoint.writes").tag("success", "true").counter().count());
    }

    @Test
    @DisplayName("retries a failed write before giving up")
    void retriesTransientFailures() {
        var store = new FlakyStore(2);
        var writer = new CheckpointWriter(store, writeRetry, eventBus, new AppforgeMetrics(meters));

        writer.write(chain("GEN-F").snapshot());

        assertEquals(3, store.attempts.get());
        assertEquals(List.of(0L), store.listSequences("GEN-F"));
        assertFalse(writer.isDegraded());
    }

    @Test
    @DisplayName("flags degraded durability once writes are exhausted and keeps going")
    void degradesWithoutStopping() {
        var store = new FlakyStore(3);
        var writer = new CheckpointWriter(store, writeRetry, eventBus, new AppforgeMetrics(meters));
        TaskGraph graph = chain("GEN-X");
        graph.addListener(writer);

        graph.markRunning("database", "openai");
        assertTrue(writer.isDegraded());
        assertEquals(TaskState.RUNNING, graph.task("database").state());

        graph.markSucceeded("database", result("openai", "schema.sql"));

        assertEquals(List.of(2L), store.listSequences("GEN-X"));
        assertTrue(writer.isDegraded());
        List<GenerationEvent> events = eventBus.recentEvents("GEN-X");
        assertEquals(1, events.size());
        assertEquals("checkpoint.degraded", events.get(0).eventType());
        assertEquals(1.0, meters.find("appforge.checkpoint.writes").tag("success", "false").counter().count());
    }

    @Test
    @DisplayName("a conflicting checkpoint is not retried and flags degraded durability")
    void conflictIsNotRetried() {
        var store = new FlakyStore(0);
        var writer = new CheckpointWriter(store, writeRetry, eventBus, new AppforgeMetrics(meters));
        TaskGraph graph = chain("GEN-K");
        GraphSnapshot first = graph.snapshot();
        graph.markRunning("database", "openai");
        GraphSnapshot second = new GraphSnapshot("GEN-K", "todo app", first.sequence(),
                graph.snapshot().tasks(), NOW);

        writer.write(first);
        writer.write(second);

        assertEquals(2, store.attempts.get());
        assertTrue(writer.isDegraded());
        assertEquals(TaskState.PENDING, store.load("GEN-K").orElseThrow().tasks().get(0).state());
    }

    @Test
    @DisplayName("refuses a snapshot recording a task as succeeded before its dependency")
    void rejectsInconsistentSnapshot() {
        var store = new FlakyStore(0);
        var writer = new CheckpointWriter(store, writeRetry, eventBus, new AppforgeMetrics(meters));
        List<Task> tasks = chain("GEN-I").tasks();
        Task backend = tasks.get(1).withResult(result("openai", "main.py")).withState(TaskState.SUCCEEDED);
        GraphSnapshot broken = new GraphSnapshot("GEN-I", "todo app", 5,
                List.of(tasks.get(0), backend, tasks.get(2)), NOW);

        var ex = assertThrows(GraphIntegrityException.class, () -> writer.write(broken));
        assertTrue(ex.getMessage().contains("backend"));
        assertTrue(store.listSequences("GEN-I").isEmpty());
    }
}
