package com.appforge.core.persistence;

import com.appforge.core.graph.GraphSnapshot;
import com.appforge.core.graph.TaskGraph;
import com.appforge.core.model.TaskState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.appforge.core.persistence.CheckpointFixtures.chain;
import static com.appforge.core.persistence.CheckpointFixtures.result;
import static org.junit.jupiter.api.Assertions.*;

class InMemoryCheckpointStoreTest {

    private final InMemoryCheckpointStore store = new InMemoryCheckpointStore(new SnapshotCodec());

    @Test
    @DisplayName("keeps every sequence and returns the latest by default")
    void latestAndHistory() {
        TaskGraph graph = chain("GEN-1");
        graph.addListener(t -> store.save(t.generationId(), t.snapshot(), t.sequence()));
        store.save("GEN-1", graph.snapshot(), graph.sequence());

        graph.markRunning("database", "openai");
        graph.markSucceeded("database", result("openai", "schema.sql"));

        assertEquals(List.of(0L, 1L, 2L), store.listSequences("GEN-1"));
        GraphSnapshot latest = store.load("GEN-1").orElseThrow();
        assertEquals(2, latest.sequence());
        assertEquals(TaskState.SUCCEEDED, latest.tasks().get(0).state());
        assertEquals("content of schema.sql", latest.tasks().get(0).result().files().get("schema.sql"));

        GraphSnapshot first = store.load("GEN-1", 1).orElseThrow();
        assertEquals(TaskState.RUNNING, first.tasks().get(0).state());
        assertEquals("openai", first.tasks().get(0).assignedProvider());
    }

    @Test
    @DisplayName("rewriting the same snapshot under an existing sequence is a no-op")
    void idempotentSave() {
        GraphSnapshot original = chain("GEN-2").snapshot();
        store.save("GEN-2", original, 0);

        assertDoesNotThrow(() -> store.save("GEN-2", original, 0));
        assertEquals(List.of(0L), store.listSequences("GEN-2"));
    }

    @Test
    @DisplayName("a different snapshot under an existing sequence is a conflict and keeps the original")
    void conflictingSave() {
        TaskGraph graph = chain("GEN-3");
        store.save("GEN-3", graph.snapshot(), 0);

        graph.markRunning("database", "openai");
        GraphSnapshot other = graph.snapshot();
        var ex = assertThrows(CheckpointConflictException.class, () -> store.save("GEN-3", other, 0));

        assertTrue(ex.getMessage().contains("GEN-3"));
        assertEquals(TaskState.PENDING, store.load("GEN-3").orElseThrow().tasks().get(0).state());
    }

    @Test
    @DisplayName("unknown generations have no checkpoints")
    void unknownGeneration() {
        assertEquals(Optional.empty(), store.load("GEN-X"));
        assertEquals(Optional.empty(), store.load("GEN-X", 3));
        assertTrue(store.listSequences("GEN-X").isEmpty());
    }

    @Test
    @DisplayName("lists generation ids sorted")
    void listsGenerations() {
        store.save("GEN-B", chain("GEN-B").snapshot(), 0);
        store.save("GEN-A", chain("GEN-A").snapshot(), 0);
        assertEquals(List.of("GEN-A", "GEN-B"), store.listGenerationIds());
        assertTrue(store.isAvailable());
    }
}
