package com.appforge.core.persistence;

import com.appforge.core.graph.GraphSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Append-only store of graph snapshots keyed by generation id and transition sequence.
 */
public interface CheckpointStore {

    /**
     * Persists a snapshot. Writing the same snapshot under the same generation and
     * sequence twice is a no-op.
     *
     * @throws CheckpointConflictException if that sequence already holds a different snapshot
     * @throws CheckpointException         if the store is unreachable
     */
    void save(String generationId, GraphSnapshot snapshot, long sequence);

    /** Latest snapshot of a generation, empty if none was ever written. */
    Optional<GraphSnapshot> load(String generationId);

    /** Snapshot written at an exact sequence. */
    Optional<GraphSnapshot> load(String generationId, long sequence);

    /** Sequences recorded for a generation, ascending. */
    List<Long> listSequences(String generationId);

    /** Every generation id with at least one checkpoint, sorted. */
    List<String> listGenerationIds();

    default boolean isAvailable() {
        return true;
    }
}
