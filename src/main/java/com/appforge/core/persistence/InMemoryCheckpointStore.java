package com.appforge.core.persistence;

import com.appforge.core.graph.GraphSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Checkpoint store kept in process memory. Snapshots are stored encoded, so a loaded
 * snapshot is a copy that shares nothing with the live graph. Not durable across restarts.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, NavigableMap<Long, String>> checkpoints = new ConcurrentHashMap<>();
    private final SnapshotCodec codec;

    public InMemoryCheckpointStore(SnapshotCodec codec) {
        this.codec = codec;
    }

    @Override
    public void save(String generationId, GraphSnapshot snapshot, long sequence) {
        String json = codec.encode(snapshot);
        String existing = checkpoints.computeIfAbsent(generationId, k -> new ConcurrentSkipListMap<>())
                .putIfAbsent(sequence, json);
        if (existing != null && !existing.equals(json)) {
            throw new CheckpointConflictException(generationId, sequence);
        }
    }

    @Override
    public Optional<GraphSnapshot> load(String generationId) {
        NavigableMap<Long, String> history = checkpoints.get(generationId);
        if (history == null || history.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(codec.decode(history.lastEntry().getValue()));
    }

    @Override
    public Optional<GraphSnapshot> load(String generationId, long sequence) {
        NavigableMap<Long, String> history = checkpoints.get(generationId);
        if (history == null || !history.containsKey(sequence)) {
            return Optional.empty();
        }
        return Optional.of(codec.decode(history.get(sequence)));
    }

    @Override
    public List<Long> listSequences(String generationId) {
        NavigableMap<Long, String> history = checkpoints.get(generationId);
        return history == null ? List.of() : new ArrayList<>(history.keySet());
    }

    @Override
    public List<String> listGenerationIds() {
        return checkpoints.keySet().stream().sorted().toList();
    }
}
