package com.appforge.core.persistence;

import com.appforge.core.graph.GraphSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON encoding of {@link GraphSnapshot}s for checkpoint storage.
 */
public class SnapshotCodec {

    private final ObjectMapper objectMapper;

    public SnapshotCodec() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String encode(GraphSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new CheckpointException("Failed to serialize snapshot of " + snapshot.generationId(), e);
        }
    }

    public GraphSnapshot decode(String json) {
        try {
            return objectMapper.readValue(json, GraphSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new CheckpointException("Failed to deserialize checkpoint snapshot", e);
        }
    }
}
