package com.appforge.core.persistence;

/**
 * Thrown when a sequence that is already stored is written again with a different
 * snapshot. Retrying cannot succeed.
 */
public class CheckpointConflictException extends CheckpointException {

    public CheckpointConflictException(String generationId, long sequence) {
        super("Conflicting checkpoint %d for generation '%s'".formatted(sequence, generationId));
    }
}
