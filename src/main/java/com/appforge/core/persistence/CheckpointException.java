package com.appforge.core.persistence;

/**
 * Thrown when a checkpoint cannot be written to or read from the store.
 */
public class CheckpointException extends RuntimeException {

    public CheckpointException(String message) {
        super(message);
    }

    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
