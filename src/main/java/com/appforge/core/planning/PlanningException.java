package com.appforge.core.planning;

/**
 * Thrown when a requirement cannot be turned into a task graph: it is empty or too
 * vague, or the constraints ask for something unsupported.
 */
public class PlanningException extends RuntimeException {

    public PlanningException(String message) {
        super(message);
    }
}
