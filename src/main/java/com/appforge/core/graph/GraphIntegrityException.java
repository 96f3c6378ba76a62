package com.appforge.core.graph;

/**
 * Raised when a graph is structurally invalid or an operation would break one of its
 * invariants (cycle, unresolved dependency, illegal state transition). Always fatal
 * for the affected generation.
 */
public class GraphIntegrityException extends RuntimeException {

    public GraphIntegrityException(String message) {
        super(message);
    }
}
