package com.appforge.core.model;

/**
 * Overall result of executing a generation graph.
 */
public enum GenerationOutcome {
    /** Every task succeeded. */
    COMPLETED,
    /** At least one task succeeded while others failed or were skipped. */
    PARTIAL,
    /** A root task failed or nothing succeeded. */
    FAILED,
    /** The run was stopped before reaching a terminal graph. */
    CANCELLED
}
