package com.appforge.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * The last classified error recorded against a task.
 *
 * @param kind       error classification
 * @param message    human-readable description
 * @param provider   provider that produced the error, null when no provider was called
 * @param occurredAt when the error was classified
 */
public record TaskError(
    ErrorKind kind,
    String message,
    String provider,
    Instant occurredAt
) implements Serializable {
}
