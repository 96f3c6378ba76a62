package com.appforge.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A progress event emitted while planning or executing a generation.
 *
 * @param eventType    event type (e.g. "generation.planned", "task.started", "checkpoint.degraded")
 * @param generationId the generation this event belongs to
 * @param taskId       the task this event relates to (nullable for generation-level events)
 * @param payload      arbitrary key-value data associated with the event
 * @param timestamp    when the event occurred
 */
public record GenerationEvent(
    String eventType,
    String generationId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
