package com.tasklane.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A status-change event emitted by the engine, consumed by notification and remediation collaborators.
 *
 * @param eventType  one of the {@link EventTypes} constants (e.g. "run.completed", "task.failed")
 * @param runId      the run this event belongs to (its isolation lane)
 * @param taskId     the task this event relates to (nullable for run- and wave-level events)
 * @param payload    structured key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record EngineEvent(
    String eventType,
    String runId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public EngineEvent {
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }
}
