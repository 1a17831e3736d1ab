package com.taskforge.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by background tasks and spawned sessions, used for SSE streaming
 * and in-process waiters.
 *
 * @param eventType event type (e.g. "session.started", "task.progress")
 * @param runId     the task id or session run id this event belongs to
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record TaskforgeEvent(
    String eventType,
    String runId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static TaskforgeEvent of(String eventType, String runId, Map<String, Object> payload) {
        return new TaskforgeEvent(eventType, runId, payload == null ? Map.of() : payload, Instant.now());
    }
}
