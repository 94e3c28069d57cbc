package com.taskwarden.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An instrumentation event emitted by the pool or by a task's completion enforcer.
 *
 * @param eventType event type (e.g. "pool.worker.ready", "completion.continuation")
 * @param taskId    the task this event belongs to (nullable for pool-level events)
 * @param source    emitting component, e.g. the pool name or "completion"
 * @param message   human-readable description
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record TaskwardenEvent(
    String eventType,
    String taskId,
    String source,
    String message,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static TaskwardenEvent of(String eventType, String taskId, String source, String message,
                                     Map<String, Object> payload) {
        return new TaskwardenEvent(eventType, taskId, source, message,
                payload != null ? payload : Map.of(), Instant.now());
    }
}
