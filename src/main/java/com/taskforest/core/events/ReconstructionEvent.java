package com.taskforest.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An audit event emitted while a reconstruction run executes.
 *
 * @param eventType event type (e.g. "run.started", "edge.invalidated", "match.ambiguous")
 * @param runId     the run this event belongs to
 * @param taskId    the skeleton this event relates to (nullable for run-level events)
 * @param payload   reason codes and other key-value data
 * @param timestamp when the event occurred
 */
public record ReconstructionEvent(
    String eventType,
    String runId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static ReconstructionEvent of(String eventType, String runId, String taskId, Map<String, Object> payload) {
        return new ReconstructionEvent(eventType, runId, taskId, payload, Instant.now());
    }
}
