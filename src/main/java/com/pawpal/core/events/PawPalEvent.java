package com.pawpal.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by the planner or the completion channel.
 *
 * @param eventType event type (e.g. "plan.generated", "conflicts.detected", "task.completed", "task.recurred")
 * @param ownerId   the owner whose aggregate the event concerns
 * @param taskId    the task this event relates to (nullable for owner-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record PawPalEvent(
    String eventType,
    String ownerId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static PawPalEvent of(String eventType, String ownerId, String taskId, Map<String, Object> payload) {
        return new PawPalEvent(eventType, ownerId, taskId, payload, Instant.now());
    }
}
