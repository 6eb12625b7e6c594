package com.ashby.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during acquisition or process supervision.
 *
 * @param eventType event type (e.g. "acquisition.started", "process.crashed")
 * @param subject   what the event is about: a capability name or a process id
 * @param processId related process id (nullable for events with no process yet)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record AshbyEvent(
    String eventType,
    String subject,
    String processId,
    Map<String, Object> payload,
    Instant timestamp
) {
    public static AshbyEvent of(String eventType, String subject, String processId, Map<String, Object> payload) {
        return new AshbyEvent(eventType, subject, processId, payload, Instant.now());
    }
}
