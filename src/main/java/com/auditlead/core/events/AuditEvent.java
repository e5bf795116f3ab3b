package com.auditlead.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An event emitted by an agent during a run, consumed by live-status reporters and sinks.
 *
 * @param runId     the run this event belongs to
 * @param sender    name of the publishing agent
 * @param eventType progress, completed or failed
 * @param payload   data for the event type (progress/task for PROGRESS, result for COMPLETED,
 *                  status/error for FAILED)
 * @param timestamp when the event was created
 */
public record AuditEvent(
    String runId,
    String sender,
    EventType eventType,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public AuditEvent {
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static AuditEvent of(String runId, String sender, EventType eventType, Map<String, Object> payload) {
        return new AuditEvent(runId, sender, eventType, payload, Instant.now());
    }
}
