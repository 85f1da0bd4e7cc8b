package com.taskledger.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.Objects;

/**
 * An event that has been derived from a validated command but not yet written.
 * The event log store assigns its sequence number on append.
 */
public record PendingEvent(
    EventType type,
    String workflowId,
    Instant timestamp,
    ObjectNode payload,
    String actor
) {
    public PendingEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(workflowId, "workflowId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(payload, "payload");
    }
}
