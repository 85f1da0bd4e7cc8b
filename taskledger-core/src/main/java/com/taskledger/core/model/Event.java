package com.taskledger.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Optional;

/**
 * Immutable record of something that happened in a workflow store.
 * The log of these is the only source of truth; workflows and tasks are folded from it.
 * 
 * Invariants:
 * - sequence is strictly increasing within one log
 * - Events are never deleted or modified
 * - type is kept as the raw wire name so events written by newer versions survive a read
 */
public record Event(
    // Ordering
    long sequence,
    Instant timestamp,

    // Event data
    String type,
    String workflowId,
    JsonNode payload,

    // Actor (who/what caused this event)
    String actor
) {
    /**
     * Actor recorded on events caused by API calls.
     */
    public static final String ACTOR_USER = "user";

    /**
     * Commit a pending event at the given log position.
     */
    public static Event committed(long sequence, PendingEvent pending) {
        return new Event(
            sequence,
            pending.timestamp(),
            pending.type().wireName(),
            pending.workflowId(),
            pending.payload(),
            pending.actor()
        );
    }

    /**
     * The event type, if this version of the engine knows it.
     */
    public Optional<EventType> knownType() {
        return EventType.fromWireName(type);
    }

    /**
     * Read a text field of the payload, or null when absent.
     */
    public String payloadText(String field) {
        if (payload == null) {
            return null;
        }
        JsonNode node = payload.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
