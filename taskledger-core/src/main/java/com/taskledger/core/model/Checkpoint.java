package com.taskledger.core.model;

import java.time.Instant;

/**
 * A named pointer to a position in the event log.
 * Restoring a checkpoint replays the log up to and including {@code logPosition};
 * it never modifies the log.
 */
public record Checkpoint(
    String id,
    String workflowId,
    Instant timestamp,
    String notes,
    CheckpointReason reason,
    long logPosition,
    boolean snapshotEmbedded
) {}
