package com.taskledger.core.model;

import java.time.Instant;

/**
 * One entry of a task's status history.
 */
public record StatusChange(
    TaskStatus from,
    TaskStatus to,
    String note,
    Instant at
) {}
