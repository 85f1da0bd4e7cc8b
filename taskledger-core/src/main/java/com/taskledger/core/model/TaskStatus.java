package com.taskledger.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.taskledger.core.exception.ValidationException;

/**
 * Lifecycle states for a task.
 */
public enum TaskStatus {
    /**
     * Waiting for its dependencies or for someone to pick it up.
     */
    PENDING("pending"),

    /**
     * Being worked on.
     */
    IN_PROGRESS("in_progress"),

    /**
     * Finished. Satisfies dependencies of other tasks.
     */
    COMPLETED("completed"),

    /**
     * Cannot proceed for a reason outside the dependency graph.
     */
    BLOCKED("blocked"),

    /**
     * Deliberately not done. Does not satisfy dependencies.
     */
    SKIPPED("skipped");

    private final String value;

    TaskStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parse a persisted or user-supplied status string.
     *
     * @throws ValidationException if the value is not a known status
     */
    @JsonCreator
    public static TaskStatus fromValue(String value) {
        if (value != null) {
            for (TaskStatus status : values()) {
                if (status.value.equals(value)) {
                    return status;
                }
            }
        }
        throw new ValidationException("task status", "unknown value '" + value + "'");
    }

    /**
     * Check if this state closes the task (it will not be scheduled again).
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == SKIPPED;
    }

    @Override
    public String toString() {
        return value;
    }
}
