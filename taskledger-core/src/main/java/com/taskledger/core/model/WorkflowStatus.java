package com.taskledger.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.taskledger.core.exception.ValidationException;

/**
 * Lifecycle states for a workflow.
 * A workflow is never deleted; it ends in COMPLETED or ARCHIVED.
 */
public enum WorkflowStatus {
    /**
     * Tasks are being added and worked on.
     * Transitions: -> COMPLETED, ARCHIVED
     */
    ACTIVE("active"),

    /**
     * All intended work is done. Can be reopened.
     * Transitions: -> ACTIVE, ARCHIVED
     */
    COMPLETED("completed"),

    /**
     * Frozen. Terminal state; history stays queryable through the log.
     */
    ARCHIVED("archived");

    private final String value;

    WorkflowStatus(String value) {
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
    public static WorkflowStatus fromValue(String value) {
        if (value != null) {
            for (WorkflowStatus status : values()) {
                if (status.value.equals(value)) {
                    return status;
                }
            }
        }
        throw new ValidationException("workflow status", "unknown value '" + value + "'");
    }

    /**
     * Check if this state is terminal (no further transitions).
     */
    public boolean isTerminal() {
        return this == ARCHIVED;
    }

    /**
     * Check if tasks of a workflow in this state may still be scheduled.
     */
    public boolean allowsScheduling() {
        return this == ACTIVE;
    }

    /**
     * Check if this state can transition to the target state.
     */
    public boolean canTransitionTo(WorkflowStatus target) {
        return switch (this) {
            case ACTIVE -> target == COMPLETED || target == ARCHIVED;
            case COMPLETED -> target == ACTIVE || target == ARCHIVED;
            case ARCHIVED -> false;
        };
    }

    @Override
    public String toString() {
        return value;
    }
}
