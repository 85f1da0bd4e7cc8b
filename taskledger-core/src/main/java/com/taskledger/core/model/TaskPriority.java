package com.taskledger.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.taskledger.core.exception.ValidationException;

/**
 * Task priority. Informational only; batches are ordered by position.
 */
public enum TaskPriority {
    CRITICAL("critical"),
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String value;

    TaskPriority(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static TaskPriority fromValue(String value) {
        if (value != null) {
            for (TaskPriority priority : values()) {
                if (priority.value.equals(value)) {
                    return priority;
                }
            }
        }
        throw new ValidationException("task priority", "unknown value '" + value + "'");
    }

    @Override
    public String toString() {
        return value;
    }
}
