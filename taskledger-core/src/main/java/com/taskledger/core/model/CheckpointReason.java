package com.taskledger.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.taskledger.core.exception.ValidationException;

/**
 * Why a checkpoint was taken.
 */
public enum CheckpointReason {
    MANUAL("manual"),
    AUTO("auto"),
    SESSION_END("session_end"),
    PHASE_COMPLETE("phase_complete");

    private final String value;

    CheckpointReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static CheckpointReason fromValue(String value) {
        if (value != null) {
            for (CheckpointReason reason : values()) {
                if (reason.value.equals(value)) {
                    return reason;
                }
            }
        }
        throw new ValidationException("checkpoint reason", "unknown value '" + value + "'");
    }

    @Override
    public String toString() {
        return value;
    }
}
