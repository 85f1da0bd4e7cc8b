package com.taskledger.core.model;

import java.util.Optional;

/**
 * Types of events that can occur in a workflow store.
 * Events are immutable facts recorded in the event log; the wire name is
 * what appears in the {@code type} field of a log line.
 */
public enum EventType {
    // Workflow lifecycle events
    WORKFLOW_CREATED("WorkflowCreated"),
    WORKFLOW_UPDATED("WorkflowUpdated"),

    // Task events
    TASK_ADDED("TaskAdded"),
    TASK_STATUS_CHANGED("TaskStatusChanged"),
    TASK_UPDATED("TaskUpdated"),
    TASKS_REORDERED("TasksReordered"),
    STEP_COMPLETED("StepCompleted"),
    BATCH_STARTED("BatchStarted"),

    // Artifact relation events
    ARTIFACT_LINKED("ArtifactLinked"),
    ARTIFACT_UNLINKED("ArtifactUnlinked"),

    // Recovery events
    CHECKPOINT_CREATED("CheckpointCreated");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolve a wire name. Empty for types written by a newer version.
     */
    public static Optional<EventType> fromWireName(String wireName) {
        for (EventType type : values()) {
            if (type.wireName.equals(wireName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
