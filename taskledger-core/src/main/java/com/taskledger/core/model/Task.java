package com.taskledger.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * A unit of work inside a workflow.
 * Derived from the event log; never mutated in place.
 * 
 * Invariants:
 * - id is unique within its workflow
 * - every id in dependsOn references a task of the same workflow
 * - position equals the task's index in the workflow's task order
 */
public record Task(
    // Identity
    String id,
    String workflowId,

    // Basic info
    String title,
    String description,
    TaskStatus status,
    TaskPriority priority,

    // Ordering and dependencies
    int position,
    Set<String> dependsOn,

    // Artifact references
    Set<String> noteIds,
    Set<String> tags,

    // Checklist
    List<TaskStep> steps,

    // Status history
    List<StatusChange> history,

    // Timing
    Instant createdAt,
    Instant startedAt,
    Instant completedAt
) {
    public Task {
        priority = priority == null ? TaskPriority.MEDIUM : priority;
        status = status == null ? TaskStatus.PENDING : status;
        dependsOn = ModelCollections.sortedSet(dependsOn);
        noteIds = ModelCollections.sortedSet(noteIds);
        tags = ModelCollections.sortedSet(tags);
        steps = ModelCollections.list(steps);
        history = ModelCollections.list(history);
    }

    /**
     * Create a new task in PENDING state.
     */
    public static Task create(
            String id,
            String workflowId,
            String title,
            String description,
            TaskPriority priority,
            int position,
            Set<String> dependsOn,
            Set<String> noteIds,
            Set<String> tags,
            List<TaskStep> steps,
            Instant createdAt) {
        return new Task(
            id,
            workflowId,
            title,
            description,
            TaskStatus.PENDING,
            priority,
            position,
            dependsOn,
            noteIds,
            tags,
            steps,
            List.of(),
            createdAt,
            null,
            null
        );
    }

    /**
     * Create a copy moved to a new status, recording the change in the history.
     */
    public Task withStatus(TaskStatus newStatus, String note, Instant at) {
        List<StatusChange> newHistory = new ArrayList<>(history);
        newHistory.add(new StatusChange(status, newStatus, note, at));

        Instant newStartedAt = startedAt;
        if (newStatus == TaskStatus.IN_PROGRESS && startedAt == null) {
            newStartedAt = at;
        }
        Instant newCompletedAt = newStatus.isTerminal()
            ? (status.isTerminal() && completedAt != null ? completedAt : at)
            : null;

        return toBuilder()
            .status(newStatus)
            .history(newHistory)
            .startedAt(newStartedAt)
            .completedAt(newCompletedAt)
            .build();
    }

    public Optional<TaskStep> findStep(String stepId) {
        return steps.stream().filter(step -> step.id().equals(stepId)).findFirst();
    }

    /**
     * Create a copy with the step marked completed.
     *
     * @throws IllegalArgumentException if the task has no such step
     */
    public Task withStepCompleted(String stepId, String evidence, Instant at) {
        List<TaskStep> newSteps = new ArrayList<>(steps.size());
        boolean found = false;
        for (TaskStep step : steps) {
            if (step.id().equals(stepId)) {
                newSteps.add(step.complete(at, evidence));
                found = true;
            } else {
                newSteps.add(step);
            }
        }
        if (!found) {
            throw new IllegalArgumentException("unknown step " + stepId);
        }
        return toBuilder().steps(newSteps).build();
    }

    /**
     * Create a copy with the note linked.
     */
    public Task withNoteLinked(String noteId) {
        Set<String> notes = new TreeSet<>(noteIds);
        notes.add(noteId);
        return toBuilder().noteIds(notes).build();
    }

    /**
     * Create a copy with the note unlinked.
     */
    public Task withNoteUnlinked(String noteId) {
        Set<String> notes = new TreeSet<>(noteIds);
        notes.remove(noteId);
        return toBuilder().noteIds(notes).build();
    }

    /**
     * Builder for creating modified copies.
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private final String id;
        private final String workflowId;
        private String title;
        private String description;
        private TaskStatus status;
        private TaskPriority priority;
        private int position;
        private Set<String> dependsOn;
        private Set<String> noteIds;
        private Set<String> tags;
        private List<TaskStep> steps;
        private List<StatusChange> history;
        private final Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;

        public Builder(Task task) {
            this.id = task.id();
            this.workflowId = task.workflowId();
            this.title = task.title();
            this.description = task.description();
            this.status = task.status();
            this.priority = task.priority();
            this.position = task.position();
            this.dependsOn = task.dependsOn();
            this.noteIds = task.noteIds();
            this.tags = task.tags();
            this.steps = task.steps();
            this.history = task.history();
            this.createdAt = task.createdAt();
            this.startedAt = task.startedAt();
            this.completedAt = task.completedAt();
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder priority(TaskPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder position(int position) {
            this.position = position;
            return this;
        }

        public Builder dependsOn(Set<String> dependsOn) {
            this.dependsOn = dependsOn;
            return this;
        }

        public Builder noteIds(Set<String> noteIds) {
            this.noteIds = noteIds;
            return this;
        }

        public Builder tags(Set<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder steps(List<TaskStep> steps) {
            this.steps = steps;
            return this;
        }

        public Builder history(List<StatusChange> history) {
            this.history = history;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Task build() {
            return new Task(
                id, workflowId, title, description, status, priority,
                position, dependsOn, noteIds, tags, steps, history,
                createdAt, startedAt, completedAt
            );
        }
    }
}
