package com.taskledger.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Materialized state of one workflow, folded from the event log.
 * A cache-only structure: it can always be discarded and rebuilt by replay.
 * 
 * Invariants:
 * - taskIds holds every key of tasks exactly once, in position order
 * - relatedNoteIds is the union of the tasks' noteIds
 * - updatedAt is not earlier than the timestamp of the last applied event
 * - lastSequence is the sequence of the last applied event
 */
public record Workflow(
    // Identity
    String id,

    // Basic info
    String title,
    String description,
    String project,
    WorkflowStatus status,

    // Tasks
    List<String> taskIds,
    Map<String, Task> tasks,

    // Relations
    Set<String> relatedNoteIds,
    Set<String> tags,

    // Recovery
    List<Checkpoint> checkpoints,
    int batchNumber,

    // Timing
    Instant createdAt,
    Instant updatedAt,

    // Log position
    long lastSequence
) {
    public static final String DEFAULT_PROJECT = "default";

    public Workflow {
        project = project == null || project.isBlank() ? DEFAULT_PROJECT : project;
        status = status == null ? WorkflowStatus.ACTIVE : status;
        taskIds = ModelCollections.list(taskIds);
        tasks = ModelCollections.orderedMap(tasks);
        relatedNoteIds = ModelCollections.sortedSet(relatedNoteIds);
        tags = ModelCollections.sortedSet(tags);
        checkpoints = ModelCollections.list(checkpoints);
    }

    /**
     * Create a new, empty workflow in ACTIVE state.
     */
    public static Workflow create(
            String id,
            String title,
            String description,
            String project,
            Set<String> tags,
            Instant createdAt,
            long sequence) {
        return new Workflow(
            id,
            title,
            description,
            project,
            WorkflowStatus.ACTIVE,
            List.of(),
            Map.of(),
            Set.of(),
            tags,
            List.of(),
            0,
            createdAt,
            createdAt,
            sequence
        );
    }

    /**
     * Get a task by id.
     */
    public Optional<Task> findTask(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    /**
     * Tasks in position order.
     */
    public List<Task> orderedTasks() {
        List<Task> ordered = new ArrayList<>(taskIds.size());
        for (String taskId : taskIds) {
            ordered.add(tasks.get(taskId));
        }
        return ordered;
    }

    /**
     * Completion counters over all tasks.
     */
    public Progress progress() {
        int completed = 0;
        int skipped = 0;
        for (Task task : tasks.values()) {
            if (task.status() == TaskStatus.COMPLETED) {
                completed++;
            } else if (task.status() == TaskStatus.SKIPPED) {
                skipped++;
            }
        }
        return Progress.of(tasks.size(), completed, skipped);
    }

    /**
     * Most recent checkpoint, if any.
     */
    public Optional<Checkpoint> latestCheckpoint() {
        return checkpoints.isEmpty()
            ? Optional.empty()
            : Optional.of(checkpoints.get(checkpoints.size() - 1));
    }

    /**
     * Create a copy with the task appended at the end of the order.
     */
    public Workflow withTaskAdded(Task task) {
        List<String> newTaskIds = new ArrayList<>(taskIds);
        newTaskIds.add(task.id());
        Map<String, Task> newTasks = new LinkedHashMap<>(tasks);
        newTasks.put(task.id(), task.toBuilder().position(newTaskIds.size() - 1).build());
        return toBuilder().taskIds(newTaskIds).tasks(newTasks).build().withRelatedNotesRecomputed();
    }

    /**
     * Create a copy with an existing task replaced.
     */
    public Workflow withTask(Task task) {
        Map<String, Task> newTasks = new LinkedHashMap<>(tasks);
        newTasks.put(task.id(), task);
        return toBuilder().tasks(newTasks).build().withRelatedNotesRecomputed();
    }

    /**
     * Create a copy with the tasks rearranged into the given order.
     * Positions are rewritten to match.
     */
    public Workflow withTaskOrder(List<String> order) {
        Map<String, Task> newTasks = new LinkedHashMap<>();
        for (int i = 0; i < order.size(); i++) {
            Task task = tasks.get(order.get(i));
            newTasks.put(task.id(), task.toBuilder().position(i).build());
        }
        return toBuilder().taskIds(order).tasks(newTasks).build();
    }

    /**
     * Create a copy with the checkpoint recorded.
     */
    public Workflow withCheckpoint(Checkpoint checkpoint) {
        List<Checkpoint> newCheckpoints = new ArrayList<>(checkpoints);
        newCheckpoints.add(checkpoint);
        return toBuilder().checkpoints(newCheckpoints).build();
    }

    /**
     * Create a copy that records an applied event: updatedAt never moves backwards.
     */
    public Workflow touched(Instant eventTime, long sequence) {
        Instant newUpdatedAt = updatedAt == null || eventTime.isAfter(updatedAt) ? eventTime : updatedAt;
        return toBuilder().updatedAt(newUpdatedAt).lastSequence(sequence).build();
    }

    private Workflow withRelatedNotesRecomputed() {
        Set<String> related = new TreeSet<>();
        for (Task task : tasks.values()) {
            related.addAll(task.noteIds());
        }
        if (related.equals(relatedNoteIds)) {
            return this;
        }
        return toBuilder().relatedNoteIds(related).build();
    }

    /**
     * Builder for creating modified copies.
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private final String id;
        private String title;
        private String description;
        private final String project;
        private WorkflowStatus status;
        private List<String> taskIds;
        private Map<String, Task> tasks;
        private Set<String> relatedNoteIds;
        private Set<String> tags;
        private List<Checkpoint> checkpoints;
        private int batchNumber;
        private final Instant createdAt;
        private Instant updatedAt;
        private long lastSequence;

        public Builder(Workflow workflow) {
            this.id = workflow.id();
            this.title = workflow.title();
            this.description = workflow.description();
            this.project = workflow.project();
            this.status = workflow.status();
            this.taskIds = workflow.taskIds();
            this.tasks = workflow.tasks();
            this.relatedNoteIds = workflow.relatedNoteIds();
            this.tags = workflow.tags();
            this.checkpoints = workflow.checkpoints();
            this.batchNumber = workflow.batchNumber();
            this.createdAt = workflow.createdAt();
            this.updatedAt = workflow.updatedAt();
            this.lastSequence = workflow.lastSequence();
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder status(WorkflowStatus status) {
            this.status = status;
            return this;
        }

        public Builder taskIds(List<String> taskIds) {
            this.taskIds = taskIds;
            return this;
        }

        public Builder tasks(Map<String, Task> tasks) {
            this.tasks = tasks;
            return this;
        }

        public Builder relatedNoteIds(Set<String> relatedNoteIds) {
            this.relatedNoteIds = relatedNoteIds;
            return this;
        }

        public Builder tags(Set<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder checkpoints(List<Checkpoint> checkpoints) {
            this.checkpoints = checkpoints;
            return this;
        }

        public Builder batchNumber(int batchNumber) {
            this.batchNumber = batchNumber;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder lastSequence(long lastSequence) {
            this.lastSequence = lastSequence;
            return this;
        }

        public Workflow build() {
            return new Workflow(
                id, title, description, project, status,
                taskIds, tasks, relatedNoteIds, tags,
                checkpoints, batchNumber, createdAt, updatedAt, lastSequence
            );
        }
    }
}
