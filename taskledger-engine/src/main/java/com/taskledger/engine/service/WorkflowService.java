package com.taskledger.engine.service;

import com.taskledger.core.model.Checkpoint;
import com.taskledger.core.model.CheckpointReason;
import com.taskledger.core.model.CorruptionReport;
import com.taskledger.core.model.Task;
import com.taskledger.core.model.TaskPriority;
import com.taskledger.core.model.TaskStatus;
import com.taskledger.core.model.TaskStep;
import com.taskledger.core.model.Workflow;
import com.taskledger.core.model.WorkflowStatus;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Mutation and query API of a task ledger.
 *
 * Every mutation is validated against the current materialized state, turned into
 * exactly one event, and appended durably before it returns. A mutation that fails
 * validation appends nothing.
 */
public interface WorkflowService {

    // ========== Workflows ==========

    /**
     * Create a new, empty workflow.
     *
     * @param request title, optional description, project and tags
     * @return The created workflow
     */
    Workflow createWorkflow(CreateWorkflowRequest request);

    /**
     * Change a workflow's title, description, tags or status.
     *
     * @param workflowId The workflow ID
     * @param patch Fields to change; null fields are kept
     * @return The updated workflow
     */
    Workflow updateWorkflow(String workflowId, WorkflowPatch patch);

    /**
     * Get workflow by ID.
     *
     * @param workflowId The workflow ID
     * @return The materialized workflow
     */
    Workflow getWorkflow(String workflowId);

    /**
     * Query workflows, most recently updated first.
     *
     * @param filter The filter; {@link WorkflowFilter#all()} matches everything
     * @return Matching workflows
     */
    List<Workflow> listWorkflows(WorkflowFilter filter);

    // ========== Tasks ==========

    /**
     * Append a task to the end of a workflow's task order.
     *
     * @param workflowId The workflow ID
     * @param request The task to add
     * @return The created task
     */
    Task addTask(String workflowId, AddTaskRequest request);

    /**
     * Move a task to a new status, recording the note in its history.
     * Setting the status it already has appends nothing.
     *
     * @param workflowId The workflow ID
     * @param taskId The task ID
     * @param status The new status
     * @param note Optional note for the history entry
     * @return The task after the change
     */
    Task setTaskStatus(String workflowId, String taskId, TaskStatus status, String note);

    /**
     * Patch a task. Dependency changes are cycle-checked.
     *
     * @param workflowId The workflow ID
     * @param taskId The task ID
     * @param patch Fields to change; null fields are kept
     * @return The task after the change
     */
    Task updateTask(String workflowId, String taskId, TaskPatch patch);

    /**
     * Add one dependency edge: {@code taskId} will wait for {@code dependsOnTaskId}.
     *
     * @return The task after the change
     */
    Task addDependency(String workflowId, String taskId, String dependsOnTaskId);

    /**
     * Remove one dependency edge.
     *
     * @return The task after the change
     */
    Task removeDependency(String workflowId, String taskId, String dependsOnTaskId);

    /**
     * Replace the task order with a permutation of the workflow's task ids.
     * Written as a single event, so readers see either the old or the new order.
     *
     * @param workflowId The workflow ID
     * @param order Every task id of the workflow exactly once
     * @return The workflow with rewritten positions
     */
    Workflow reorderTasks(String workflowId, List<String> order);

    /**
     * Link a knowledge-base note to a task.
     */
    Task linkArtifact(String workflowId, String taskId, String noteId);

    /**
     * Unlink a knowledge-base note from a task.
     */
    Task unlinkArtifact(String workflowId, String taskId, String noteId);

    /**
     * Mark one step of a task done. Completing a step that is already done
     * appends nothing.
     *
     * @param workflowId The workflow ID
     * @param taskId The task ID
     * @param stepId The step ID
     * @param evidence Optional proof the step was done (command output, commit, link)
     * @return The step after the change
     */
    TaskStep completeStep(String workflowId, String taskId, String stepId, String evidence);

    /**
     * Query a workflow's tasks in position order.
     *
     * @param workflowId The workflow ID
     * @param filter The filter; {@link TaskFilter#all()} matches everything
     * @return Matching tasks
     */
    List<Task> getTasks(String workflowId, TaskFilter filter);

    // ========== Scheduling ==========

    /**
     * Pending tasks whose dependencies are all completed, in position order,
     * capped at the configured default batch size.
     *
     * @param workflowId The workflow ID
     * @return The batch; empty when the workflow is not active
     */
    List<Task> getNextBatch(String workflowId);

    /**
     * Like {@link #getNextBatch(String)}, capped at {@code limit} tasks.
     * 0 means the configured default batch size, which is uncapped unless set.
     */
    List<Task> getNextBatch(String workflowId, int limit);

    /**
     * Move the next batch to IN_PROGRESS with a single event.
     *
     * @param workflowId The workflow ID
     * @param limit Maximum batch size; 0 means the configured default
     * @return The started tasks; empty (and nothing appended) if no task is eligible
     */
    List<Task> startNextBatch(String workflowId, int limit);

    // ========== Checkpoints ==========

    /**
     * Record a named pointer to the current end of the log.
     *
     * @param workflowId The workflow ID
     * @param notes Free-form notes
     * @param reason Why the checkpoint is taken
     * @return The checkpoint
     */
    Checkpoint createCheckpoint(String workflowId, String notes, CheckpointReason reason);

    /**
     * Rebuild a workflow as it was at a checkpoint. Read-only: the log and the live
     * state are not touched.
     *
     * @param checkpointId The checkpoint ID
     * @return The workflow as of the checkpoint's log position
     */
    Workflow restoreCheckpoint(String checkpointId);

    /**
     * Checkpoints of a workflow, oldest first.
     */
    List<Checkpoint> listCheckpoints(String workflowId);

    /**
     * Most recent checkpoint of a workflow.
     */
    Optional<Checkpoint> getLatestCheckpoint(String workflowId);

    // ========== Status ==========

    /**
     * Progress, blockers, next actions and recent activity of a workflow.
     */
    WorkflowStatusSummary getWorkflowStatus(String workflowId);

    /**
     * Lines of the log that could not be decoded on the last full read.
     */
    List<CorruptionReport> getCorruptionReports();

    /**
     * Request to create a workflow.
     */
    record CreateWorkflowRequest(
        String title,
        String description,
        String project,
        Set<String> tags
    ) {
        public static CreateWorkflowRequest of(String title) {
            return new CreateWorkflowRequest(title, null, null, Set.of());
        }
    }

    /**
     * Changes to a workflow. Null fields are left as they are.
     */
    record WorkflowPatch(
        String title,
        String description,
        WorkflowStatus status,
        Set<String> tags
    ) {
        public static WorkflowPatch status(WorkflowStatus status) {
            return new WorkflowPatch(null, null, status, null);
        }
    }

    /**
     * Request to add a task.
     */
    record AddTaskRequest(
        String title,
        String description,
        String priority,
        List<String> dependsOn,
        Set<String> noteIds,
        Set<String> tags,
        List<StepRequest> steps
    ) {
        public static AddTaskRequest of(String title, String... dependsOn) {
            return new AddTaskRequest(title, null, null, List.of(dependsOn), Set.of(), Set.of(), List.of());
        }

        public AddTaskRequest withSteps(StepRequest... steps) {
            return new AddTaskRequest(title, description, priority, dependsOn, noteIds, tags, List.of(steps));
        }
    }

    /**
     * One checklist step of a new task.
     */
    record StepRequest(
        String description,
        Integer estimatedMinutes,
        String verificationCommand
    ) {
        public static StepRequest of(String description) {
            return new StepRequest(description, null, null);
        }
    }

    /**
     * Changes to a task. Null fields are left as they are; status and priority are
     * given as their wire values ("in_progress", "high") and validated.
     */
    record TaskPatch(
        String title,
        String description,
        String priority,
        String status,
        String note,
        Set<String> dependsOn,
        Set<String> noteIds,
        Set<String> tags
    ) {
        public static TaskPatch status(String status, String note) {
            return new TaskPatch(null, null, null, status, note, null, null, null);
        }

        public static TaskPatch dependsOn(Set<String> dependsOn) {
            return new TaskPatch(null, null, null, null, null, dependsOn, null, null);
        }

        public boolean isEmpty() {
            return title == null && description == null && priority == null && status == null
                && note == null && dependsOn == null && noteIds == null && tags == null;
        }
    }

    /**
     * Query criteria for workflows. Null fields do not filter.
     * {@code search} matches the title or description, ignoring case.
     * {@code tags} matches workflows carrying at least one of the tags.
     */
    record WorkflowFilter(
        Set<WorkflowStatus> statuses,
        String project,
        Set<String> tags,
        String search
    ) {
        public static WorkflowFilter all() {
            return new WorkflowFilter(null, null, null, null);
        }

        public static WorkflowFilter byStatus(WorkflowStatus... statuses) {
            return new WorkflowFilter(Set.of(statuses), null, null, null);
        }

        public boolean matches(Workflow workflow) {
            if (statuses != null && !statuses.isEmpty() && !statuses.contains(workflow.status())) {
                return false;
            }
            if (project != null && !project.equals(workflow.project())) {
                return false;
            }
            if (tags != null && !tags.isEmpty() && workflow.tags().stream().noneMatch(tags::contains)) {
                return false;
            }
            if (search != null && !search.isBlank()) {
                String needle = search.toLowerCase(Locale.ROOT);
                boolean inTitle = workflow.title() != null
                    && workflow.title().toLowerCase(Locale.ROOT).contains(needle);
                boolean inDescription = workflow.description() != null
                    && workflow.description().toLowerCase(Locale.ROOT).contains(needle);
                return inTitle || inDescription;
            }
            return true;
        }
    }

    /**
     * Query criteria for tasks. Null fields do not filter.
     * {@code hasBlockers} selects tasks that are blocked or have dependencies
     * (or, when false, neither). {@code search} matches the title or description,
     * ignoring case.
     */
    record TaskFilter(
        Set<TaskStatus> statuses,
        Set<TaskPriority> priorities,
        Boolean hasBlockers,
        String search
    ) {
        public static TaskFilter all() {
            return new TaskFilter(null, null, null, null);
        }

        public static TaskFilter byStatus(TaskStatus... statuses) {
            return new TaskFilter(Set.of(statuses), null, null, null);
        }

        public boolean matches(Task task) {
            if (statuses != null && !statuses.isEmpty() && !statuses.contains(task.status())) {
                return false;
            }
            if (priorities != null && !priorities.isEmpty() && !priorities.contains(task.priority())) {
                return false;
            }
            if (hasBlockers != null) {
                boolean blocked = task.status() == TaskStatus.BLOCKED || !task.dependsOn().isEmpty();
                if (blocked != hasBlockers) {
                    return false;
                }
            }
            if (search != null && !search.isBlank()) {
                String needle = search.toLowerCase(Locale.ROOT);
                boolean inTitle = task.title() != null
                    && task.title().toLowerCase(Locale.ROOT).contains(needle);
                boolean inDescription = task.description() != null
                    && task.description().toLowerCase(Locale.ROOT).contains(needle);
                return inTitle || inDescription;
            }
            return true;
        }
    }
}
