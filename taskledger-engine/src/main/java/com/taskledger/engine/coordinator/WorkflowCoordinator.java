package com.taskledger.engine.coordinator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskledger.core.exception.CycleException;
import com.taskledger.core.exception.NotFoundException;
import com.taskledger.core.exception.ValidationException;
import com.taskledger.core.model.Checkpoint;
import com.taskledger.core.model.CheckpointReason;
import com.taskledger.core.model.CorruptionReport;
import com.taskledger.core.model.Event;
import com.taskledger.core.model.EventType;
import com.taskledger.core.model.Ids;
import com.taskledger.core.model.PendingEvent;
import com.taskledger.core.model.Task;
import com.taskledger.core.model.TaskPriority;
import com.taskledger.core.model.TaskStatus;
import com.taskledger.core.model.TaskStep;
import com.taskledger.core.model.Workflow;
import com.taskledger.core.model.WorkflowStatus;
import com.taskledger.core.repository.EventLogStore;
import com.taskledger.engine.checkpoint.CheckpointManager;
import com.taskledger.engine.config.TaskLedgerProperties;
import com.taskledger.engine.event.EventPayloads;
import com.taskledger.engine.logging.LoggingContext;
import com.taskledger.engine.materializer.StateMaterializer;
import com.taskledger.engine.materializer.WorkflowProjection;
import com.taskledger.engine.metrics.LedgerMetrics;
import com.taskledger.engine.persistence.SnapshotIndex;
import com.taskledger.engine.scheduling.CycleDetector;
import com.taskledger.engine.scheduling.DependencyResolver;
import com.taskledger.engine.service.Validation;
import com.taskledger.engine.service.WorkflowService;
import com.taskledger.engine.service.WorkflowStatusSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Coordinator for one task ledger store.
 * Validates commands against the materialized state, turns each into a single event,
 * and keeps the projection current as events are committed.
 *
 * This is the handle every operation goes through; there is no global store.
 */
public class WorkflowCoordinator implements WorkflowService, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCoordinator.class);

    static final int STATUS_RECENT_EVENTS = 5;
    static final int STATUS_NEXT_ACTIONS = 3;

    private final EventLogStore store;
    private final WorkflowProjection projection;
    private final EventWriter writer;
    private final CheckpointManager checkpoints;
    private final DependencyResolver resolver = new DependencyResolver();
    private final CycleDetector cycleDetector = new CycleDetector();
    private final TaskLedgerProperties properties;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * @param snapshotIndex sidecar index, or null to always replay the full log
     */
    public WorkflowCoordinator(
            EventLogStore store,
            SnapshotIndex snapshotIndex,
            ObjectMapper objectMapper,
            TaskLedgerProperties properties,
            LedgerMetrics metrics,
            Clock clock) {
        this.store = store;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;

        StateMaterializer materializer = new StateMaterializer();
        this.projection = new WorkflowProjection(store, materializer, snapshotIndex, properties.snapshotInterval());
        this.writer = new EventWriter(store, projection, metrics, properties.lockTimeout());
        this.checkpoints = new CheckpointManager(
            store, projection, materializer, writer, objectMapper, clock, properties.checkpointSnapshots());

        rebuild();
    }

    /**
     * Drop the materialized state and rebuild it from the log.
     */
    public void rebuild() {
        projection.reload();
        List<CorruptionReport> corruptions = projection.corruptions();
        if (!corruptions.isEmpty()) {
            log.warn("Event log has {} corrupt lines; they are skipped", corruptions.size());
        }
        metrics.corruptLines(corruptions.size());
        metrics.workflowCounts(projection.all());
    }

    // ========== Workflows ==========

    @Override
    public Workflow createWorkflow(CreateWorkflowRequest request) {
        Objects.requireNonNull(request, "request");
        String title = Validation.requireText("title", request.title(), Validation.MAX_TITLE_LENGTH);
        String description = Validation.optionalText("description", request.description(), Validation.MAX_TEXT_LENGTH);
        String project = request.project() == null || request.project().isBlank()
            ? Workflow.DEFAULT_PROJECT
            : Validation.requireId("project", request.project());
        Set<String> tags = Validation.ids("tags", request.tags());
        String workflowId = Ids.workflowId();

        try (var ctx = LoggingContext.forWorkflow(workflowId, "createWorkflow")) {
            writer.write("createWorkflow", () -> {
                if (projection.find(workflowId).isPresent()) {
                    throw new ValidationException("workflowId", "'" + workflowId + "' is already in use");
                }
                return event(EventType.WORKFLOW_CREATED, workflowId,
                    EventPayloads.workflowCreated(title, description, project, tags));
            });
            log.info("Created workflow {} '{}' in project {}", workflowId, title, project);
            metrics.workflowCounts(projection.all());
            return requireWorkflow(workflowId);
        }
    }

    @Override
    public Workflow updateWorkflow(String workflowId, WorkflowPatch patch) {
        Objects.requireNonNull(patch, "patch");
        String title = patch.title() == null
            ? null
            : Validation.requireText("title", patch.title(), Validation.MAX_TITLE_LENGTH);
        String description = Validation.optionalText("description", patch.description(), Validation.MAX_TEXT_LENGTH);
        Set<String> tags = Validation.optionalIds("tags", patch.tags());

        try (var ctx = LoggingContext.forWorkflow(workflowId, "updateWorkflow")) {
            writer.write("updateWorkflow", () -> {
                Workflow workflow = requireMutable(workflowId);
                WorkflowStatus status = patch.status();
                if (status == workflow.status()) {
                    status = null;
                } else if (status != null && !workflow.status().canTransitionTo(status)) {
                    throw new ValidationException("status",
                        "cannot move workflow from " + workflow.status() + " to " + status);
                }
                if (title == null && description == null && status == null && tags == null) {
                    return null;
                }
                return event(EventType.WORKFLOW_UPDATED, workflowId,
                    EventPayloads.workflowUpdated(title, description, status, tags));
            });
            Workflow updated = requireWorkflow(workflowId);
            log.info("Updated workflow {} (status={})", workflowId, updated.status());
            metrics.workflowCounts(projection.all());
            return updated;
        }
    }

    @Override
    public Workflow getWorkflow(String workflowId) {
        return requireWorkflow(workflowId);
    }

    @Override
    public List<Workflow> listWorkflows(WorkflowFilter filter) {
        WorkflowFilter effective = filter == null ? WorkflowFilter.all() : filter;
        return projection.all().stream()
            .filter(effective::matches)
            .sorted(Comparator.comparing(Workflow::updatedAt).reversed().thenComparing(Workflow::id))
            .collect(Collectors.toList());
    }

    // ========== Tasks ==========

    @Override
    public Task addTask(String workflowId, AddTaskRequest request) {
        Objects.requireNonNull(request, "request");
        String title = Validation.requireText("title", request.title(), Validation.MAX_TITLE_LENGTH);
        String description = Validation.optionalText("description", request.description(), Validation.MAX_TEXT_LENGTH);
        TaskPriority priority = request.priority() == null
            ? TaskPriority.MEDIUM
            : TaskPriority.fromValue(request.priority());
        Set<String> dependsOn = Validation.ids("dependsOn", request.dependsOn());
        Set<String> noteIds = Validation.ids("noteIds", request.noteIds());
        Set<String> tags = Validation.ids("tags", request.tags());
        List<TaskStep> steps = steps(request.steps());
        String taskId = Ids.taskId();

        try (var ctx = LoggingContext.forTask(workflowId, taskId, "addTask")) {
            writer.write("addTask", () -> {
                Workflow workflow = requireMutable(workflowId);
                if (workflow.tasks().containsKey(taskId)) {
                    throw new ValidationException("taskId", "'" + taskId + "' is already in use");
                }
                // A new task has no dependents yet, so its edges cannot close a cycle.
                requireTasksExist(workflow, "dependsOn", dependsOn);
                return event(EventType.TASK_ADDED, workflowId,
                    EventPayloads.taskAdded(taskId, title, description, priority, dependsOn, noteIds, tags, steps));
            });
            log.info("Added task {} '{}' to workflow {}", taskId, title, workflowId);
            return requireTask(requireWorkflow(workflowId), taskId);
        }
    }

    @Override
    public Task setTaskStatus(String workflowId, String taskId, TaskStatus status, String note) {
        if (status == null) {
            throw new ValidationException("status", "must not be null");
        }
        String validNote = Validation.optionalText("note", note, Validation.MAX_TEXT_LENGTH);

        try (var ctx = LoggingContext.forTask(workflowId, taskId, "setTaskStatus")) {
            writer.write("setTaskStatus", () -> {
                Workflow workflow = requireMutable(workflowId);
                Task task = requireTask(workflow, taskId);
                if (task.status() == status) {
                    return null;
                }
                return event(EventType.TASK_STATUS_CHANGED, workflowId,
                    EventPayloads.taskStatusChanged(taskId, task.status(), status, validNote));
            });
            Task updated = requireTask(requireWorkflow(workflowId), taskId);
            log.info("Task {} is now {}", taskId, updated.status());
            return updated;
        }
    }

    @Override
    public Task updateTask(String workflowId, String taskId, TaskPatch patch) {
        Objects.requireNonNull(patch, "patch");
        if (patch.isEmpty()) {
            throw new ValidationException("patch", "no fields to update");
        }
        String title = patch.title() == null
            ? null
            : Validation.requireText("title", patch.title(), Validation.MAX_TITLE_LENGTH);
        String description = Validation.optionalText("description", patch.description(), Validation.MAX_TEXT_LENGTH);
        TaskPriority priority = patch.priority() == null ? null : TaskPriority.fromValue(patch.priority());
        TaskStatus requestedStatus = patch.status() == null ? null : TaskStatus.fromValue(patch.status());
        String note = Validation.optionalText("note", patch.note(), Validation.MAX_TEXT_LENGTH);
        Set<String> dependsOn = Validation.optionalIds("dependsOn", patch.dependsOn());
        Set<String> noteIds = Validation.optionalIds("noteIds", patch.noteIds());
        Set<String> tags = Validation.optionalIds("tags", patch.tags());

        try (var ctx = LoggingContext.forTask(workflowId, taskId, "updateTask")) {
            writer.write("updateTask", () -> {
                Workflow workflow = requireMutable(workflowId);
                Task task = requireTask(workflow, taskId);
                if (dependsOn != null) {
                    requireTasksExist(workflow, "dependsOn", dependsOn);
                    checkAcyclic(workflow, taskId, dependsOn);
                }
                TaskStatus status = requestedStatus == task.status() && note == null ? null : requestedStatus;
                if (title == null && description == null && priority == null && status == null
                        && note == null && dependsOn == null && noteIds == null && tags == null) {
                    return null;
                }
                return event(EventType.TASK_UPDATED, workflowId, EventPayloads.taskUpdated(
                    taskId, title, description, priority, status, note, dependsOn, noteIds, tags));
            });
            log.info("Updated task {}", taskId);
            return requireTask(requireWorkflow(workflowId), taskId);
        }
    }

    @Override
    public Task addDependency(String workflowId, String taskId, String dependsOnTaskId) {
        String dependencyId = Validation.requireId("dependsOn", dependsOnTaskId);

        try (var ctx = LoggingContext.forTask(workflowId, taskId, "addDependency")) {
            writer.write("addDependency", () -> {
                Workflow workflow = requireMutable(workflowId);
                Task task = requireTask(workflow, taskId);
                requireTasksExist(workflow, "dependsOn", Set.of(dependencyId));
                if (task.dependsOn().contains(dependencyId)) {
                    return null;
                }
                checkAcyclic(workflow, taskId, Set.of(dependencyId));
                Set<String> dependsOn = new LinkedHashSet<>(task.dependsOn());
                dependsOn.add(dependencyId);
                return dependencyUpdate(workflowId, taskId, dependsOn);
            });
            log.info("Task {} now depends on {}", taskId, dependencyId);
            return requireTask(requireWorkflow(workflowId), taskId);
        }
    }

    @Override
    public Task removeDependency(String workflowId, String taskId, String dependsOnTaskId) {
        String dependencyId = Validation.requireId("dependsOn", dependsOnTaskId);

        try (var ctx = LoggingContext.forTask(workflowId, taskId, "removeDependency")) {
            writer.write("removeDependency", () -> {
                Workflow workflow = requireMutable(workflowId);
                Task task = requireTask(workflow, taskId);
                if (!task.dependsOn().contains(dependencyId)) {
                    return null;
                }
                Set<String> dependsOn = new LinkedHashSet<>(task.dependsOn());
                dependsOn.remove(dependencyId);
                return dependencyUpdate(workflowId, taskId, dependsOn);
            });
            log.info("Task {} no longer depends on {}", taskId, dependencyId);
            return requireTask(requireWorkflow(workflowId), taskId);
        }
    }

    @Override
    public Workflow reorderTasks(String workflowId, List<String> order) {
        List<String> newOrder = Validation.distinctIds("order", order);

        try (var ctx = LoggingContext.forWorkflow(workflowId, "reorderTasks")) {
            writer.write("reorderTasks", () -> {
                Workflow workflow = requireMutable(workflowId);
                if (newOrder.size() != workflow.taskIds().size()
                        || !workflow.tasks().keySet().containsAll(newOrder)) {
                    throw new ValidationException("order",
                        "must list each of the workflow's " + workflow.taskIds().size() + " tasks exactly once");
                }
                if (newOrder.equals(workflow.taskIds())) {
                    return null;
                }
                return event(EventType.TASKS_REORDERED, workflowId, EventPayloads.tasksReordered(newOrder));
            });
            log.info("Reordered {} tasks of workflow {}", newOrder.size(), workflowId);
            return requireWorkflow(workflowId);
        }
    }

    @Override
    public Task linkArtifact(String workflowId, String taskId, String noteId) {
        String validNoteId = Validation.requireId("noteId", noteId);

        try (var ctx = LoggingContext.forTask(workflowId, taskId, "linkArtifact")) {
            writer.write("linkArtifact", () -> {
                Workflow workflow = requireMutable(workflowId);
                Task task = requireTask(workflow, taskId);
                if (task.noteIds().contains(validNoteId)) {
                    return null;
                }
                if (task.noteIds().size() >= Validation.MAX_ITEMS) {
                    throw new ValidationException("noteIds", "more than " + Validation.MAX_ITEMS + " items");
                }
                return event(EventType.ARTIFACT_LINKED, workflowId, EventPayloads.artifact(taskId, validNoteId));
            });
            log.info("Linked note {} to task {}", validNoteId, taskId);
            return requireTask(requireWorkflow(workflowId), taskId);
        }
    }

    @Override
    public Task unlinkArtifact(String workflowId, String taskId, String noteId) {
        String validNoteId = Validation.requireId("noteId", noteId);

        try (var ctx = LoggingContext.forTask(workflowId, taskId, "unlinkArtifact")) {
            writer.write("unlinkArtifact", () -> {
                Workflow workflow = requireMutable(workflowId);
                Task task = requireTask(workflow, taskId);
                if (!task.noteIds().contains(validNoteId)) {
                    return null;
                }
                return event(EventType.ARTIFACT_UNLINKED, workflowId, EventPayloads.artifact(taskId, validNoteId));
            });
            log.info("Unlinked note {} from task {}", validNoteId, taskId);
            return requireTask(requireWorkflow(workflowId), taskId);
        }
    }

    @Override
    public TaskStep completeStep(String workflowId, String taskId, String stepId, String evidence) {
        String validStepId = Validation.requireId("stepId", stepId);
        String validEvidence = Validation.optionalText("evidence", evidence, Validation.MAX_TEXT_LENGTH);

        try (var ctx = LoggingContext.forTask(workflowId, taskId, "completeStep")) {
            writer.write("completeStep", () -> {
                Workflow workflow = requireMutable(workflowId);
                Task task = requireTask(workflow, taskId);
                TaskStep step = task.findStep(validStepId)
                    .orElseThrow(() -> new NotFoundException("Step", validStepId));
                if (step.completed()) {
                    return null;
                }
                return event(EventType.STEP_COMPLETED, workflowId,
                    EventPayloads.stepCompleted(taskId, validStepId, validEvidence));
            });
            log.info("Completed step {} of task {}", validStepId, taskId);
            return requireTask(requireWorkflow(workflowId), taskId).findStep(validStepId)
                .orElseThrow(() -> new NotFoundException("Step", validStepId));
        }
    }

    @Override
    public List<Task> getTasks(String workflowId, TaskFilter filter) {
        TaskFilter effective = filter == null ? TaskFilter.all() : filter;
        return requireWorkflow(workflowId).orderedTasks().stream()
            .filter(effective::matches)
            .collect(Collectors.toList());
    }

    // ========== Scheduling ==========

    @Override
    public List<Task> getNextBatch(String workflowId) {
        return getNextBatch(workflowId, 0);
    }

    @Override
    public List<Task> getNextBatch(String workflowId, int limit) {
        return resolver.nextBatch(requireWorkflow(workflowId), effectiveLimit(limit));
    }

    @Override
    public List<Task> startNextBatch(String workflowId, int limit) {
        int batchLimit = effectiveLimit(limit);
        List<String> started = new ArrayList<>();

        try (var ctx = LoggingContext.forWorkflow(workflowId, "startNextBatch")) {
            Optional<Event> committed = writer.write("startNextBatch", () -> {
                started.clear();
                Workflow workflow = requireMutable(workflowId);
                List<Task> batch = resolver.nextBatch(workflow, batchLimit);
                if (batch.isEmpty()) {
                    return null;
                }
                batch.forEach(task -> started.add(task.id()));
                return event(EventType.BATCH_STARTED, workflowId,
                    EventPayloads.batchStarted(workflow.batchNumber() + 1, started));
            });
            if (committed.isEmpty()) {
                log.info("No runnable tasks in workflow {}", workflowId);
                return List.of();
            }
            Workflow workflow = requireWorkflow(workflowId);
            log.info("Started batch {} of workflow {} with {} tasks",
                workflow.batchNumber(), workflowId, started.size());
            return started.stream().map(id -> requireTask(workflow, id)).collect(Collectors.toList());
        }
    }

    // ========== Checkpoints ==========

    @Override
    public Checkpoint createCheckpoint(String workflowId, String notes, CheckpointReason reason) {
        try (var ctx = LoggingContext.forWorkflow(workflowId, "createCheckpoint")) {
            return checkpoints.create(workflowId, notes, reason);
        }
    }

    @Override
    public Workflow restoreCheckpoint(String checkpointId) {
        return checkpoints.restore(checkpointId);
    }

    @Override
    public List<Checkpoint> listCheckpoints(String workflowId) {
        return requireWorkflow(workflowId).checkpoints();
    }

    @Override
    public Optional<Checkpoint> getLatestCheckpoint(String workflowId) {
        return requireWorkflow(workflowId).latestCheckpoint();
    }

    // ========== Status ==========

    @Override
    public WorkflowStatusSummary getWorkflowStatus(String workflowId) {
        Workflow workflow = requireWorkflow(workflowId);

        List<Task> inProgress = workflow.orderedTasks().stream()
            .filter(task -> task.status() == TaskStatus.IN_PROGRESS)
            .collect(Collectors.toList());

        List<Event> workflowEvents = store.readAll().events().stream()
            .filter(event -> workflowId.equals(event.workflowId()))
            .collect(Collectors.toList());
        List<Event> recent = workflowEvents.subList(
            Math.max(0, workflowEvents.size() - STATUS_RECENT_EVENTS), workflowEvents.size());

        return new WorkflowStatusSummary(
            workflow.id(),
            workflow.title(),
            workflow.status(),
            workflow.progress(),
            inProgress,
            resolver.blockers(workflow),
            resolver.nextBatch(workflow, STATUS_NEXT_ACTIONS),
            recent,
            workflow.latestCheckpoint().orElse(null),
            projection.corruptions().size()
        );
    }

    @Override
    public List<CorruptionReport> getCorruptionReports() {
        return projection.corruptions();
    }

    // ========== Lifecycle ==========

    /**
     * Write the snapshot index and close the store.
     */
    @Override
    public void close() {
        projection.flushSnapshot();
        store.close();
        log.info("Task ledger closed");
    }

    // ========== Helpers ==========

    private PendingEvent event(EventType type, String workflowId, ObjectNode payload) {
        return new PendingEvent(type, workflowId, clock.instant(), payload, Event.ACTOR_USER);
    }

    private PendingEvent dependencyUpdate(String workflowId, String taskId, Set<String> dependsOn) {
        return event(EventType.TASK_UPDATED, workflowId, EventPayloads.taskUpdated(
            taskId, null, null, null, null, null, dependsOn, null, null));
    }

    private Workflow requireWorkflow(String workflowId) {
        if (workflowId == null) {
            throw new ValidationException("workflowId", "must not be null");
        }
        return projection.find(workflowId)
            .orElseThrow(() -> new NotFoundException("Workflow", workflowId));
    }

    /**
     * Archived workflows are frozen; only checkpoints may still be added.
     */
    private Workflow requireMutable(String workflowId) {
        Workflow workflow = requireWorkflow(workflowId);
        if (workflow.status().isTerminal()) {
            throw new ValidationException("Workflow " + workflowId + " is " + workflow.status() + " and cannot be modified");
        }
        return workflow;
    }

    private static Task requireTask(Workflow workflow, String taskId) {
        if (taskId == null) {
            throw new ValidationException("taskId", "must not be null");
        }
        return workflow.findTask(taskId)
            .orElseThrow(() -> new NotFoundException("Task", taskId));
    }

    private static void requireTasksExist(Workflow workflow, String field, Set<String> taskIds) {
        Set<String> unknown = new HashSet<>(taskIds);
        unknown.removeAll(workflow.tasks().keySet());
        if (!unknown.isEmpty()) {
            throw new ValidationException(field, "unknown tasks " + unknown.stream().sorted().toList());
        }
    }

    private static List<TaskStep> steps(List<StepRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            return List.of();
        }
        if (requests.size() > Validation.MAX_ITEMS) {
            throw new ValidationException("steps", "more than " + Validation.MAX_ITEMS + " items");
        }
        List<TaskStep> steps = new ArrayList<>(requests.size());
        for (StepRequest request : requests) {
            if (request == null) {
                throw new ValidationException("steps", "must not contain null");
            }
            Integer minutes = request.estimatedMinutes();
            if (minutes != null && minutes < 0) {
                throw new ValidationException("estimatedMinutes", "must not be negative");
            }
            steps.add(TaskStep.create(
                Ids.stepId(),
                Validation.requireText("steps.description", request.description(), Validation.MAX_TITLE_LENGTH),
                minutes,
                Validation.optionalText("verificationCommand", request.verificationCommand(), Validation.MAX_TEXT_LENGTH)));
        }
        return steps;
    }

    private void checkAcyclic(Workflow workflow, String taskId, Set<String> dependsOn) {
        try {
            cycleDetector.requireAcyclic(workflow, taskId, dependsOn);
        } catch (CycleException e) {
            metrics.cycleRejected();
            log.warn("Rejected dependency change on task {}: {}", taskId, e.getMessage());
            throw e;
        }
    }

    private int effectiveLimit(int limit) {
        if (limit < 0) {
            throw new ValidationException("limit", "must not be negative");
        }
        return limit == 0 ? properties.defaultBatchSize() : limit;
    }
}
