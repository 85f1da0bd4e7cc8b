package com.taskledger.engine.materializer;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskledger.core.exception.ValidationException;
import com.taskledger.core.model.Checkpoint;
import com.taskledger.core.model.CheckpointReason;
import com.taskledger.core.model.Event;
import com.taskledger.core.model.EventType;
import com.taskledger.core.model.Task;
import com.taskledger.core.model.TaskPriority;
import com.taskledger.core.model.TaskStatus;
import com.taskledger.core.model.Workflow;
import com.taskledger.core.model.WorkflowStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.taskledger.engine.event.EventPayloads.*;

/**
 * Folds events into workflow state.
 *
 * The fold is a pure function of the event sequence: replaying the same events
 * always yields the same workflows, and replaying a prefix yields the state as
 * of that prefix. Events of unknown type are logged and skipped. Known events
 * whose payload cannot be applied (unknown task, malformed field) are skipped
 * the same way, so one bad event never blocks the rest of the log.
 */
public class StateMaterializer {

    private static final Logger log = LoggerFactory.getLogger(StateMaterializer.class);

    /**
     * Replay a full event sequence from empty state.
     */
    public Map<String, Workflow> reduce(List<Event> events) {
        return reduce(Map.of(), events);
    }

    /**
     * Apply events on top of an existing state. The input map is not modified.
     */
    public Map<String, Workflow> reduce(Map<String, Workflow> initial, List<Event> events) {
        Map<String, Workflow> state = new LinkedHashMap<>(initial);
        for (Event event : events) {
            applyTo(state, event);
        }
        return Collections.unmodifiableMap(state);
    }

    /**
     * Replay the events of one workflow with sequence not above {@code upToSequence}.
     */
    public Optional<Workflow> replayWorkflow(List<Event> events, String workflowId, long upToSequence) {
        Workflow workflow = null;
        for (Event event : events) {
            if (event.sequence() > upToSequence) {
                break;
            }
            if (workflowId.equals(event.workflowId())) {
                workflow = apply(workflow, event);
            }
        }
        return Optional.ofNullable(workflow);
    }

    /**
     * Apply one event to a mutable state map.
     */
    public void applyTo(Map<String, Workflow> state, Event event) {
        Workflow current = state.get(event.workflowId());
        Workflow next = apply(current, event);
        if (next != null && next != current) {
            state.put(next.id(), next);
        }
    }

    /**
     * Apply one event to the workflow it belongs to.
     *
     * @param current the workflow before the event, or null if it does not exist yet
     * @return the workflow after the event; {@code current} itself if the event was skipped
     */
    public Workflow apply(Workflow current, Event event) {
        Optional<EventType> type = event.knownType();
        if (type.isEmpty()) {
            log.warn("Skipping event seq={} of unknown type '{}'", event.sequence(), event.type());
            return current;
        }
        if (current == null && type.get() != EventType.WORKFLOW_CREATED) {
            log.warn("Skipping event seq={} type={} for unknown workflow {}",
                event.sequence(), event.type(), event.workflowId());
            return null;
        }

        try {
            Workflow next = switch (type.get()) {
                case WORKFLOW_CREATED -> workflowCreated(current, event);
                case WORKFLOW_UPDATED -> workflowUpdated(current, event);
                case TASK_ADDED -> taskAdded(current, event);
                case TASK_STATUS_CHANGED -> taskStatusChanged(current, event);
                case TASK_UPDATED -> taskUpdated(current, event);
                case TASKS_REORDERED -> tasksReordered(current, event);
                case STEP_COMPLETED -> stepCompleted(current, event);
                case BATCH_STARTED -> batchStarted(current, event);
                case ARTIFACT_LINKED -> artifactLinked(current, event);
                case ARTIFACT_UNLINKED -> artifactUnlinked(current, event);
                case CHECKPOINT_CREATED -> checkpointCreated(current, event);
            };
            return next.touched(event.timestamp(), event.sequence());
        } catch (ValidationException | IllegalArgumentException e) {
            log.warn("Skipping event seq={} type={} for workflow {}: {}",
                event.sequence(), event.type(), event.workflowId(), e.getMessage());
            return current;
        }
    }

    // ========== Workflow Events ==========

    private Workflow workflowCreated(Workflow current, Event event) {
        if (current != null) {
            throw new IllegalArgumentException("workflow already exists");
        }
        JsonNode payload = event.payload();
        return Workflow.create(
            event.workflowId(),
            requiredText(payload, TITLE),
            text(payload, DESCRIPTION),
            text(payload, PROJECT),
            stringSet(payload, TAGS),
            event.timestamp(),
            event.sequence()
        );
    }

    private Workflow workflowUpdated(Workflow current, Event event) {
        JsonNode payload = event.payload();
        Workflow.Builder builder = current.toBuilder();
        if (has(payload, TITLE)) {
            builder.title(text(payload, TITLE));
        }
        if (has(payload, DESCRIPTION)) {
            builder.description(text(payload, DESCRIPTION));
        }
        if (has(payload, STATUS)) {
            builder.status(WorkflowStatus.fromValue(text(payload, STATUS)));
        }
        Set<String> tags = stringSet(payload, TAGS);
        if (tags != null) {
            builder.tags(tags);
        }
        return builder.build();
    }

    private Workflow checkpointCreated(Workflow current, Event event) {
        JsonNode payload = event.payload();
        JsonNode logPosition = payload == null ? null : payload.get(LOG_POSITION);
        Checkpoint checkpoint = new Checkpoint(
            requiredText(payload, CHECKPOINT_ID),
            current.id(),
            event.timestamp(),
            text(payload, NOTES),
            has(payload, REASON) ? CheckpointReason.fromValue(text(payload, REASON)) : CheckpointReason.MANUAL,
            logPosition != null && logPosition.canConvertToLong() ? logPosition.asLong() : event.sequence() - 1,
            has(payload, SNAPSHOT)
        );
        return current.withCheckpoint(checkpoint);
    }

    private Workflow batchStarted(Workflow current, Event event) {
        JsonNode payload = event.payload();
        List<String> taskIds = stringList(payload, TASK_IDS);
        if (taskIds == null) {
            throw new IllegalArgumentException("payload field '" + TASK_IDS + "' is missing");
        }
        int batchNumber = has(payload, BATCH_NUMBER)
            ? payload.get(BATCH_NUMBER).asInt()
            : current.batchNumber() + 1;
        String note = "Started in batch " + batchNumber;

        Workflow next = current;
        for (String taskId : taskIds) {
            Task task = requireTask(next, taskId);
            if (task.status() == TaskStatus.PENDING) {
                next = next.withTask(task.withStatus(TaskStatus.IN_PROGRESS, note, event.timestamp()));
            }
        }
        return next.toBuilder().batchNumber(batchNumber).build();
    }

    // ========== Task Events ==========

    private Workflow taskAdded(Workflow current, Event event) {
        JsonNode payload = event.payload();
        String taskId = requiredText(payload, TASK_ID);
        if (current.tasks().containsKey(taskId)) {
            throw new IllegalArgumentException("task " + taskId + " already exists");
        }
        Task task = Task.create(
            taskId,
            current.id(),
            requiredText(payload, TITLE),
            text(payload, DESCRIPTION),
            has(payload, PRIORITY) ? TaskPriority.fromValue(text(payload, PRIORITY)) : TaskPriority.MEDIUM,
            current.taskIds().size(),
            stringSet(payload, DEPENDS_ON),
            stringSet(payload, NOTE_IDS),
            stringSet(payload, TAGS),
            steps(payload),
            event.timestamp()
        );
        return current.withTaskAdded(task);
    }

    private Workflow taskStatusChanged(Workflow current, Event event) {
        JsonNode payload = event.payload();
        Task task = requireTask(current, requiredText(payload, TASK_ID));
        TaskStatus to = TaskStatus.fromValue(requiredText(payload, TO));
        return current.withTask(task.withStatus(to, text(payload, NOTE), event.timestamp()));
    }

    private Workflow taskUpdated(Workflow current, Event event) {
        JsonNode payload = event.payload();
        Task task = requireTask(current, requiredText(payload, TASK_ID));

        Task.Builder builder = task.toBuilder();
        if (has(payload, TITLE)) {
            builder.title(text(payload, TITLE));
        }
        if (has(payload, DESCRIPTION)) {
            builder.description(text(payload, DESCRIPTION));
        }
        if (has(payload, PRIORITY)) {
            builder.priority(TaskPriority.fromValue(text(payload, PRIORITY)));
        }
        Set<String> dependsOn = stringSet(payload, DEPENDS_ON);
        if (dependsOn != null) {
            builder.dependsOn(dependsOn);
        }
        Set<String> noteIds = stringSet(payload, NOTE_IDS);
        if (noteIds != null) {
            builder.noteIds(noteIds);
        }
        Set<String> tags = stringSet(payload, TAGS);
        if (tags != null) {
            builder.tags(tags);
        }
        Task updated = builder.build();

        // A note without a status is recorded as a history entry on the current status.
        if (has(payload, STATUS) || has(payload, NOTE)) {
            TaskStatus status = has(payload, STATUS)
                ? TaskStatus.fromValue(text(payload, STATUS))
                : updated.status();
            updated = updated.withStatus(status, text(payload, NOTE), event.timestamp());
        }
        return current.withTask(updated);
    }

    private Workflow tasksReordered(Workflow current, Event event) {
        List<String> order = stringList(event.payload(), ORDER);
        if (order == null) {
            throw new IllegalArgumentException("payload field '" + ORDER + "' is missing");
        }
        Set<String> unique = new HashSet<>(order);
        if (unique.size() != order.size() || !unique.equals(current.tasks().keySet())) {
            throw new IllegalArgumentException("order is not a permutation of the workflow's tasks");
        }
        return current.withTaskOrder(order);
    }

    private Workflow stepCompleted(Workflow current, Event event) {
        JsonNode payload = event.payload();
        Task task = requireTask(current, requiredText(payload, TASK_ID));
        return current.withTask(task.withStepCompleted(
            requiredText(payload, STEP_ID), text(payload, EVIDENCE), event.timestamp()));
    }

    private Workflow artifactLinked(Workflow current, Event event) {
        JsonNode payload = event.payload();
        Task task = requireTask(current, requiredText(payload, TASK_ID));
        return current.withTask(task.withNoteLinked(requiredText(payload, NOTE_ID)));
    }

    private Workflow artifactUnlinked(Workflow current, Event event) {
        JsonNode payload = event.payload();
        Task task = requireTask(current, requiredText(payload, TASK_ID));
        return current.withTask(task.withNoteUnlinked(requiredText(payload, NOTE_ID)));
    }

    private static Task requireTask(Workflow workflow, String taskId) {
        return workflow.findTask(taskId)
            .orElseThrow(() -> new IllegalArgumentException("unknown task " + taskId));
    }
}
