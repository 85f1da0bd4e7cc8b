package com.taskledger.engine.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskledger.core.model.CheckpointReason;
import com.taskledger.core.model.TaskPriority;
import com.taskledger.core.model.TaskStatus;
import com.taskledger.core.model.TaskStep;
import com.taskledger.core.model.WorkflowStatus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds and reads the payload of every event type.
 * The field names here are the persisted format; changing one breaks old logs.
 */
public final class EventPayloads {

    public static final String TITLE = "title";
    public static final String DESCRIPTION = "description";
    public static final String PROJECT = "project";
    public static final String TAGS = "tags";
    public static final String STATUS = "status";
    public static final String TASK_ID = "taskId";
    public static final String TASK_IDS = "taskIds";
    public static final String PRIORITY = "priority";
    public static final String DEPENDS_ON = "dependsOn";
    public static final String NOTE_IDS = "noteIds";
    public static final String NOTE_ID = "noteId";
    public static final String NOTE = "note";
    public static final String FROM = "from";
    public static final String TO = "to";
    public static final String ORDER = "order";
    public static final String BATCH_NUMBER = "batchNumber";
    public static final String CHECKPOINT_ID = "checkpointId";
    public static final String NOTES = "notes";
    public static final String REASON = "reason";
    public static final String LOG_POSITION = "logPosition";
    public static final String SNAPSHOT = "snapshot";
    public static final String STEPS = "steps";
    public static final String STEP_ID = "stepId";
    public static final String ESTIMATED_MINUTES = "estimatedMinutes";
    public static final String VERIFICATION_COMMAND = "verificationCommand";
    public static final String EVIDENCE = "evidence";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private EventPayloads() {
    }

    // ========== Builders ==========

    public static ObjectNode workflowCreated(String title, String description, String project, Set<String> tags) {
        ObjectNode payload = NODES.objectNode();
        payload.put(TITLE, title);
        putIfNotNull(payload, DESCRIPTION, description);
        payload.put(PROJECT, project);
        payload.set(TAGS, array(tags));
        return payload;
    }

    public static ObjectNode workflowUpdated(String title, String description, WorkflowStatus status, Set<String> tags) {
        ObjectNode payload = NODES.objectNode();
        putIfNotNull(payload, TITLE, title);
        putIfNotNull(payload, DESCRIPTION, description);
        if (status != null) {
            payload.put(STATUS, status.value());
        }
        if (tags != null) {
            payload.set(TAGS, array(tags));
        }
        return payload;
    }

    public static ObjectNode taskAdded(
            String taskId,
            String title,
            String description,
            TaskPriority priority,
            Collection<String> dependsOn,
            Collection<String> noteIds,
            Collection<String> tags) {
        return taskAdded(taskId, title, description, priority, dependsOn, noteIds, tags, List.of());
    }

    public static ObjectNode taskAdded(
            String taskId,
            String title,
            String description,
            TaskPriority priority,
            Collection<String> dependsOn,
            Collection<String> noteIds,
            Collection<String> tags,
            List<TaskStep> steps) {
        ObjectNode payload = NODES.objectNode();
        payload.put(TASK_ID, taskId);
        payload.put(TITLE, title);
        putIfNotNull(payload, DESCRIPTION, description);
        payload.put(PRIORITY, priority.value());
        payload.set(DEPENDS_ON, array(dependsOn));
        payload.set(NOTE_IDS, array(noteIds));
        payload.set(TAGS, array(tags));
        if (!steps.isEmpty()) {
            ArrayNode stepNodes = payload.putArray(STEPS);
            for (TaskStep step : steps) {
                ObjectNode node = stepNodes.addObject();
                node.put(STEP_ID, step.id());
                node.put(DESCRIPTION, step.description());
                if (step.estimatedMinutes() != null) {
                    node.put(ESTIMATED_MINUTES, step.estimatedMinutes());
                }
                putIfNotNull(node, VERIFICATION_COMMAND, step.verificationCommand());
            }
        }
        return payload;
    }

    public static ObjectNode stepCompleted(String taskId, String stepId, String evidence) {
        ObjectNode payload = NODES.objectNode();
        payload.put(TASK_ID, taskId);
        payload.put(STEP_ID, stepId);
        putIfNotNull(payload, EVIDENCE, evidence);
        return payload;
    }

    public static ObjectNode taskStatusChanged(String taskId, TaskStatus from, TaskStatus to, String note) {
        ObjectNode payload = NODES.objectNode();
        payload.put(TASK_ID, taskId);
        payload.put(FROM, from.value());
        payload.put(TO, to.value());
        putIfNotNull(payload, NOTE, note);
        return payload;
    }

    /**
     * Patch payload for a task. Null arguments are left out and keep their current value.
     */
    public static ObjectNode taskUpdated(
            String taskId,
            String title,
            String description,
            TaskPriority priority,
            TaskStatus status,
            String note,
            Collection<String> dependsOn,
            Collection<String> noteIds,
            Collection<String> tags) {
        ObjectNode payload = NODES.objectNode();
        payload.put(TASK_ID, taskId);
        putIfNotNull(payload, TITLE, title);
        putIfNotNull(payload, DESCRIPTION, description);
        if (priority != null) {
            payload.put(PRIORITY, priority.value());
        }
        if (status != null) {
            payload.put(STATUS, status.value());
        }
        putIfNotNull(payload, NOTE, note);
        if (dependsOn != null) {
            payload.set(DEPENDS_ON, array(dependsOn));
        }
        if (noteIds != null) {
            payload.set(NOTE_IDS, array(noteIds));
        }
        if (tags != null) {
            payload.set(TAGS, array(tags));
        }
        return payload;
    }

    public static ObjectNode tasksReordered(List<String> order) {
        ObjectNode payload = NODES.objectNode();
        payload.set(ORDER, array(order));
        return payload;
    }

    public static ObjectNode batchStarted(int batchNumber, List<String> taskIds) {
        ObjectNode payload = NODES.objectNode();
        payload.put(BATCH_NUMBER, batchNumber);
        payload.set(TASK_IDS, array(taskIds));
        return payload;
    }

    public static ObjectNode artifact(String taskId, String noteId) {
        ObjectNode payload = NODES.objectNode();
        payload.put(TASK_ID, taskId);
        payload.put(NOTE_ID, noteId);
        return payload;
    }

    public static ObjectNode checkpointCreated(
            String checkpointId,
            String notes,
            CheckpointReason reason,
            long logPosition,
            JsonNode snapshot) {
        ObjectNode payload = NODES.objectNode();
        payload.put(CHECKPOINT_ID, checkpointId);
        putIfNotNull(payload, NOTES, notes);
        payload.put(REASON, reason.value());
        payload.put(LOG_POSITION, logPosition);
        if (snapshot != null) {
            payload.set(SNAPSHOT, snapshot);
        }
        return payload;
    }

    // ========== Readers ==========

    /**
     * Read an optional text field.
     */
    public static String text(JsonNode payload, String field) {
        JsonNode node = payload == null ? null : payload.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    /**
     * Read a mandatory text field.
     *
     * @throws IllegalArgumentException if the field is missing or blank
     */
    public static String requiredText(JsonNode payload, String field) {
        String value = text(payload, field);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("payload field '" + field + "' is missing");
        }
        return value;
    }

    /**
     * Read an optional string array as a set. Null when the field is absent.
     */
    public static Set<String> stringSet(JsonNode payload, String field) {
        List<String> values = stringList(payload, field);
        return values == null ? null : new LinkedHashSet<>(values);
    }

    /**
     * Read an optional string array. Null when the field is absent.
     *
     * @throws IllegalArgumentException if the field is present but not an array of strings
     */
    public static List<String> stringList(JsonNode payload, String field) {
        JsonNode node = payload == null ? null : payload.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("payload field '" + field + "' is not an array");
        }
        List<String> values = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                throw new IllegalArgumentException("payload field '" + field + "' holds a non-string item");
            }
            values.add(item.asText());
        }
        return values;
    }

    /**
     * Read the step list of a TaskAdded payload. Empty when the field is absent.
     *
     * @throws IllegalArgumentException if an entry lacks its id or description
     */
    public static List<TaskStep> steps(JsonNode payload) {
        JsonNode node = payload == null ? null : payload.get(STEPS);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("payload field '" + STEPS + "' is not an array");
        }
        List<TaskStep> steps = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            JsonNode minutes = item.get(ESTIMATED_MINUTES);
            steps.add(TaskStep.create(
                requiredText(item, STEP_ID),
                requiredText(item, DESCRIPTION),
                minutes != null && minutes.canConvertToInt() ? minutes.asInt() : null,
                text(item, VERIFICATION_COMMAND)));
        }
        return steps;
    }

    public static boolean has(JsonNode payload, String field) {
        return payload != null && payload.hasNonNull(field);
    }

    private static ArrayNode array(Collection<String> values) {
        ArrayNode array = NODES.arrayNode();
        if (values != null) {
            values.forEach(array::add);
        }
        return array;
    }

    private static void putIfNotNull(ObjectNode payload, String field, String value) {
        if (value != null) {
            payload.put(field, value);
        }
    }
}
