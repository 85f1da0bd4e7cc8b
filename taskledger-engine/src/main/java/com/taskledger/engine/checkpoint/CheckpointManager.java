package com.taskledger.engine.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskledger.core.exception.NotFoundException;
import com.taskledger.core.model.Checkpoint;
import com.taskledger.core.model.CheckpointReason;
import com.taskledger.core.model.Event;
import com.taskledger.core.model.EventType;
import com.taskledger.core.model.Ids;
import com.taskledger.core.model.PendingEvent;
import com.taskledger.core.model.Workflow;
import com.taskledger.core.repository.EventLogStore;
import com.taskledger.engine.coordinator.EventWriter;
import com.taskledger.engine.event.EventPayloads;
import com.taskledger.engine.materializer.StateMaterializer;
import com.taskledger.engine.materializer.WorkflowProjection;
import com.taskledger.engine.service.Validation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Creates checkpoints and rebuilds workflows as of a checkpoint.
 *
 * A checkpoint records the sequence of the last event in the log when it was taken.
 * Restoring replays the log up to that sequence for the checkpoint's workflow, or
 * decodes the snapshot embedded in the checkpoint event when there is one. The log
 * is never truncated or rewritten.
 */
public class CheckpointManager {

    private static final Logger log = LoggerFactory.getLogger(CheckpointManager.class);

    private final EventLogStore store;
    private final WorkflowProjection projection;
    private final StateMaterializer materializer;
    private final EventWriter writer;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final boolean embedSnapshots;

    public CheckpointManager(
            EventLogStore store,
            WorkflowProjection projection,
            StateMaterializer materializer,
            EventWriter writer,
            ObjectMapper objectMapper,
            Clock clock,
            boolean embedSnapshots) {
        this.store = store;
        this.projection = projection;
        this.materializer = materializer;
        this.writer = writer;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.embedSnapshots = embedSnapshots;
    }

    /**
     * Append a CheckpointCreated event pointing at the current end of the log.
     */
    public Checkpoint create(String workflowId, String notes, CheckpointReason reason) {
        String validNotes = Validation.optionalText("notes", notes, Validation.MAX_TEXT_LENGTH);
        CheckpointReason validReason = reason == null ? CheckpointReason.MANUAL : reason;
        String checkpointId = Ids.checkpointId();

        writer.write("createCheckpoint", () -> {
            Workflow workflow = projection.find(workflowId)
                .orElseThrow(() -> new NotFoundException("Workflow", workflowId));
            long logPosition = store.lastSequence();
            JsonNode snapshot = embedSnapshots ? objectMapper.valueToTree(workflow) : null;
            return new PendingEvent(
                EventType.CHECKPOINT_CREATED,
                workflowId,
                clock.instant(),
                EventPayloads.checkpointCreated(checkpointId, validNotes, validReason, logPosition, snapshot),
                Event.ACTOR_USER
            );
        });

        Checkpoint checkpoint = find(checkpointId)
            .orElseThrow(() -> new NotFoundException("Checkpoint", checkpointId));
        log.info("Created checkpoint {} for workflow {} at log position {}",
            checkpointId, workflowId, checkpoint.logPosition());
        return checkpoint;
    }

    /**
     * Rebuild the checkpoint's workflow as it was when the checkpoint was taken.
     *
     * @throws NotFoundException if no workflow has a checkpoint with this id
     */
    public Workflow restore(String checkpointId) {
        Checkpoint checkpoint = find(checkpointId)
            .orElseThrow(() -> new NotFoundException("Checkpoint", checkpointId));
        List<Event> events = store.readAll().events();

        if (checkpoint.snapshotEmbedded()) {
            Optional<Workflow> embedded = embeddedSnapshot(events, checkpoint);
            if (embedded.isPresent()) {
                return embedded.get();
            }
        }

        log.debug("Restoring checkpoint {} by replaying workflow {} up to sequence {}",
            checkpointId, checkpoint.workflowId(), checkpoint.logPosition());
        return materializer.replayWorkflow(events, checkpoint.workflowId(), checkpoint.logPosition())
            .orElseThrow(() -> new NotFoundException("Workflow", checkpoint.workflowId()));
    }

    /**
     * Look a checkpoint up by id across all workflows.
     */
    public Optional<Checkpoint> find(String checkpointId) {
        for (Workflow workflow : projection.all()) {
            for (Checkpoint checkpoint : workflow.checkpoints()) {
                if (checkpoint.id().equals(checkpointId)) {
                    return Optional.of(checkpoint);
                }
            }
        }
        return Optional.empty();
    }

    private Optional<Workflow> embeddedSnapshot(List<Event> events, Checkpoint checkpoint) {
        for (Event event : events) {
            if (!EventType.CHECKPOINT_CREATED.wireName().equals(event.type())
                    || !checkpoint.id().equals(event.payloadText(EventPayloads.CHECKPOINT_ID))) {
                continue;
            }
            JsonNode snapshot = event.payload().get(EventPayloads.SNAPSHOT);
            if (snapshot == null || snapshot.isNull()) {
                return Optional.empty();
            }
            try {
                return Optional.of(objectMapper.treeToValue(snapshot, Workflow.class));
            } catch (JsonProcessingException e) {
                log.warn("Embedded snapshot of checkpoint {} is unreadable, replaying instead: {}",
                    checkpoint.id(), e.getOriginalMessage());
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
