package com.taskledger.engine.materializer;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskledger.core.model.Event;
import com.taskledger.core.model.EventType;
import com.taskledger.core.model.PendingEvent;
import com.taskledger.core.model.TaskPriority;
import com.taskledger.core.model.Workflow;
import com.taskledger.engine.event.EventPayloads;
import com.taskledger.engine.persistence.EventCodec;
import com.taskledger.engine.persistence.InMemoryEventLogStore;
import com.taskledger.engine.persistence.SnapshotIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Workflow Projection Tests")
class WorkflowProjectionTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir
    Path root;

    private InMemoryEventLogStore store;
    private SnapshotIndex snapshotIndex;
    private final StateMaterializer materializer = new StateMaterializer();

    @BeforeEach
    void setUp() {
        store = new InMemoryEventLogStore();
        snapshotIndex = new SnapshotIndex(root, EventCodec.createObjectMapper());
    }

    private Event append(String workflowId, EventType type, ObjectNode payload) {
        return store.append(new PendingEvent(type, workflowId, T0.plusSeconds(store.size()), payload, Event.ACTOR_USER));
    }

    private void seed(WorkflowProjection projection, int tasks) {
        projection.apply(append("wf_1", EventType.WORKFLOW_CREATED,
            EventPayloads.workflowCreated("One", null, "default", Set.of())));
        for (int i = 0; i < tasks; i++) {
            projection.apply(append("wf_1", EventType.TASK_ADDED,
                EventPayloads.taskAdded("t" + i, "Task " + i, null, TaskPriority.MEDIUM, Set.of(), Set.of(), Set.of())));
        }
    }

    @Test
    @DisplayName("Applied events keep the projection equal to a full replay")
    void staysInSyncWithLog() {
        WorkflowProjection projection = new WorkflowProjection(store, materializer, null, 0);
        seed(projection, 3);

        assertThat(projection.appliedSequence()).isEqualTo(4);
        assertThat(projection.find("wf_1")).contains(materializer.reduce(store.events()).get("wf_1"));
    }

    @Test
    @DisplayName("Events appended behind the projection's back are picked up on the next apply")
    void catchesUpAfterGap() {
        WorkflowProjection projection = new WorkflowProjection(store, materializer, null, 0);
        seed(projection, 1);

        append("wf_1", EventType.TASK_ADDED,
            EventPayloads.taskAdded("late", "Late", null, TaskPriority.LOW, Set.of(), Set.of(), Set.of()));
        projection.apply(append("wf_1", EventType.ARTIFACT_LINKED, EventPayloads.artifact("late", "n1")));

        Workflow workflow = projection.find("wf_1").orElseThrow();
        assertThat(workflow.taskIds()).containsExactly("t0", "late");
        assertThat(workflow.relatedNoteIds()).containsExactly("n1");
    }

    @Test
    @DisplayName("The snapshot index is written every interval and used on the next load")
    void snapshotUsedOnLoad() {
        WorkflowProjection projection = new WorkflowProjection(store, materializer, snapshotIndex, 3);
        seed(projection, 4);

        assertThat(snapshotIndex.load()).hasValueSatisfying(snapshot -> assertThat(snapshot.sequence()).isEqualTo(3));

        WorkflowProjection reloaded = new WorkflowProjection(store, materializer, snapshotIndex, 3);
        assertThat(reloaded.find("wf_1")).isEqualTo(projection.find("wf_1"));
        assertThat(reloaded.appliedSequence()).isEqualTo(5);
    }

    @Test
    @DisplayName("Deleting the snapshot index changes nothing but load time")
    void snapshotIsDiscardable() throws Exception {
        WorkflowProjection projection = new WorkflowProjection(store, materializer, snapshotIndex, 2);
        seed(projection, 5);
        projection.flushSnapshot();
        Workflow withSnapshot = new WorkflowProjection(store, materializer, snapshotIndex, 2).find("wf_1").orElseThrow();

        Files.delete(snapshotIndex.file());
        Workflow withoutSnapshot = new WorkflowProjection(store, materializer, snapshotIndex, 2).find("wf_1").orElseThrow();

        assertThat(withoutSnapshot).isEqualTo(withSnapshot);
    }

    @Test
    @DisplayName("A snapshot taken against a different log is ignored")
    void foreignSnapshotIgnored() {
        WorkflowProjection projection = new WorkflowProjection(store, materializer, snapshotIndex, 1);
        seed(projection, 2);

        // A new log whose events differ from the ones the snapshot was taken on.
        store = new InMemoryEventLogStore();
        store.append(new PendingEvent(EventType.WORKFLOW_CREATED, "wf_2", T0.minusSeconds(100),
            EventPayloads.workflowCreated("Two", null, "default", Set.of()), Event.ACTOR_USER));

        WorkflowProjection fresh = new WorkflowProjection(store, materializer, snapshotIndex, 1);
        assertThat(fresh.all()).extracting(Workflow::id).containsExactly("wf_2");
    }

    @Test
    @DisplayName("Reload rebuilds the same state from the log")
    void reloadRebuilds() {
        WorkflowProjection projection = new WorkflowProjection(store, materializer, null, 0);
        seed(projection, 2);
        Workflow before = projection.find("wf_1").orElseThrow();

        projection.reload();

        assertThat(projection.find("wf_1")).contains(before);
    }
}
