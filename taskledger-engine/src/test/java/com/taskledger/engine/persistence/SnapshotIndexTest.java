package com.taskledger.engine.persistence;

import com.taskledger.core.model.Workflow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Snapshot Index Tests")
class SnapshotIndexTest {

    @TempDir
    Path root;

    @Test
    @DisplayName("A missing index loads as empty")
    void missingIndex() {
        SnapshotIndex fresh = new SnapshotIndex(root, EventCodec.createObjectMapper());

        assertThat(fresh.load()).isEmpty();
    }

    @Test
    @DisplayName("A saved index loads back with its workflows")
    void saveAndLoad() {
        SnapshotIndex fresh = new SnapshotIndex(root, EventCodec.createObjectMapper());
        Instant at = Instant.parse("2024-05-01T10:00:00Z");
        Workflow workflow = Workflow.create("wf_1", "Release", null, null, Set.of("ops"), at, 1);

        fresh.save(new SnapshotIndex.Snapshot(SnapshotIndex.FORMAT_VERSION, 1, at, "WorkflowCreated",
            Map.of("wf_1", workflow)));

        Optional<SnapshotIndex.Snapshot> loaded = fresh.load();
        assertThat(loaded).isPresent();
        assertThat(loaded.get().sequence()).isEqualTo(1);
        assertThat(loaded.get().workflows()).containsEntry("wf_1", workflow);
        assertThat(Files.exists(root.resolve(SnapshotIndex.FILE_NAME + ".tmp"))).isFalse();
    }

    @Test
    @DisplayName("An unreadable index is ignored")
    void unreadableIndex() throws Exception {
        SnapshotIndex fresh = new SnapshotIndex(root, EventCodec.createObjectMapper());
        Files.writeString(root.resolve(SnapshotIndex.FILE_NAME), "{ truncated");

        assertThat(fresh.load()).isEmpty();
    }

    @Test
    @DisplayName("An index of another format version is ignored")
    void otherVersion() throws Exception {
        SnapshotIndex fresh = new SnapshotIndex(root, EventCodec.createObjectMapper());
        Files.writeString(root.resolve(SnapshotIndex.FILE_NAME),
            "{\"version\":99,\"sequence\":1,\"workflows\":{}}");

        assertThat(fresh.load()).isEmpty();
    }
}
