package com.taskledger.engine.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskledger.core.model.Workflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Sidecar file holding the materialized workflows as of some log sequence.
 *
 * Only an accelerator: deleting it, or any failure to read it, just means the
 * next load replays the whole log. Writes go to a temporary file that is then
 * moved over the old one, so a reader never sees a half-written index.
 */
public class SnapshotIndex {

    private static final Logger log = LoggerFactory.getLogger(SnapshotIndex.class);

    public static final String FILE_NAME = "snapshot.json";
    public static final int FORMAT_VERSION = 1;

    private final Path file;
    private final ObjectMapper objectMapper;

    /**
     * Materialized state as of {@code sequence}. {@code eventTimestamp} and
     * {@code eventType} identify the event at that sequence so a snapshot taken
     * against a different log is detected.
     */
    public record Snapshot(
        int version,
        long sequence,
        Instant eventTimestamp,
        String eventType,
        Map<String, Workflow> workflows
    ) {}

    public SnapshotIndex(Path root, ObjectMapper objectMapper) {
        this.file = root.resolve(FILE_NAME);
        this.objectMapper = objectMapper;
    }

    public Path file() {
        return file;
    }

    /**
     * Load the index if present and readable.
     */
    public Optional<Snapshot> load() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            Snapshot snapshot = objectMapper.readValue(file.toFile(), Snapshot.class);
            if (snapshot == null || snapshot.version() != FORMAT_VERSION || snapshot.workflows() == null) {
                log.warn("Ignoring snapshot index {} with unsupported format", file);
                return Optional.empty();
            }
            return Optional.of(snapshot);
        } catch (IOException e) {
            log.warn("Ignoring unreadable snapshot index {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Replace the index atomically. Failures are logged and otherwise ignored,
     * because the log alone is enough to rebuild state.
     */
    public void save(Snapshot snapshot) {
        Path temp = file.resolveSibling(FILE_NAME + ".tmp");
        try {
            Files.createDirectories(file.getParent());
            objectMapper.writeValue(temp.toFile(), snapshot);
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Wrote snapshot index {} at sequence {}", file, snapshot.sequence());
        } catch (IOException e) {
            log.warn("Failed to write snapshot index {}", file, e);
        }
    }
}
