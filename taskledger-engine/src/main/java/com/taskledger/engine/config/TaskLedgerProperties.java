package com.taskledger.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings of a task ledger, bound from {@code taskledger.*}.
 *
 * @param root directory holding events.jsonl and snapshot.json; defaults to ~/.taskledger
 * @param writeTimeout how long an append may take before it fails with a storage error
 * @param lockTimeout how long a mutation waits for the mutation lock
 * @param writerQueueCapacity appends that may wait for the writer thread
 * @param snapshotInterval events between snapshot index writes; 0 writes only on close
 * @param checkpointSnapshots embed the workflow state in each checkpoint event
 * @param defaultBatchSize batch cap used when a caller passes 0; 0 means uncapped
 */
@ConfigurationProperties(prefix = "taskledger")
public record TaskLedgerProperties(
    Path root,
    @DefaultValue("5s") Duration writeTimeout,
    @DefaultValue("2s") Duration lockTimeout,
    @DefaultValue("1024") int writerQueueCapacity,
    @DefaultValue("100") int snapshotInterval,
    @DefaultValue("false") boolean checkpointSnapshots,
    @DefaultValue("0") int defaultBatchSize
) {
    public static final String DEFAULT_DIRECTORY = ".taskledger";

    public TaskLedgerProperties {
        root = root == null ? Path.of(System.getProperty("user.home"), DEFAULT_DIRECTORY) : root;
        writeTimeout = writeTimeout == null ? Duration.ofSeconds(5) : writeTimeout;
        lockTimeout = lockTimeout == null ? Duration.ofSeconds(2) : lockTimeout;
        if (writerQueueCapacity <= 0) {
            throw new IllegalArgumentException("taskledger.writer-queue-capacity must be positive");
        }
        if (snapshotInterval < 0 || defaultBatchSize < 0) {
            throw new IllegalArgumentException("taskledger.snapshot-interval and default-batch-size must not be negative");
        }
    }

    /**
     * Defaults with the given root directory.
     */
    public static TaskLedgerProperties forRoot(Path root) {
        return new TaskLedgerProperties(root, null, null, 1024, 100, false, 0);
    }

    public TaskLedgerProperties withCheckpointSnapshots(boolean enabled) {
        return new TaskLedgerProperties(root, writeTimeout, lockTimeout, writerQueueCapacity,
            snapshotInterval, enabled, defaultBatchSize);
    }

    public TaskLedgerProperties withSnapshotInterval(int interval) {
        return new TaskLedgerProperties(root, writeTimeout, lockTimeout, writerQueueCapacity,
            interval, checkpointSnapshots, defaultBatchSize);
    }

    public TaskLedgerProperties withDefaultBatchSize(int batchSize) {
        return new TaskLedgerProperties(root, writeTimeout, lockTimeout, writerQueueCapacity,
            snapshotInterval, checkpointSnapshots, batchSize);
    }
}
