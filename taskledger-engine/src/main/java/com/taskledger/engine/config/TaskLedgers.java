package com.taskledger.engine.config;

import com.taskledger.engine.coordinator.WorkflowCoordinator;
import com.taskledger.engine.metrics.LedgerMetrics;
import com.taskledger.engine.persistence.EventCodec;
import com.taskledger.engine.persistence.InMemoryEventLogStore;
import com.taskledger.engine.persistence.JsonlEventLogStore;
import com.taskledger.engine.persistence.SnapshotIndex;

import java.time.Clock;

/**
 * Entry points for opening a ledger without Spring.
 */
public final class TaskLedgers {

    private TaskLedgers() {
    }

    /**
     * Open the file-backed ledger under {@code properties.root()}, replaying its log.
     */
    public static WorkflowCoordinator open(TaskLedgerProperties properties) {
        return open(properties, new EventCodec(), new LedgerMetrics(), Clock.systemUTC());
    }

    public static WorkflowCoordinator open(
            TaskLedgerProperties properties,
            EventCodec codec,
            LedgerMetrics metrics,
            Clock clock) {
        JsonlEventLogStore store = new JsonlEventLogStore(
            properties.root(), codec, properties.writeTimeout(), properties.writerQueueCapacity());
        SnapshotIndex snapshotIndex = new SnapshotIndex(properties.root(), codec.objectMapper());
        return new WorkflowCoordinator(store, snapshotIndex, codec.objectMapper(), properties, metrics, clock);
    }

    /**
     * A ledger that lives only in memory. For demos and tests.
     */
    public static WorkflowCoordinator inMemory(TaskLedgerProperties properties, Clock clock) {
        EventCodec codec = new EventCodec();
        return new WorkflowCoordinator(
            new InMemoryEventLogStore(), null, codec.objectMapper(), properties, new LedgerMetrics(), clock);
    }
}
