package com.taskledger.engine.coordinator;

import com.taskledger.core.exception.ConcurrencyException;
import com.taskledger.core.exception.StorageException;
import com.taskledger.core.model.Event;
import com.taskledger.core.model.PendingEvent;
import com.taskledger.core.repository.EventLogStore;
import com.taskledger.engine.materializer.WorkflowProjection;
import com.taskledger.engine.metrics.LedgerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs one mutation as a critical section: validate against current state, append
 * the resulting event, apply it to the projection. Mutations are serialized by a
 * fair lock so no two commands validate against the same state.
 *
 * A {@link ConcurrencyException} (lock wait or writer queue exhausted) is retried once;
 * nothing was written in that case. Storage failures are never retried because the
 * write may have reached the disk.
 */
public class EventWriter {

    private static final Logger log = LoggerFactory.getLogger(EventWriter.class);

    private final EventLogStore store;
    private final WorkflowProjection projection;
    private final LedgerMetrics metrics;
    private final Duration lockTimeout;

    private final ReentrantLock mutationLock = new ReentrantLock(true);

    public EventWriter(
            EventLogStore store,
            WorkflowProjection projection,
            LedgerMetrics metrics,
            Duration lockTimeout) {
        this.store = store;
        this.projection = projection;
        this.metrics = metrics;
        this.lockTimeout = lockTimeout;
    }

    /**
     * Run a command and append the event it produces.
     *
     * @param operation name used for logging and metrics
     * @param command validates and returns the event to append, or null for a no-op
     * @return the committed event, or empty if the command produced none
     */
    public Optional<Event> write(String operation, Supplier<PendingEvent> command) {
        try {
            return attempt(command);
        } catch (ConcurrencyException e) {
            log.warn("Retrying {} after concurrency conflict: {}", operation, e.getMessage());
            metrics.concurrencyRetry(operation);
            return attempt(command);
        }
    }

    private Optional<Event> attempt(Supplier<PendingEvent> command) {
        acquire();
        try {
            PendingEvent pending = command.get();
            if (pending == null) {
                return Optional.empty();
            }
            long start = System.nanoTime();
            Event committed = store.append(pending);
            metrics.eventAppended(committed.type(), Duration.ofNanos(System.nanoTime() - start));
            projection.apply(committed);
            return Optional.of(committed);
        } finally {
            mutationLock.unlock();
        }
    }

    private void acquire() {
        try {
            if (!mutationLock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new ConcurrencyException("Timed out after " + lockTimeout + " waiting for the mutation lock");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while waiting for the mutation lock", e);
        }
    }
}
