package com.taskledger.engine.materializer;

import com.taskledger.core.model.CorruptionReport;
import com.taskledger.core.model.Event;
import com.taskledger.core.model.LogReadResult;
import com.taskledger.core.model.Workflow;
import com.taskledger.core.repository.EventLogStore;
import com.taskledger.engine.persistence.SnapshotIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Read-mostly cache of the materialized workflows of one store.
 *
 * Loaded lazily from the snapshot index (when it matches the log) plus the log tail,
 * then kept current by applying each committed event. The cache can be dropped at
 * any time; {@link #reload()} rebuilds it from the log.
 */
public class WorkflowProjection {

    private static final Logger log = LoggerFactory.getLogger(WorkflowProjection.class);

    private final EventLogStore store;
    private final StateMaterializer materializer;
    private final SnapshotIndex snapshotIndex;
    private final int snapshotInterval;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    // Guarded by lock
    private Map<String, Workflow> workflows = new LinkedHashMap<>();
    private List<CorruptionReport> corruptions = List.of();
    private long appliedSequence;
    private int eventsSinceSnapshot;
    private boolean loaded;

    /**
     * @param snapshotIndex sidecar index, or null to always replay the full log
     * @param snapshotInterval events between index writes; 0 disables periodic writes
     */
    public WorkflowProjection(
            EventLogStore store,
            StateMaterializer materializer,
            SnapshotIndex snapshotIndex,
            int snapshotInterval) {
        this.store = store;
        this.materializer = materializer;
        this.snapshotIndex = snapshotIndex;
        this.snapshotInterval = snapshotInterval;
    }

    // ========== Queries ==========

    public Optional<Workflow> find(String workflowId) {
        ensureLoaded();
        lock.readLock().lock();
        try {
            return Optional.ofNullable(workflows.get(workflowId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * All workflows, in creation order.
     */
    public List<Workflow> all() {
        ensureLoaded();
        lock.readLock().lock();
        try {
            return new ArrayList<>(workflows.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Corrupt lines found by the last full read of the log.
     */
    public List<CorruptionReport> corruptions() {
        ensureLoaded();
        lock.readLock().lock();
        try {
            return corruptions;
        } finally {
            lock.readLock().unlock();
        }
    }

    public long appliedSequence() {
        ensureLoaded();
        lock.readLock().lock();
        try {
            return appliedSequence;
        } finally {
            lock.readLock().unlock();
        }
    }

    // ========== Updates ==========

    /**
     * Apply an event that was just committed to the store.
     * If events were appended by someone else in between, the missing tail is read first.
     */
    public void apply(Event committed) {
        ensureLoaded();
        lock.writeLock().lock();
        try {
            if (committed.sequence() <= appliedSequence) {
                return;
            }
            if (committed.sequence() != appliedSequence + 1) {
                log.info("Projection at {} missed events before {}, catching up from the log",
                    appliedSequence, committed.sequence());
                catchUp();
            }
            if (committed.sequence() > appliedSequence) {
                materializer.applyTo(workflows, committed);
                appliedSequence = committed.sequence();
                eventsSinceSnapshot++;
            }
            if (snapshotIndex != null && snapshotInterval > 0 && eventsSinceSnapshot >= snapshotInterval) {
                writeSnapshot(committed);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Drop the cache and rebuild it from the log.
     */
    public void reload() {
        lock.writeLock().lock();
        try {
            load();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Write the snapshot index for the current state, if there is anything new to write.
     */
    public void flushSnapshot() {
        if (snapshotIndex == null) {
            return;
        }
        lock.writeLock().lock();
        try {
            if (loaded && eventsSinceSnapshot > 0) {
                store.readAll().events().stream()
                    .filter(event -> event.sequence() == appliedSequence)
                    .findFirst()
                    .ifPresent(this::writeSnapshot);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ========== Loading ==========

    private void ensureLoaded() {
        lock.readLock().lock();
        try {
            if (loaded) {
                return;
            }
        } finally {
            lock.readLock().unlock();
        }
        lock.writeLock().lock();
        try {
            if (!loaded) {
                load();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void load() {
        LogReadResult result = store.readAll();
        List<Event> events = result.events();

        Map<String, Workflow> state = new LinkedHashMap<>();
        long fromSequence = 0;
        Optional<SnapshotIndex.Snapshot> snapshot = snapshotIndex == null ? Optional.empty() : snapshotIndex.load();
        if (snapshot.isPresent() && matchesLog(snapshot.get(), events)) {
            state.putAll(snapshot.get().workflows());
            fromSequence = snapshot.get().sequence();
        } else if (snapshot.isPresent()) {
            log.warn("Snapshot index at sequence {} does not match the event log, replaying in full",
                snapshot.get().sequence());
        }

        int replayed = 0;
        for (Event event : events) {
            if (event.sequence() > fromSequence) {
                materializer.applyTo(state, event);
                replayed++;
            }
        }

        this.workflows = state;
        this.corruptions = result.corruptions();
        this.appliedSequence = Math.max(fromSequence, result.lastSequence());
        this.eventsSinceSnapshot = replayed;
        this.loaded = true;

        log.info("Materialized {} workflows from {} events ({} replayed, {} corrupt lines)",
            state.size(), events.size(), replayed, result.corruptions().size());
    }

    private void catchUp() {
        LogReadResult result = store.readAll();
        for (Event event : result.events()) {
            if (event.sequence() > appliedSequence) {
                materializer.applyTo(workflows, event);
                appliedSequence = event.sequence();
                eventsSinceSnapshot++;
            }
        }
        corruptions = result.corruptions();
    }

    private static boolean matchesLog(SnapshotIndex.Snapshot snapshot, List<Event> events) {
        for (Event event : events) {
            if (event.sequence() == snapshot.sequence()) {
                return event.type().equals(snapshot.eventType())
                    && event.timestamp().equals(snapshot.eventTimestamp());
            }
            if (event.sequence() > snapshot.sequence()) {
                return false;
            }
        }
        return false;
    }

    private void writeSnapshot(Event lastApplied) {
        snapshotIndex.save(new SnapshotIndex.Snapshot(
            SnapshotIndex.FORMAT_VERSION,
            lastApplied.sequence(),
            lastApplied.timestamp(),
            lastApplied.type(),
            new LinkedHashMap<>(workflows)
        ));
        eventsSinceSnapshot = 0;
    }
}
