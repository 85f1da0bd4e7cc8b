package com.taskledger.engine.persistence;

import com.taskledger.core.model.Event;
import com.taskledger.core.model.LogReadResult;
import com.taskledger.core.model.PendingEvent;
import com.taskledger.core.repository.EventLogStore;

import java.util.ArrayList;
import java.util.List;

/**
 * In-memory implementation of EventLogStore.
 * For demonstration and testing purposes; nothing survives the JVM.
 */
public class InMemoryEventLogStore implements EventLogStore {

    private final List<Event> events = new ArrayList<>();

    @Override
    public synchronized Event append(PendingEvent pending) {
        Event event = Event.committed(events.size() + 1L, pending);
        events.add(event);
        return event;
    }

    @Override
    public synchronized LogReadResult readAll() {
        return new LogReadResult(events, List.of());
    }

    @Override
    public synchronized long lastSequence() {
        return events.size();
    }

    /**
     * Number of events appended so far.
     */
    public synchronized int size() {
        return events.size();
    }

    /**
     * Snapshot of the events, in append order.
     */
    public synchronized List<Event> events() {
        return new ArrayList<>(events);
    }

    @Override
    public void close() {
        // nothing to release
    }
}
