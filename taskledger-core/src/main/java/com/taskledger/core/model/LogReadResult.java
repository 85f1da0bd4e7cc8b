package com.taskledger.core.model;

import java.util.List;

/**
 * Result of a full log read: the well-formed events in log order plus the
 * reports for every line that failed to parse.
 */
public record LogReadResult(
    List<Event> events,
    List<CorruptionReport> corruptions
) {
    public LogReadResult {
        events = List.copyOf(events);
        corruptions = List.copyOf(corruptions);
    }

    public static LogReadResult empty() {
        return new LogReadResult(List.of(), List.of());
    }

    /**
     * Highest sequence number among the well-formed events (0 for an empty log).
     */
    public long lastSequence() {
        long last = 0;
        for (Event event : events) {
            last = Math.max(last, event.sequence());
        }
        return last;
    }

    public boolean hasCorruption() {
        return !corruptions.isEmpty();
    }
}
