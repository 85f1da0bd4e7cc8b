package com.taskledger.core.repository;

import com.taskledger.core.model.Event;
import com.taskledger.core.model.LogReadResult;
import com.taskledger.core.model.PendingEvent;

/**
 * Append-only persistence for events.
 * One store owns one log; sequence numbers are strictly increasing within it.
 */
public interface EventLogStore extends AutoCloseable {

    /**
     * Append one event to the log as a single atomic write.
     * 
     * @param event The event to append
     * @return The committed event carrying its assigned sequence number
     * @throws com.taskledger.core.exception.ConcurrencyException if the append could not be serialized in time
     * @throws com.taskledger.core.exception.StorageException if the storage is unreachable or the write failed
     */
    Event append(PendingEvent event);

    /**
     * Read the whole log in order.
     * Lines that fail to parse are reported, not thrown.
     * 
     * @return Well-formed events plus corruption reports
     * @throws com.taskledger.core.exception.StorageException if the storage is unreachable
     */
    LogReadResult readAll();

    /**
     * Get the sequence number of the last committed event.
     * 
     * @return Last sequence (0 if the log is empty)
     */
    long lastSequence();

    /**
     * Release the resources held by this store.
     */
    @Override
    void close();
}
