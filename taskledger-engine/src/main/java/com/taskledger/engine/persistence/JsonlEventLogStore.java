package com.taskledger.engine.persistence;

import com.taskledger.core.exception.ConcurrencyException;
import com.taskledger.core.exception.CorruptionException;
import com.taskledger.core.exception.StorageException;
import com.taskledger.core.exception.TaskLedgerException;
import com.taskledger.core.model.CorruptionReport;
import com.taskledger.core.model.Event;
import com.taskledger.core.model.LogReadResult;
import com.taskledger.core.model.PendingEvent;
import com.taskledger.core.repository.EventLogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Event log kept as one JSON object per line in {@code <root>/events.jsonl}.
 *
 * All appends go through a single writer thread, so each line is written whole
 * and sequence numbers are assigned in file order. The writer holds an exclusive
 * file lock for the duration of each write; if the file grew since the last write
 * (another process appended) the sequence counter is re-derived from the file first.
 *
 * Readers only see bytes up to the last committed write, never a line in progress.
 */
public class JsonlEventLogStore implements EventLogStore {

    private static final Logger log = LoggerFactory.getLogger(JsonlEventLogStore.class);

    public static final String LOG_FILE_NAME = "events.jsonl";

    private static final byte NEWLINE = '\n';

    /**
     * The log is read into a single array, so it cannot grow past the largest array the JVM allocates.
     */
    static final long MAX_LOG_BYTES = Integer.MAX_VALUE - 8;

    private final Path logFile;
    private final EventCodec codec;
    private final Duration writeTimeout;
    private final ExecutorService writer;

    // Written by the writer thread only; read by any thread.
    private volatile long committedSize;
    private volatile long lastSequence;

    // Writer thread only.
    private boolean endsWithNewline;

    public JsonlEventLogStore(Path root, EventCodec codec, Duration writeTimeout, int queueCapacity) {
        this.logFile = root.resolve(LOG_FILE_NAME);
        this.codec = codec;
        this.writeTimeout = writeTimeout;
        this.writer = new ThreadPoolExecutor(
            1, 1, 0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(queueCapacity),
            runnable -> {
                Thread thread = new Thread(runnable, "taskledger-writer");
                thread.setDaemon(true);
                return thread;
            },
            new ThreadPoolExecutor.AbortPolicy()
        );

        try {
            Files.createDirectories(root);
            if (Files.exists(logFile)) {
                resync(Files.size(logFile));
            } else {
                this.endsWithNewline = true;
            }
        } catch (IOException e) {
            writer.shutdownNow();
            throw new StorageException("Failed to open event log " + logFile, e);
        } catch (StorageException e) {
            writer.shutdownNow();
            throw e;
        }
        log.info("Opened event log {} (lastSequence={}, {} bytes)", logFile, lastSequence, committedSize);
    }

    public Path logFile() {
        return logFile;
    }

    // ========== Append ==========

    @Override
    public Event append(PendingEvent pending) {
        Future<Event> result;
        try {
            result = writer.submit(() -> write(pending));
        } catch (RejectedExecutionException e) {
            throw new ConcurrencyException("Writer queue for " + logFile + " is full or closed", e);
        }

        try {
            return result.get(writeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            result.cancel(false);
            throw new StorageException(
                "Append to " + logFile + " did not complete within " + writeTimeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while appending to " + logFile, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TaskLedgerException ledgerException) {
                throw ledgerException;
            }
            throw new StorageException("Append to " + logFile + " failed", cause);
        }
    }

    private Event write(PendingEvent pending) {
        try (FileChannel channel = FileChannel.open(logFile,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
             FileLock ignored = channel.lock()) {

            long size = channel.size();
            if (size != committedSize) {
                log.warn("Event log {} changed outside this store ({} -> {} bytes), rescanning",
                    logFile, committedSize, size);
                resync(size);
            }

            Event event = Event.committed(lastSequence + 1, pending);
            String line = codec.encode(event) + "\n";
            if (!endsWithNewline) {
                // A torn line from an earlier crash must not swallow this one.
                line = "\n" + line;
            }

            ByteBuffer buffer = ByteBuffer.wrap(line.getBytes(StandardCharsets.UTF_8));
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(false);

            endsWithNewline = true;
            lastSequence = event.sequence();
            committedSize = channel.size();

            log.debug("Appended event seq={} type={} workflowId={}",
                event.sequence(), event.type(), event.workflowId());
            return event;
        } catch (IOException e) {
            log.error("Failed to append {} event to {}", pending.type(), logFile, e);
            throw new StorageException("Failed to append to " + logFile, e);
        }
    }

    private void resync(long size) throws IOException {
        byte[] data = readBytes(size);
        LogReadResult scan = parse(data, data.length);
        this.lastSequence = Math.max(lastSequence, scan.lastSequence());
        this.endsWithNewline = data.length == 0 || data[data.length - 1] == NEWLINE;
        this.committedSize = data.length;
    }

    // ========== Read ==========

    @Override
    public LogReadResult readAll() {
        long limit = committedSize;
        if (limit == 0) {
            return LogReadResult.empty();
        }
        try {
            byte[] data = readBytes(limit);
            LogReadResult result = parse(data, data.length);
            for (CorruptionReport corruption : result.corruptions()) {
                log.warn("Skipping corrupt line {} of {}: {}", corruption.lineNumber(), logFile, corruption.error());
            }
            return result;
        } catch (IOException e) {
            throw new StorageException("Failed to read " + logFile, e);
        }
    }

    @Override
    public long lastSequence() {
        return lastSequence;
    }

    private byte[] readBytes(long limit) throws IOException {
        if (!Files.exists(logFile)) {
            return new byte[0];
        }
        try (FileChannel channel = FileChannel.open(logFile, StandardOpenOption.READ)) {
            int length = readLength(logFile, limit, channel.size());
            ByteBuffer buffer = ByteBuffer.allocate(length);
            while (buffer.hasRemaining()) {
                if (channel.read(buffer) < 0) {
                    break;
                }
            }
            byte[] data = new byte[buffer.position()];
            buffer.flip();
            buffer.get(data);
            return data;
        }
    }

    static int readLength(Path file, long limit, long size) {
        long length = Math.min(limit, size);
        if (length > MAX_LOG_BYTES) {
            throw new StorageException(
                "Event log " + file + " is " + length + " bytes, larger than the " + MAX_LOG_BYTES + " bytes a store can read");
        }
        return (int) length;
    }

    /**
     * Split raw log bytes into lines and decode each one.
     *
     * Blank lines are ignored. A line that fails to decode becomes a corruption report,
     * as does a line whose sequence does not advance past the last accepted event.
     * A line that jumps ahead while the next decoded line carries on below the jump
     * is the odd one out: it is reported and the lines after it are kept.
     */
    LogReadResult parse(byte[] data, int length) {
        List<DecodedLine> decoded = new ArrayList<>();
        List<CorruptionReport> corruptions = new ArrayList<>();
        long lineNumber = 0;
        int start = 0;

        while (start < length) {
            int end = start;
            while (end < length && data[end] != NEWLINE) {
                end++;
            }
            lineNumber++;
            String line = new String(data, start, end - start, StandardCharsets.UTF_8);
            start = end + 1;

            if (line.isBlank()) {
                continue;
            }
            try {
                decoded.add(new DecodedLine(lineNumber, line, codec.decode(line)));
            } catch (CorruptionException e) {
                corruptions.add(new CorruptionReport(lineNumber, line, e.getMessage()));
            }
        }

        List<Event> events = new ArrayList<>(decoded.size());
        long previousSequence = 0;
        for (int i = 0; i < decoded.size(); i++) {
            DecodedLine current = decoded.get(i);
            long sequence = current.event().sequence();
            if (sequence <= previousSequence) {
                corruptions.add(current.report("Sequence " + sequence + " does not follow " + previousSequence));
                continue;
            }
            if (sequence > previousSequence + 1 && i + 1 < decoded.size()) {
                long next = decoded.get(i + 1).event().sequence();
                if (next > previousSequence && next < sequence) {
                    corruptions.add(current.report("Sequence " + sequence + " jumps ahead of " + previousSequence
                        + " while the next line continues at " + next));
                    continue;
                }
            }
            previousSequence = sequence;
            events.add(current.event());
        }
        corruptions.sort(Comparator.comparingLong(CorruptionReport::lineNumber));
        return new LogReadResult(events, corruptions);
    }

    private record DecodedLine(long lineNumber, String line, Event event) {

        CorruptionReport report(String error) {
            return new CorruptionReport(lineNumber, line, error);
        }
    }

    // ========== Lifecycle ==========

    @Override
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(writeTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Writer for {} did not drain within {}", logFile, writeTimeout);
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writer.shutdownNow();
        }
        log.info("Closed event log {}", logFile);
    }
}
