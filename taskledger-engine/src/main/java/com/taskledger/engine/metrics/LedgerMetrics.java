package com.taskledger.engine.metrics;

import com.taskledger.core.model.Workflow;
import com.taskledger.core.model.WorkflowStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Duration;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for the task ledger.
 * Until {@link #bindTo(MeterRegistry)} is called every recording method is a no-op.
 *
 * Metrics exposed:
 * - Appended events by type, and append latency
 * - Corrupt log lines seen on load
 * - Rejected dependency cycles
 * - Concurrency retries
 * - Workflows by status
 */
public class LedgerMetrics implements MeterBinder {

    // Metric names
    public static final String EVENTS_APPENDED = "taskledger.events.appended";
    public static final String APPEND_DURATION = "taskledger.append.duration";
    public static final String CORRUPT_LINES = "taskledger.log.corrupt_lines";
    public static final String CYCLES_REJECTED = "taskledger.dependencies.cycles_rejected";
    public static final String CONCURRENCY_RETRIES = "taskledger.concurrency.retries";
    public static final String WORKFLOW_COUNT = "taskledger.workflows";

    private volatile MeterRegistry registry;

    private final Map<WorkflowStatus, AtomicInteger> workflowGauges = new EnumMap<>(WorkflowStatus.class);

    public LedgerMetrics() {
        for (WorkflowStatus status : WorkflowStatus.values()) {
            workflowGauges.put(status, new AtomicInteger(0));
        }
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        for (Map.Entry<WorkflowStatus, AtomicInteger> entry : workflowGauges.entrySet()) {
            Gauge.builder(WORKFLOW_COUNT, entry.getValue(), AtomicInteger::get)
                .tag("status", entry.getKey().value())
                .description("Number of workflows in " + entry.getKey().value() + " status")
                .register(registry);
        }
    }

    // ========== Log Metrics ==========

    public void eventAppended(String eventType, Duration latency) {
        MeterRegistry registry = this.registry;
        if (registry == null) {
            return;
        }
        Counter.builder(EVENTS_APPENDED)
            .tag("type", eventType)
            .description("Events appended to the log")
            .register(registry)
            .increment();

        Timer.builder(APPEND_DURATION)
            .description("Time from submitting an event to its durable write")
            .register(registry)
            .record(latency);
    }

    public void corruptLines(int count) {
        MeterRegistry registry = this.registry;
        if (registry == null || count == 0) {
            return;
        }
        Counter.builder(CORRUPT_LINES)
            .description("Log lines skipped because they could not be decoded")
            .register(registry)
            .increment(count);
    }

    // ========== Mutation Metrics ==========

    public void cycleRejected() {
        MeterRegistry registry = this.registry;
        if (registry == null) {
            return;
        }
        Counter.builder(CYCLES_REJECTED)
            .description("Dependency edges rejected because they would close a cycle")
            .register(registry)
            .increment();
    }

    public void concurrencyRetry(String operation) {
        MeterRegistry registry = this.registry;
        if (registry == null) {
            return;
        }
        Counter.builder(CONCURRENCY_RETRIES)
            .tag("operation", operation)
            .description("Mutations retried after a concurrency conflict")
            .register(registry)
            .increment();
    }

    /**
     * Refresh the per-status workflow gauges.
     */
    public void workflowCounts(Collection<Workflow> workflows) {
        Map<WorkflowStatus, Integer> counts = new EnumMap<>(WorkflowStatus.class);
        for (Workflow workflow : workflows) {
            counts.merge(workflow.status(), 1, Integer::sum);
        }
        workflowGauges.forEach((status, gauge) -> gauge.set(counts.getOrDefault(status, 0)));
    }
}
