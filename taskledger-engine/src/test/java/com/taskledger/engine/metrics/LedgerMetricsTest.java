package com.taskledger.engine.metrics;

import com.taskledger.core.model.Workflow;
import com.taskledger.core.model.WorkflowStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@DisplayName("Ledger Metrics Tests")
class LedgerMetricsTest {

    @Test
    @DisplayName("Recording without a registry is a no-op")
    void unboundIsNoOp() {
        LedgerMetrics metrics = new LedgerMetrics();

        assertThatCode(() -> {
            metrics.eventAppended("TaskAdded", Duration.ofMillis(3));
            metrics.corruptLines(2);
            metrics.cycleRejected();
            metrics.concurrencyRetry("addTask");
        }).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Counters, timer and gauges are registered once bound")
    void recordsWhenBound() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        LedgerMetrics metrics = new LedgerMetrics();
        metrics.bindTo(registry);

        metrics.eventAppended("TaskAdded", Duration.ofMillis(3));
        metrics.eventAppended("TaskAdded", Duration.ofMillis(5));
        metrics.corruptLines(2);
        metrics.concurrencyRetry("addTask");
        Instant now = Instant.parse("2024-05-01T10:00:00Z");
        Workflow active = Workflow.create("wf_1", "One", null, null, Set.of(), now, 1);
        Workflow archived = active.toBuilder().status(WorkflowStatus.ARCHIVED).build();
        metrics.workflowCounts(List.of(active, archived, active));

        assertThat(registry.get(LedgerMetrics.EVENTS_APPENDED).tag("type", "TaskAdded").counter().count()).isEqualTo(2.0);
        assertThat(registry.get(LedgerMetrics.APPEND_DURATION).timer().count()).isEqualTo(2);
        assertThat(registry.get(LedgerMetrics.CORRUPT_LINES).counter().count()).isEqualTo(2.0);
        assertThat(registry.get(LedgerMetrics.CONCURRENCY_RETRIES).tag("operation", "addTask").counter().count()).isEqualTo(1.0);
        assertThat(registry.get(LedgerMetrics.WORKFLOW_COUNT).tag("status", "active").gauge().value()).isEqualTo(2.0);
        assertThat(registry.get(LedgerMetrics.WORKFLOW_COUNT).tag("status", "archived").gauge().value()).isEqualTo(1.0);
        assertThat(registry.get(LedgerMetrics.WORKFLOW_COUNT).tag("status", "completed").gauge().value()).isZero();
    }
}
