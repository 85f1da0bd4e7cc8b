package com.taskledger.engine.config;

import com.taskledger.engine.coordinator.WorkflowCoordinator;
import com.taskledger.engine.metrics.LedgerMetrics;
import com.taskledger.engine.persistence.EventCodec;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import java.time.Clock;

/**
 * Spring wiring for a file-backed task ledger.
 *
 * Configures:
 * - The event codec and its Jackson mapper
 * - Ledger metrics, bound to a MeterRegistry when the context has one
 * - The workflow coordinator over {@code taskledger.root}
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(TaskLedgerProperties.class)
public class TaskLedgerConfiguration {

    @Bean
    public EventCodec taskLedgerEventCodec() {
        return new EventCodec();
    }

    @Bean
    public LedgerMetrics ledgerMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        LedgerMetrics metrics = new LedgerMetrics();
        meterRegistry.ifAvailable(metrics::bindTo);
        return metrics;
    }

    @Bean
    public Clock taskLedgerClock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public WorkflowCoordinator workflowCoordinator(
            TaskLedgerProperties properties,
            EventCodec taskLedgerEventCodec,
            LedgerMetrics ledgerMetrics,
            Clock taskLedgerClock) {
        return TaskLedgers.open(properties, taskLedgerEventCodec, ledgerMetrics, taskLedgerClock);
    }
}
