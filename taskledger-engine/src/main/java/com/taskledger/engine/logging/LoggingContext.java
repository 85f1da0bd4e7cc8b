package com.taskledger.engine.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Puts the ids a ledger operation touches on the SLF4J MDC for as long as it runs.
 *
 * <pre>
 * try (var ctx = LoggingContext.forTask(workflowId, taskId, "setTaskStatus")) {
 *     log.info("Task is now {}", status);   // carries workflowId, taskId, operation, traceId
 * }
 * </pre>
 *
 * Closing restores whatever the keys held before, so a checkpoint taken inside
 * another operation does not wipe the outer operation's ids. The trace id is set
 * once per thread and kept.
 */
public final class LoggingContext implements AutoCloseable {

    public static final String WORKFLOW_ID = "workflowId";
    public static final String TASK_ID = "taskId";
    public static final String OPERATION = "operation";
    public static final String TRACE_ID = "traceId";

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LoggingContext() {
    }

    public static LoggingContext forWorkflow(String workflowId, String operation) {
        return forTask(workflowId, null, operation);
    }

    public static LoggingContext forTask(String workflowId, String taskId, String operation) {
        LoggingContext ctx = new LoggingContext();
        ctx.set(WORKFLOW_ID, workflowId);
        ctx.set(TASK_ID, taskId);
        ctx.set(OPERATION, operation);
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
        return ctx;
    }

    public static String getWorkflowId() {
        return MDC.get(WORKFLOW_ID);
    }

    public static String getOperation() {
        return MDC.get(OPERATION);
    }

    private void set(String key, String value) {
        previous.put(key, MDC.get(key));
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
    }
}
