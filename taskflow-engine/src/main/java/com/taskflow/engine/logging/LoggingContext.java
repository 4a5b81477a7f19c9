package com.taskflow.engine.logging;

import org.slf4j.MDC;

import java.util.Map;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs of a run include the workflow, execution and step being processed.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forStep(workflowId, executionId, stepId, attempt)) {
 *     log.info("Running step"); // Automatically includes workflowId, executionId, stepId, attempt
 * }
 * </pre>
 *
 * Closing restores the MDC as it was when the context was opened, so pooled threads
 * never carry keys of an earlier run.
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [taskflow-exec-1] INFO  c.t.e.s.StepRunner - Running step
 *   workflowId=abc-123 executionId=def-456 stepId=789-abc attempt=1 traceId=1a2b3c4d
 */
public final class LoggingContext implements AutoCloseable {

    public static final String WORKFLOW_ID = "workflowId";
    public static final String EXECUTION_ID = "executionId";
    public static final String STEP_ID = "stepId";
    public static final String ATTEMPT = "attempt";
    public static final String TRACE_ID = "traceId";

    private final Map<String, String> previous;

    private LoggingContext(Map<String, String> previous) {
        this.previous = previous;
    }

    /**
     * Create a logging context for execution-level operations.
     */
    public static LoggingContext forExecution(UUID workflowId, UUID executionId) {
        LoggingContext ctx = new LoggingContext(MDC.getCopyOfContextMap());
        put(WORKFLOW_ID, workflowId);
        put(EXECUTION_ID, executionId);
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for one step attempt.
     * Runs on step pool threads too, so it sets the execution keys again.
     */
    public static LoggingContext forStep(UUID workflowId, UUID executionId, UUID stepId, int attempt) {
        LoggingContext ctx = new LoggingContext(MDC.getCopyOfContextMap());
        put(WORKFLOW_ID, workflowId);
        put(EXECUTION_ID, executionId);
        put(STEP_ID, stepId);
        MDC.put(ATTEMPT, String.valueOf(attempt));
        ensureTraceId();
        return ctx;
    }

    private static void put(String key, UUID value) {
        if (value != null) {
            MDC.put(key, value.toString());
        }
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        if (previous == null || previous.isEmpty()) {
            MDC.clear();
        } else {
            MDC.setContextMap(previous);
        }
    }
}
