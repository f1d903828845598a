package com.agentflow.engine.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC helper for structured logging. Every log line written inside the context carries the
 * execution's correlation ids.
 *
 * <pre>
 * try (var ctx = LoggingContext.forStep(executionId, workflowId, "fetch", 2)) {
 *     log.info("Dispatching step");
 * }
 * </pre>
 *
 * 2025-01-15 10:30:45.123 [agentflow-worker-3] INFO  c.a.e.e.ExecutionEngine - Dispatching step
 *   executionId=5f0c... workflowId=etl stepName=fetch attempt=2 traceId=1a2b3c4d
 */
public final class LoggingContext implements AutoCloseable {

    public static final String EXECUTION_ID = "executionId";
    public static final String WORKFLOW_ID = "workflowId";
    public static final String STEP_NAME = "stepName";
    public static final String ATTEMPT = "attempt";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
    }

    /**
     * Create a logging context for execution-level operations.
     */
    public static LoggingContext forExecution(UUID executionId, String workflowId) {
        LoggingContext ctx = new LoggingContext();
        if (executionId != null) {
            MDC.put(EXECUTION_ID, executionId.toString());
        }
        if (workflowId != null) {
            MDC.put(WORKFLOW_ID, workflowId);
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for one attempt of a step.
     */
    public static LoggingContext forStep(UUID executionId, String workflowId, String stepName, int attempt) {
        LoggingContext ctx = forExecution(executionId, workflowId);
        if (stepName != null) {
            MDC.put(STEP_NAME, stepName);
        }
        MDC.put(ATTEMPT, String.valueOf(attempt));
        return ctx;
    }

    public static String getExecutionId() {
        return MDC.get(EXECUTION_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(EXECUTION_ID);
        MDC.remove(WORKFLOW_ID);
        MDC.remove(STEP_NAME);
        MDC.remove(ATTEMPT);
        // trace id stays for request-scoped tracing
    }
}
