package com.agentflow.core.model;

/**
 * Aggregated execution counters for one workflow, or for the whole system when workflowId is null.
 */
public record ExecutionStatistics(
    String workflowId,
    long executionCount,
    long successCount,
    long failureCount,
    long cancelledCount,
    long runningCount,
    double averageDurationSeconds
) {
    public static ExecutionStatistics empty(String workflowId) {
        return new ExecutionStatistics(workflowId, 0, 0, 0, 0, 0, 0.0);
    }

    /**
     * Share of finished executions that succeeded, in [0, 1].
     */
    public double successRate() {
        long finished = successCount + failureCount + cancelledCount;
        return finished == 0 ? 0.0 : (double) successCount / finished;
    }
}
