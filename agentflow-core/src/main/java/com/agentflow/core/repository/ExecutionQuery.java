package com.agentflow.core.repository;

import com.agentflow.core.model.ExecutionStatus;

/**
 * Filter for listing executions. Null filters match everything; results are ordered by
 * {@code started_at} descending, executions not yet started last.
 */
public record ExecutionQuery(
    String workflowId,
    ExecutionStatus status,
    int limit,
    int offset
) {
    public static final int DEFAULT_LIMIT = 100;

    public static ExecutionQuery all() {
        return new ExecutionQuery(null, null, DEFAULT_LIMIT, 0);
    }
}
