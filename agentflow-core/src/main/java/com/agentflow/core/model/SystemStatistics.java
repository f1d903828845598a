package com.agentflow.core.model;

import java.util.Map;

/**
 * System-wide view: workflow inventory plus execution counters.
 */
public record SystemStatistics(
    long totalWorkflows,
    Map<WorkflowType, Long> workflowsByType,
    Map<WorkflowStatus, Long> workflowsByStatus,
    ExecutionStatistics executions
) {
}
