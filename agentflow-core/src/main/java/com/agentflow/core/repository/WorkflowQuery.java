package com.agentflow.core.repository;

import com.agentflow.core.model.WorkflowStatus;
import com.agentflow.core.model.WorkflowType;

import java.util.List;

/**
 * Filter for listing workflows. Null filters match everything; results are ordered by
 * {@code updated_at} descending. A workflow matches the tag filter when it carries any of
 * the listed tags.
 */
public record WorkflowQuery(
    WorkflowType workflowType,
    WorkflowStatus status,
    List<String> tags,
    int limit,
    int offset
) {
    public static final int DEFAULT_LIMIT = 100;

    public WorkflowQuery {
        tags = tags == null || tags.isEmpty() ? null : List.copyOf(tags);
    }

    public static WorkflowQuery all() {
        return new WorkflowQuery(null, null, null, DEFAULT_LIMIT, 0);
    }
}
