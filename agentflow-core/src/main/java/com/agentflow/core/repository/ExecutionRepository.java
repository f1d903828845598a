package com.agentflow.core.repository;

import com.agentflow.core.model.ExecutionStatistics;
import com.agentflow.core.model.WorkflowExecution;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for workflow executions.
 * Supports optimistic locking via the execution's version.
 */
public interface ExecutionRepository {

    /**
     * Save a new execution.
     *
     * @param execution The execution to save
     */
    void save(WorkflowExecution execution);

    /**
     * Update an execution with optimistic locking.
     *
     * @param execution The new state; the stored version must be {@code execution.version() - 1}
     * @throws com.agentflow.core.exception.OptimisticLockException if the stored version differs
     */
    void update(WorkflowExecution execution);

    /**
     * Find an execution by ID.
     *
     * @param executionId The execution ID
     * @return The execution if found
     */
    Optional<WorkflowExecution> findById(UUID executionId);

    /**
     * List executions matching a query.
     *
     * @param query Filters and pagination
     * @return Matching executions, most recently started first
     */
    List<WorkflowExecution> find(ExecutionQuery query);

    /**
     * Find every execution not in a terminal state. Used by crash recovery.
     *
     * @return Pending and running executions, oldest first
     */
    List<WorkflowExecution> findNonTerminal();

    /**
     * Count pending and running executions of a workflow.
     *
     * @param workflowId The workflow ID
     * @return Number of active executions
     */
    long countActive(String workflowId);

    /**
     * Aggregate execution counters.
     *
     * @param workflowId The workflow ID, or null for system-wide statistics
     * @return Counts and average duration of finished executions
     */
    ExecutionStatistics statistics(String workflowId);
}
