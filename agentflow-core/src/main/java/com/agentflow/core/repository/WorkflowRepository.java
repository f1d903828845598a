package com.agentflow.core.repository;

import com.agentflow.core.model.Workflow;
import com.agentflow.core.model.WorkflowStatus;
import com.agentflow.core.model.WorkflowType;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository for workflow definitions and their steps, persisted as one aggregate.
 * Implementations signal retryable failures with {@code TransientStoreException}.
 */
public interface WorkflowRepository {

    /**
     * Save a new workflow with its steps.
     *
     * @param workflow The workflow to save
     * @throws com.agentflow.core.exception.ConflictException if a workflow with the same id exists
     */
    void save(Workflow workflow);

    /**
     * Replace a workflow and its steps.
     *
     * @param workflow The new version; its version must be exactly one above the stored one
     * @throws com.agentflow.core.exception.OptimisticLockException if the stored version differs
     */
    void update(Workflow workflow);

    /**
     * Find a workflow by ID.
     *
     * @param workflowId The workflow ID
     * @return The workflow with its steps, if found
     */
    Optional<Workflow> findById(String workflowId);

    /**
     * List workflows matching a query.
     *
     * @param query Filters and pagination
     * @return Matching workflows, most recently updated first
     */
    List<Workflow> find(WorkflowQuery query);

    /**
     * Delete a workflow together with its steps and execution history.
     *
     * @param workflowId The workflow ID
     * @return true if a workflow was deleted
     */
    boolean delete(String workflowId);

    long count();

    Map<WorkflowType, Long> countByType();

    Map<WorkflowStatus, Long> countByStatus();
}
