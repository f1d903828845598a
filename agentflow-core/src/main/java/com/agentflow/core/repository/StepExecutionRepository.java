package com.agentflow.core.repository;

import com.agentflow.core.model.StepExecution;

import java.util.List;
import java.util.UUID;

/**
 * Repository for step attempt records. One row per attempt per loop iteration.
 */
public interface StepExecutionRepository {

    /**
     * Save a new attempt record.
     *
     * @param stepExecution The attempt to save
     */
    void save(StepExecution stepExecution);

    /**
     * Save several new attempt records in one write.
     *
     * @param stepExecutions The attempts to save
     */
    void saveAll(List<StepExecution> stepExecutions);

    /**
     * Update an existing attempt record.
     *
     * @param stepExecution The attempt with its new status
     */
    void update(StepExecution stepExecution);

    /**
     * Find the full attempt history of an execution.
     *
     * @param executionId The execution ID
     * @return Attempts in the order they were created
     */
    List<StepExecution> findByExecution(UUID executionId);
}
