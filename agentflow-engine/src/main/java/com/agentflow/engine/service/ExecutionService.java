package com.agentflow.engine.service;

import com.agentflow.core.model.Workflow;
import com.agentflow.core.model.WorkflowExecution;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.UUID;

/**
 * Runs validated workflows.
 */
public interface ExecutionService {

    /**
     * Start an execution asynchronously.
     *
     * @param workflow  A validated workflow
     * @param inputData The execution input
     * @return ID of the new execution, returned before any step completes
     */
    UUID execute(Workflow workflow, JsonNode inputData);

    /**
     * Get the persisted state of an execution.
     */
    WorkflowExecution getStatus(UUID executionId);

    /**
     * Cancel a non-terminal execution. In-flight attempts are asked to stop and their late
     * results are discarded.
     *
     * @return The cancelled execution
     */
    WorkflowExecution cancel(UUID executionId, String reason);

    /**
     * Deliver a named event to an event-driven execution.
     */
    void signal(UUID executionId, String eventName, JsonNode payload);
}
