package com.agentflow.engine.service;

import com.agentflow.core.model.ExecutionStatistics;
import com.agentflow.core.model.StepExecution;
import com.agentflow.core.model.SystemStatistics;
import com.agentflow.core.model.Workflow;
import com.agentflow.core.model.WorkflowExecution;
import com.agentflow.core.model.WorkflowStatus;
import com.agentflow.core.model.WorkflowType;
import com.agentflow.core.repository.ExecutionQuery;
import com.agentflow.core.repository.WorkflowQuery;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.UUID;

/**
 * Facade over validation, the workflow store and the execution engine.
 * Manages workflow definitions and hands execution requests to the engine.
 */
public interface WorkflowService {

    /**
     * Validate and store a new workflow definition.
     *
     * @param request The definition
     * @return The stored workflow, version 1
     * @throws com.agentflow.core.exception.WorkflowValidationException with every violation found
     */
    Workflow createWorkflow(WorkflowRequest request);

    /**
     * Validate and store a new version of a workflow. Running executions keep their snapshot.
     *
     * @param workflowId The workflow ID
     * @param request    The new definition
     * @return The stored workflow with its version incremented
     */
    Workflow updateWorkflow(String workflowId, WorkflowRequest request);

    /**
     * Delete a workflow together with its execution history.
     *
     * @throws com.agentflow.core.exception.ConflictException if executions are still pending or running
     */
    void deleteWorkflow(String workflowId);

    Workflow getWorkflow(String workflowId);

    List<Workflow> listWorkflows(WorkflowQuery query);

    /**
     * Start an execution of a stored workflow.
     *
     * @param workflowId The workflow ID
     * @param inputData  The execution input, a JSON object
     * @return ID of the new execution
     */
    UUID executeWorkflow(String workflowId, JsonNode inputData);

    /**
     * Get an execution with its full attempt history.
     */
    ExecutionDetails getExecution(UUID executionId);

    List<WorkflowExecution> listExecutions(ExecutionQuery query);

    WorkflowExecution cancelExecution(UUID executionId, String reason);

    /**
     * Deliver a named event to an event-driven execution.
     */
    void signalExecution(UUID executionId, String eventName, JsonNode payload);

    ExecutionStatistics getWorkflowStatistics(String workflowId);

    SystemStatistics getSystemStatistics();

    /**
     * Request to create or update a workflow.
     * Status defaults to draft on create and to the current status on update.
     */
    record WorkflowRequest(
        String id,
        String name,
        String description,
        WorkflowType workflowType,
        WorkflowStatus status,
        JsonNode config,
        JsonNode metadata,
        List<String> tags,
        List<StepRequest> steps
    ) {}

    /**
     * One step of a workflow request. Omitted timeout and retry count take the engine defaults.
     */
    record StepRequest(
        String id,
        String name,
        String stepType,
        String agentRef,
        JsonNode config,
        List<String> dependencies,
        Integer timeoutSeconds,
        Integer retryCount
    ) {}

    /**
     * An execution with every attempt of every step, in creation order.
     */
    record ExecutionDetails(WorkflowExecution execution, List<StepExecution> steps) {}
}
