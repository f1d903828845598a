package com.agentflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One run of a workflow against concrete input.
 *
 * Primary Key: id
 * Optimistic version: version (every copy method increments it)
 *
 * Invariants:
 * - status transitions are monotonic, terminal states are never left
 * - stepResults only grows and keeps completion order
 * - outputData set iff status == SUCCEEDED
 * - definition is the workflow snapshot the execution was started with
 */
public record WorkflowExecution(
    UUID id,
    String workflowId,
    int workflowVersion,
    ExecutionStatus status,
    JsonNode inputData,
    JsonNode outputData,
    Map<String, StepResult> stepResults,
    Map<String, JsonNode> receivedEvents,
    String error,
    String errorCode,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Double durationSeconds,
    long version,
    Workflow definition
) {
    public WorkflowExecution {
        stepResults = stepResults == null
            ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(stepResults));
        receivedEvents = receivedEvents == null
            ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(receivedEvents));
    }

    /**
     * Create a new execution in PENDING state.
     */
    public static WorkflowExecution create(Workflow workflow, JsonNode inputData, Instant now) {
        return new WorkflowExecution(
            UUID.randomUUID(),
            workflow.id(),
            workflow.version(),
            ExecutionStatus.PENDING,
            inputData,
            null,
            Map.of(),
            Map.of(),
            null,
            null,
            now,
            null,
            null,
            null,
            1L,
            workflow
        );
    }

    public WorkflowExecution withRunning(Instant now) {
        return new WorkflowExecution(
            id, workflowId, workflowVersion, ExecutionStatus.RUNNING, inputData, outputData,
            stepResults, receivedEvents, error, errorCode,
            createdAt, now, completedAt, durationSeconds, version + 1, definition
        );
    }

    /**
     * Append a terminal step outcome. Existing keys are never overwritten.
     */
    public WorkflowExecution withStepResult(String key, StepResult result) {
        if (stepResults.containsKey(key)) {
            throw new IllegalStateException("Step result already recorded: " + key);
        }
        Map<String, StepResult> results = new LinkedHashMap<>(stepResults);
        results.put(key, result);
        return new WorkflowExecution(
            id, workflowId, workflowVersion, status, inputData, outputData,
            results, receivedEvents, error, errorCode,
            createdAt, startedAt, completedAt, durationSeconds, version + 1, definition
        );
    }

    public WorkflowExecution withEvent(String name, JsonNode payload) {
        Map<String, JsonNode> events = new LinkedHashMap<>(receivedEvents);
        events.put(name, payload);
        return new WorkflowExecution(
            id, workflowId, workflowVersion, status, inputData, outputData,
            stepResults, events, error, errorCode,
            createdAt, startedAt, completedAt, durationSeconds, version + 1, definition
        );
    }

    public WorkflowExecution withSucceeded(JsonNode output, Instant now) {
        return finish(ExecutionStatus.SUCCEEDED, output, null, null, now);
    }

    public WorkflowExecution withFailed(String code, String message, Instant now) {
        return finish(ExecutionStatus.FAILED, null, message, code, now);
    }

    public WorkflowExecution withCancelled(String reason, Instant now) {
        return finish(ExecutionStatus.CANCELLED, null, reason, ErrorCodes.CANCELLED, now);
    }

    private WorkflowExecution finish(ExecutionStatus target, JsonNode output, String message,
                                     String code, Instant now) {
        Instant start = startedAt != null ? startedAt : createdAt;
        double seconds = Duration.between(start, now).toMillis() / 1000.0;
        return new WorkflowExecution(
            id, workflowId, workflowVersion, target, inputData, output,
            stepResults, receivedEvents, message, code,
            createdAt, startedAt, now, seconds, version + 1, definition
        );
    }
}
