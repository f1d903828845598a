package com.agentflow.worker;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.UUID;

/**
 * Everything an executor receives for one attempt of a step.
 *
 * @param stepId          Step identity within the workflow
 * @param stepName        Human-readable step name
 * @param stepType        Step type used to pick the executor when no agent is referenced
 * @param agentRef        Reference to the agent that executes the step
 * @param executionId     Owning execution
 * @param workflowId      Owning workflow
 * @param attempt         1-based attempt number
 * @param iteration       Loop iteration, 0 outside loops
 * @param timeoutSeconds  Time the executor has to report back
 * @param config          The step's opaque parameters
 * @param upstreamResults Results of direct dependencies, keyed by step name
 * @param inputData       The execution's input data
 * @param event           Payload of the event the step waited for, if any
 * @param cancellation    Signal raised when the execution is cancelled
 */
public record StepDispatch(
    String stepId,
    String stepName,
    String stepType,
    String agentRef,
    UUID executionId,
    String workflowId,
    int attempt,
    int iteration,
    int timeoutSeconds,
    JsonNode config,
    Map<String, JsonNode> upstreamResults,
    JsonNode inputData,
    JsonNode event,
    @JsonIgnore CancellationSignal cancellation
) {
    public StepDispatch {
        upstreamResults = upstreamResults == null ? Map.of() : Map.copyOf(upstreamResults);
    }

    /**
     * Idempotency key an executor can use to deduplicate retried attempts of the same step.
     */
    public String idempotencyKey() {
        return executionId + ":" + stepId + ":" + iteration;
    }

    @JsonIgnore
    public boolean isCancellationRequested() {
        return cancellation != null && cancellation.isCancelled();
    }
}
