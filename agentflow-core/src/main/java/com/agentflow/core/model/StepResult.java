package com.agentflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Terminal outcome of a step, appended to the execution's step results.
 */
public record StepResult(
    String stepId,
    String stepName,
    int iteration,
    int attempt,
    StepStatus status,
    JsonNode result,
    String error,
    String errorCode,
    Instant completedAt
) {
    public static StepResult of(StepExecution step) {
        return new StepResult(
            step.stepId(), step.stepName(), step.iteration(), step.attempt(),
            step.status(), step.result(), step.error(), step.errorCode(), step.completedAt()
        );
    }
}
