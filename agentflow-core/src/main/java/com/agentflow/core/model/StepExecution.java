package com.agentflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

/**
 * One attempt of one step within an execution.
 * Retries and loop iterations each produce a fresh record.
 *
 * Primary Key: id
 * Natural Key: (executionId, stepId, iteration, attempt)
 *
 * Invariants:
 * - attempt is 1-based and never exceeds the step's retry count + 1
 * - result set iff status == SUCCEEDED
 * - deadline set once the attempt is dispatched
 */
public record StepExecution(
    UUID id,
    UUID executionId,
    String stepId,
    String stepName,
    int iteration,
    int attempt,
    StepStatus status,
    JsonNode result,
    String error,
    String errorCode,
    Instant dispatchedAt,
    Instant deadline,
    Instant startedAt,
    Instant completedAt
) {
    /**
     * Create the first, pending attempt of a step.
     */
    public static StepExecution create(UUID executionId, String stepId, String stepName, int iteration) {
        return new StepExecution(
            UUID.randomUUID(), executionId, stepId, stepName, iteration, 1,
            StepStatus.PENDING, null, null, null,
            null, null, null, null
        );
    }

    public StepKey key() {
        return new StepKey(stepId, iteration);
    }

    /**
     * Create a copy handed to an executor, due by the given deadline.
     */
    public StepExecution withDispatched(Instant now, Instant due) {
        return new StepExecution(
            id, executionId, stepId, stepName, iteration, attempt,
            StepStatus.DISPATCHED, null, null, null,
            now, due, null, null
        );
    }

    /**
     * Create the record of the next attempt, dispatched immediately.
     */
    public StepExecution nextAttempt(Instant now, Instant due) {
        return new StepExecution(
            UUID.randomUUID(), executionId, stepId, stepName, iteration, attempt + 1,
            StepStatus.DISPATCHED, null, null, null,
            now, due, null, null
        );
    }

    public StepExecution withRunning(Instant now) {
        return new StepExecution(
            id, executionId, stepId, stepName, iteration, attempt,
            StepStatus.RUNNING, null, null, null,
            dispatchedAt, deadline, now, null
        );
    }

    public StepExecution withSucceeded(JsonNode stepResult, Instant now) {
        return new StepExecution(
            id, executionId, stepId, stepName, iteration, attempt,
            StepStatus.SUCCEEDED, stepResult, null, null,
            dispatchedAt, deadline, startedAt, now
        );
    }

    public StepExecution withFailed(String code, String message, Instant now) {
        return new StepExecution(
            id, executionId, stepId, stepName, iteration, attempt,
            StepStatus.FAILED, null, message, code,
            dispatchedAt, deadline, startedAt, now
        );
    }

    public StepExecution withTimedOut(Instant now) {
        return new StepExecution(
            id, executionId, stepId, stepName, iteration, attempt,
            StepStatus.TIMED_OUT, null,
            "Step did not complete within its timeout", ErrorCodes.STEP_TIMEOUT,
            dispatchedAt, deadline, startedAt, now
        );
    }

    /**
     * Keep the failure details, mark that another attempt follows.
     */
    public StepExecution withRetrying() {
        return new StepExecution(
            id, executionId, stepId, stepName, iteration, attempt,
            StepStatus.RETRYING, null, error, errorCode,
            dispatchedAt, deadline, startedAt, completedAt
        );
    }

    /**
     * Record of an attempt superseded by the next one, carrying its own outcome: TIMED_OUT when it
     * missed its deadline, FAILED otherwise.
     */
    public StepExecution withSettled() {
        StepStatus outcome = ErrorCodes.STEP_TIMEOUT.equals(errorCode) ? StepStatus.TIMED_OUT : StepStatus.FAILED;
        return new StepExecution(
            id, executionId, stepId, stepName, iteration, attempt,
            outcome, null, error, errorCode,
            dispatchedAt, deadline, startedAt, completedAt
        );
    }

    /**
     * Turn a timed out attempt into the step's final failure.
     */
    public StepExecution withExhausted() {
        return new StepExecution(
            id, executionId, stepId, stepName, iteration, attempt,
            StepStatus.FAILED, null, error, errorCode,
            dispatchedAt, deadline, startedAt, completedAt
        );
    }

    public StepExecution withSkipped(String code, String reason, Instant now) {
        return new StepExecution(
            id, executionId, stepId, stepName, iteration, attempt,
            StepStatus.SKIPPED, null, reason, code,
            dispatchedAt, deadline, startedAt, now
        );
    }

    /**
     * Check if the attempt is still awaiting a result after its deadline.
     */
    public boolean isOverdue(Instant now) {
        return status.isAwaitingResult() && deadline != null && !now.isBefore(deadline);
    }
}
