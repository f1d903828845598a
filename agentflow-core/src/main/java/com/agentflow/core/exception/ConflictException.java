package com.agentflow.core.exception;

/**
 * Thrown when a request conflicts with the current state, e.g. deleting a workflow
 * that still has active executions.
 */
public class ConflictException extends AgentflowException {

    public static final String ERROR_CODE = "CONFLICT";

    public ConflictException(String message) {
        super(ERROR_CODE, message);
    }
}
