package com.agentflow.core.exception;

/**
 * Thrown when a workflow or execution is not found.
 */
public class NotFoundException extends AgentflowException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, Object entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
