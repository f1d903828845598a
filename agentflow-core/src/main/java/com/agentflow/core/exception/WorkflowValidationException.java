package com.agentflow.core.exception;

import com.agentflow.core.validation.ValidationResult;

/**
 * Thrown when a workflow definition or request fails validation.
 * Carries every violation found, not just the first.
 */
public class WorkflowValidationException extends AgentflowException {

    public static final String ERROR_CODE = "VALIDATION_ERROR";

    private final ValidationResult result;

    public WorkflowValidationException(ValidationResult result) {
        super(ERROR_CODE, result.summary());
        this.result = result;
    }

    public ValidationResult getResult() {
        return result;
    }
}
