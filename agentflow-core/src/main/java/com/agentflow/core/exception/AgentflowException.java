package com.agentflow.core.exception;

/**
 * Root of the agentflow error taxonomy. Each subclass publishes an {@code ERROR_CODE} constant,
 * which the REST layer returns as {@code error_code}.
 */
public class AgentflowException extends RuntimeException {

    private final String errorCode;

    protected AgentflowException(String errorCode, String message) {
        this(errorCode, message, null);
    }

    protected AgentflowException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
