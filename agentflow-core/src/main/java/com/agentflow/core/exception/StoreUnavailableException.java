package com.agentflow.core.exception;

/**
 * Thrown once transient store failures outlast the retry budget.
 */
public class StoreUnavailableException extends AgentflowException {

    public static final String ERROR_CODE = "STORE_UNAVAILABLE";

    public StoreUnavailableException(String operation, int attempts, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Store operation '%s' failed after %d attempts: %s",
            operation, attempts, cause != null ? cause.getMessage() : "unknown"
        ), cause);
    }
}
