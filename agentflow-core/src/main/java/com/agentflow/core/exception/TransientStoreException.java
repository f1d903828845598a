package com.agentflow.core.exception;

/**
 * A persistence hiccup worth retrying: lost connection, lock timeout, failover.
 */
public class TransientStoreException extends AgentflowException {

    public static final String ERROR_CODE = "TRANSIENT_STORE_ERROR";

    public TransientStoreException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
