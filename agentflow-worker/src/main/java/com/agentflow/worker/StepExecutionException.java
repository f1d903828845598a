package com.agentflow.worker;

/**
 * Exception thrown by step executors on failure.
 */
public class StepExecutionException extends Exception {

    public static final String DEFAULT_ERROR_CODE = "STEP_FAILED";

    private final String errorCode;
    private final boolean retryable;

    public StepExecutionException(String message) {
        this(DEFAULT_ERROR_CODE, message, true);
    }

    public StepExecutionException(String errorCode, String message, boolean retryable) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public StepExecutionException(String errorCode, String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Create a non-retryable exception (permanent failure).
     */
    public static StepExecutionException permanent(String errorCode, String message) {
        return new StepExecutionException(errorCode, message, false);
    }

    /**
     * Create a retryable exception (transient failure).
     */
    public static StepExecutionException retryable(String errorCode, String message) {
        return new StepExecutionException(errorCode, message, true);
    }
}
