package com.agentflow.core.model;

/**
 * Error codes recorded on steps and executions. They are data, never thrown to callers.
 */
public final class ErrorCodes {

    public static final String STEP_FAILED = "STEP_FAILED";
    public static final String STEP_TIMEOUT = "STEP_TIMEOUT";
    public static final String NO_EXECUTOR = "NO_EXECUTOR";
    public static final String STORE_ERROR = "STORE_ERROR";
    public static final String ORCHESTRATOR_RESTART = "ORCHESTRATOR_RESTART";
    public static final String DEPENDENCY_FAILED = "DEPENDENCY_FAILED";
    public static final String CONDITION_NOT_MET = "CONDITION_NOT_MET";
    public static final String CANCELLED = "CANCELLED";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private ErrorCodes() {
    }
}
