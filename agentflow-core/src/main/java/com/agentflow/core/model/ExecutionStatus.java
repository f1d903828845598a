package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle states for a workflow execution.
 * Terminal states are never left.
 */
public enum ExecutionStatus {
    /**
     * Execution record created, waiting for the engine to start it.
     * Transitions: -> RUNNING, CANCELLED, FAILED
     */
    PENDING,

    /**
     * At least one step is not terminal.
     * Transitions: -> SUCCEEDED, FAILED, CANCELLED
     */
    RUNNING,

    /**
     * Every step succeeded or was permissibly skipped. Terminal state.
     */
    SUCCEEDED,

    /**
     * A required step terminally failed, or the store could not record progress. Terminal state.
     */
    FAILED,

    /**
     * Stopped by an explicit cancellation request. Terminal state.
     */
    CANCELLED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ExecutionStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ExecutionStatus status : values()) {
            if (status.name().equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown execution status: " + value);
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(ExecutionStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING || target == CANCELLED || target == FAILED;
            case RUNNING -> target == SUCCEEDED || target == FAILED || target == CANCELLED;
            case SUCCEEDED, FAILED, CANCELLED -> false;
        };
    }
}
