package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle states for a single step attempt.
 *
 * <pre>
 * pending -> dispatched -> running -> {succeeded | failed | timed_out}
 * failed | timed_out -> retrying -> dispatched (next attempt)
 * timed_out -> failed (attempts exhausted)
 * pending -> skipped (dependency failed, branch not taken, cancellation)
 * </pre>
 *
 * A persisted {@code FAILED} record is always final for its attempt. A failure with attempts
 * left is stored as {@code RETRYING} until the next attempt is dispatched; the superseded record
 * then keeps its own outcome, {@code FAILED} or {@code TIMED_OUT}. A timeout is stored as
 * {@code TIMED_OUT} before it moves on to {@code RETRYING} or {@code FAILED}.
 */
public enum StepStatus {
    PENDING,
    DISPATCHED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    TIMED_OUT,
    RETRYING,
    SKIPPED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static StepStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (StepStatus status : values()) {
            if (status.name().equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown step status: " + value);
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }

    /**
     * Check if an attempt in this state occupies a concurrency slot.
     */
    public boolean isInFlight() {
        return this == DISPATCHED || this == RUNNING || this == RETRYING;
    }

    /**
     * Check if an executor may still report a result for an attempt in this state.
     */
    public boolean isAwaitingResult() {
        return this == DISPATCHED || this == RUNNING;
    }

    public boolean canTransitionTo(StepStatus target) {
        return switch (this) {
            case PENDING -> target == DISPATCHED || target == SKIPPED;
            case DISPATCHED -> target == RUNNING || target == FAILED || target == TIMED_OUT || target == SKIPPED;
            case RUNNING -> target == SUCCEEDED || target == FAILED || target == TIMED_OUT || target == SKIPPED;
            case FAILED -> target == RETRYING;
            case TIMED_OUT -> target == RETRYING || target == FAILED;
            case RETRYING -> target == DISPATCHED || target == SKIPPED;
            case SUCCEEDED, SKIPPED -> false;
        };
    }
}
