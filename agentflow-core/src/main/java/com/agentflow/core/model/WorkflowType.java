package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Scheduling discipline governing how a workflow's steps are dispatched.
 */
public enum WorkflowType {
    /**
     * At most one step in flight, definition order among ready steps.
     */
    SEQUENTIAL,

    /**
     * All ready steps dispatched concurrently, bounded by the concurrency limit.
     */
    PARALLEL,

    /**
     * Steps carry a branch predicate evaluated before they become ready.
     */
    CONDITIONAL,

    /**
     * Steps may wait for a named external event in addition to their dependencies.
     */
    EVENT_DRIVEN,

    /**
     * A designated step subgraph is re-entered until a bound or predicate stops it.
     */
    LOOP;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static WorkflowType fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (WorkflowType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown workflow type: " + value);
    }

    /**
     * Check if steps of this topology are serialized by construction.
     */
    public boolean isSerial() {
        return this == SEQUENTIAL;
    }
}
