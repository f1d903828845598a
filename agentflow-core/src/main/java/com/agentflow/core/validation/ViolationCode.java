package com.agentflow.core.validation;

/**
 * Machine-readable category of a validation violation.
 */
public enum ViolationCode {
    REQUIRED,
    TOO_LONG,
    TOO_MANY,
    OUT_OF_RANGE,
    INVALID_FORMAT,
    DUPLICATE_NAME,
    UNKNOWN_DEPENDENCY,
    SELF_DEPENDENCY,
    CYCLE,
    PAYLOAD_TOO_LARGE,
    INVALID_CONFIG,
    INVALID_PREDICATE
}
