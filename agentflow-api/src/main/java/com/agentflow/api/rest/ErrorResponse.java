package com.agentflow.api.rest;

import com.agentflow.core.validation.ValidationResult;
import com.agentflow.core.validation.ViolationCode;

import java.time.Instant;
import java.util.List;

/**
 * Error envelope returned by every endpoint.
 *
 * <pre>{@code
 * {
 *   "error_code": "VALIDATION_ERROR",
 *   "message": "Validation failed: steps[1].dependencies: unknown step 'X'",
 *   "violations": [{"code": "UNKNOWN_DEPENDENCY", "field": "steps[1].dependencies", "message": "..."}],
 *   "timestamp": "2025-01-01T10:00:00Z",
 *   "path": "/workflows"
 * }
 * }</pre>
 */
public record ErrorResponse(
    String errorCode,
    String message,
    List<ViolationDto> violations,
    Instant timestamp,
    String path
) {
    public static ErrorResponse of(String errorCode, String message, String path) {
        return new ErrorResponse(errorCode, message, List.of(), Instant.now(), path);
    }

    public static ErrorResponse of(String errorCode, ValidationResult result, String path) {
        return new ErrorResponse(
            errorCode,
            result.summary(),
            result.violations().stream().map(ViolationDto::from).toList(),
            Instant.now(),
            path
        );
    }

    public record ViolationDto(ViolationCode code, String field, String message) {
        static ViolationDto from(ValidationResult.Violation violation) {
            return new ViolationDto(violation.code(), violation.field(), violation.message());
        }
    }
}
