package com.agentflow.core.validation;

/**
 * Size and range bounds enforced on definitions and requests.
 */
public record ValidationLimits(
    int maxNameLength,
    int maxDescriptionLength,
    int maxTags,
    int maxTagLength,
    int maxSteps,
    int maxStepTypeLength,
    int maxIdLength,
    int minTimeoutSeconds,
    int maxTimeoutSeconds,
    int maxRetryCount,
    long maxConfigBytes,
    long maxMetadataBytes,
    long maxInputBytes,
    int maxPageSize
) {
    public static ValidationLimits defaults() {
        return new ValidationLimits(
            255,
            1000,
            20,
            50,
            100,
            100,
            255,
            1,
            3600,
            10,
            1024 * 1024,
            1024 * 1024,
            10 * 1024 * 1024,
            1000
        );
    }
}
