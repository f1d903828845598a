package com.agentflow.core.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of validating a definition or request. Collects every violation so a single call
 * surfaces all problems.
 */
public final class ValidationResult {

    private final List<Violation> violations = new ArrayList<>();

    public static ValidationResult valid() {
        return new ValidationResult();
    }

    public ValidationResult add(ViolationCode code, String field, String message) {
        violations.add(new Violation(code, field, message));
        return this;
    }

    public ValidationResult merge(ValidationResult other) {
        violations.addAll(other.violations);
        return this;
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    public List<Violation> violations() {
        return Collections.unmodifiableList(violations);
    }

    public boolean hasViolation(ViolationCode code) {
        return violations.stream().anyMatch(v -> v.code() == code);
    }

    /**
     * One-line description of every violation, used as the exception message.
     */
    public String summary() {
        if (violations.isEmpty()) {
            return "Validation passed";
        }
        return violations.stream()
            .map(v -> v.field() + ": " + v.message())
            .collect(Collectors.joining("; ", "Validation failed: ", ""));
    }

    @Override
    public String toString() {
        return summary();
    }

    /**
     * A single problem, located by a field path such as {@code steps[2].timeout_seconds}.
     */
    public record Violation(ViolationCode code, String field, String message) {
    }
}
