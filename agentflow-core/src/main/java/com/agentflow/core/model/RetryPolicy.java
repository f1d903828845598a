package com.agentflow.core.model;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Configuration for retry behavior of step attempts.
 * Immutable and reusable across steps.
 *
 * Invariants:
 * - maxAttempts >= 1
 * - maxBackoff >= initialBackoff
 * - backoffMultiplier >= 1.0
 * - jitterFactor in [0.0, 1.0]
 */
public record RetryPolicy(
    int maxAttempts,
    BackoffStrategy strategy,
    Duration initialBackoff,
    Duration maxBackoff,
    double backoffMultiplier,
    double jitterFactor,
    Set<String> nonRetryableErrors
) {
    /**
     * How the wait between attempts grows.
     */
    public enum BackoffStrategy {
        EXPONENTIAL,
        FIXED
    }

    public RetryPolicy {
        nonRetryableErrors = nonRetryableErrors == null ? Set.of() : Set.copyOf(nonRetryableErrors);
    }

    /**
     * Default retry policy: 4 attempts, exponential backoff starting at 1s.
     */
    public static RetryPolicy defaultPolicy() {
        return builder().build();
    }

    /**
     * No retry policy: single attempt only.
     */
    public static RetryPolicy noRetry() {
        return builder()
            .maxAttempts(1)
            .initialBackoff(Duration.ZERO)
            .maxBackoff(Duration.ZERO)
            .jitterFactor(0.0)
            .build();
    }

    /**
     * Compute the backoff duration before the attempt that follows {@code attemptNumber}.
     *
     * @param attemptNumber 1-indexed number of the attempt that just failed
     * @return Duration to wait before the next attempt
     */
    public Duration computeBackoff(int attemptNumber) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("Attempt number must be >= 1");
        }

        double baseBackoffMs = strategy == BackoffStrategy.FIXED
            ? initialBackoff.toMillis()
            : initialBackoff.toMillis() * Math.pow(backoffMultiplier, attemptNumber - 1);

        double cappedBackoffMs = Math.min(baseBackoffMs, maxBackoff.toMillis());

        // backoff * (1 - jitter + random(0, 2*jitter))
        double jitterRange = cappedBackoffMs * jitterFactor;
        double jitteredBackoffMs = cappedBackoffMs - jitterRange +
            ThreadLocalRandom.current().nextDouble() * 2 * jitterRange;

        return Duration.ofMillis((long) jitteredBackoffMs);
    }

    /**
     * Check if the given error code should trigger a retry.
     */
    public boolean shouldRetry(String errorCode) {
        return errorCode == null || !nonRetryableErrors.contains(errorCode);
    }

    /**
     * Check if more attempts are available.
     *
     * @param currentAttempt Current attempt number (1-indexed)
     */
    public boolean hasMoreAttempts(int currentAttempt) {
        return currentAttempt < maxAttempts;
    }

    public RetryPolicy withMaxAttempts(int attempts) {
        return new RetryPolicy(attempts, strategy, initialBackoff, maxBackoff,
            backoffMultiplier, jitterFactor, nonRetryableErrors);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxAttempts = WorkflowStep.DEFAULT_RETRY_COUNT + 1;
        private BackoffStrategy strategy = BackoffStrategy.EXPONENTIAL;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofMinutes(1);
        private double backoffMultiplier = 2.0;
        private double jitterFactor = 0.1;
        private Set<String> nonRetryableErrors = Set.of();

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder strategy(BackoffStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder initialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder jitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
            return this;
        }

        public Builder nonRetryableErrors(Set<String> nonRetryableErrors) {
            this.nonRetryableErrors = nonRetryableErrors;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(
                maxAttempts, strategy, initialBackoff, maxBackoff,
                backoffMultiplier, jitterFactor, nonRetryableErrors
            );
        }
    }
}
