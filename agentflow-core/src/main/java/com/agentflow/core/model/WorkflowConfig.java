package com.agentflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Typed view of a workflow's {@code config} object.
 *
 * <pre>
 * {
 *   "continue_on_failure": false,
 *   "max_concurrency": 4,
 *   "output_steps": ["summarize"],
 *   "retry": {"backoff": "exponential", "initial_backoff_ms": 1000, "max_backoff_ms": 60000, "multiplier": 2.0},
 *   "loop": {"steps": ["poll"], "max_iterations": 5, "while": "poll.result.done == false"}
 * }
 * </pre>
 */
public record WorkflowConfig(
    boolean continueOnFailure,
    Integer maxConcurrency,
    List<String> outputSteps,
    RetrySettings retry,
    LoopConfig loop
) {
    public static final WorkflowConfig DEFAULT = new WorkflowConfig(false, null, List.of(), null, null);

    public WorkflowConfig {
        outputSteps = outputSteps == null ? List.of() : List.copyOf(outputSteps);
    }

    /**
     * Parse a raw config object.
     *
     * @throws IllegalArgumentException if a known field has the wrong shape
     */
    public static WorkflowConfig parse(JsonNode config) {
        ConfigReader reader = new ConfigReader(config, "config");
        Integer maxConcurrency = reader.integer("max_concurrency");
        if (maxConcurrency != null && maxConcurrency < 1) {
            throw new IllegalArgumentException("config.max_concurrency must be at least 1");
        }
        return new WorkflowConfig(
            reader.bool("continue_on_failure", false),
            maxConcurrency,
            reader.textList("output_steps"),
            reader.has("retry") ? RetrySettings.parse(reader.object("retry")) : null,
            reader.has("loop") ? LoopConfig.parse(reader.object("loop")) : null
        );
    }

    /**
     * Retry policy for a step of this workflow, starting from the engine defaults.
     */
    public RetryPolicy retryPolicy(RetryPolicy defaults, int maxAttempts) {
        RetryPolicy base = retry != null ? retry.applyTo(defaults) : defaults;
        return base.withMaxAttempts(maxAttempts);
    }

    /**
     * Backoff overrides taken from {@code config.retry}.
     */
    public record RetrySettings(
        RetryPolicy.BackoffStrategy backoff,
        Long initialBackoffMs,
        Long maxBackoffMs,
        Double multiplier
    ) {
        static RetrySettings parse(ConfigReader reader) {
            String backoff = reader.text("backoff");
            RetryPolicy.BackoffStrategy strategy = null;
            if (backoff != null) {
                try {
                    strategy = RetryPolicy.BackoffStrategy.valueOf(backoff.toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException(
                        "config.retry.backoff must be 'exponential' or 'fixed'", e);
                }
            }
            Long initial = reader.longValue("initial_backoff_ms");
            Long max = reader.longValue("max_backoff_ms");
            Double multiplier = reader.number("multiplier");
            if (initial != null && initial < 0) {
                throw new IllegalArgumentException("config.retry.initial_backoff_ms must not be negative");
            }
            if (max != null && max < 0) {
                throw new IllegalArgumentException("config.retry.max_backoff_ms must not be negative");
            }
            if (multiplier != null && multiplier < 1.0) {
                throw new IllegalArgumentException("config.retry.multiplier must be at least 1.0");
            }
            return new RetrySettings(strategy, initial, max, multiplier);
        }

        RetryPolicy applyTo(RetryPolicy defaults) {
            Duration initial = initialBackoffMs != null
                ? Duration.ofMillis(initialBackoffMs) : defaults.initialBackoff();
            Duration max = maxBackoffMs != null ? Duration.ofMillis(maxBackoffMs) : defaults.maxBackoff();
            return new RetryPolicy(
                defaults.maxAttempts(),
                backoff != null ? backoff : defaults.strategy(),
                initial,
                max.compareTo(initial) < 0 ? initial : max,
                multiplier != null ? multiplier : defaults.backoffMultiplier(),
                defaults.jitterFactor(),
                defaults.nonRetryableErrors()
            );
        }
    }

    /**
     * Loop settings: which steps are re-entered, how often, and while which predicate holds.
     * An empty step list means the whole workflow is the loop body.
     */
    public record LoopConfig(List<String> steps, int maxIterations, String whileCondition) {

        public static final int MAX_ITERATIONS_LIMIT = 1000;

        public LoopConfig {
            steps = steps == null ? List.of() : List.copyOf(steps);
        }

        static LoopConfig parse(ConfigReader reader) {
            Integer maxIterations = reader.integer("max_iterations");
            if (maxIterations == null) {
                throw new IllegalArgumentException("config.loop.max_iterations is required");
            }
            if (maxIterations < 1 || maxIterations > MAX_ITERATIONS_LIMIT) {
                throw new IllegalArgumentException(
                    "config.loop.max_iterations must be between 1 and " + MAX_ITERATIONS_LIMIT);
            }
            return new LoopConfig(reader.textList("steps"), maxIterations, reader.text("while"));
        }
    }
}
