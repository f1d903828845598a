package com.agentflow.engine.execution;

import com.agentflow.core.model.RetryPolicy;
import com.agentflow.core.model.WorkflowStep;

import java.time.Duration;

/**
 * Tunables of the execution engine.
 *
 * @param maxConcurrency        default limit of attempts in flight per execution
 * @param workerThreads         size of the pool running executor calls
 * @param defaultTimeoutSeconds timeout applied to steps that do not set one
 * @param defaultRetryCount     retry count applied to steps that do not set one
 * @param retryPolicy           backoff defaults; attempts are always derived from the step
 * @param shutdownTimeout       how long shutdown waits for in-flight attempts
 */
public record EngineSettings(
    int maxConcurrency,
    int workerThreads,
    int defaultTimeoutSeconds,
    int defaultRetryCount,
    RetryPolicy retryPolicy,
    Duration shutdownTimeout
) {
    public static EngineSettings defaults() {
        return new EngineSettings(
            10,
            32,
            WorkflowStep.DEFAULT_TIMEOUT_SECONDS,
            WorkflowStep.DEFAULT_RETRY_COUNT,
            RetryPolicy.defaultPolicy(),
            Duration.ofSeconds(30)
        );
    }

    public EngineSettings withRetryPolicy(RetryPolicy policy) {
        return new EngineSettings(maxConcurrency, workerThreads, defaultTimeoutSeconds,
            defaultRetryCount, policy, shutdownTimeout);
    }

    public EngineSettings withMaxConcurrency(int concurrency) {
        return new EngineSettings(concurrency, workerThreads, defaultTimeoutSeconds,
            defaultRetryCount, retryPolicy, shutdownTimeout);
    }
}
