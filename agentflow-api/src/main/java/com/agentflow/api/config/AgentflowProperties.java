package com.agentflow.api.config;

import com.agentflow.core.model.RetryPolicy;
import com.agentflow.core.validation.ValidationLimits;
import com.agentflow.engine.execution.EngineSettings;
import com.agentflow.engine.state.StoreRetrier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Settings bound from the {@code agentflow.*} namespace.
 */
@ConfigurationProperties(prefix = "agentflow")
public record AgentflowProperties(
    @DefaultValue Store store,
    @DefaultValue Engine engine,
    @DefaultValue Recovery recovery,
    @DefaultValue Validation validation,
    Map<String, Agent> agents
) {
    public AgentflowProperties {
        agents = agents == null ? Map.of() : Map.copyOf(agents);
    }

    public enum StoreType {
        JDBC,
        MEMORY
    }

    public record Store(
        @DefaultValue("jdbc") StoreType type,
        @DefaultValue StoreRetry retry
    ) {
    }

    public record StoreRetry(
        @DefaultValue("3") int maxAttempts,
        @DefaultValue("100ms") Duration initialBackoff,
        @DefaultValue("2s") Duration maxBackoff
    ) {
        public StoreRetrier toRetrier() {
            return new StoreRetrier(maxAttempts, initialBackoff, maxBackoff);
        }
    }

    public record Engine(
        @DefaultValue("10") int maxConcurrency,
        @DefaultValue("32") int workerThreads,
        @DefaultValue("300") int defaultTimeoutSeconds,
        @DefaultValue("3") int defaultRetryCount,
        @DefaultValue("30s") Duration shutdownTimeout,
        @DefaultValue Retry retry
    ) {
        public EngineSettings toSettings() {
            return new EngineSettings(
                maxConcurrency,
                workerThreads,
                defaultTimeoutSeconds,
                defaultRetryCount,
                retry.toPolicy(defaultRetryCount + 1),
                shutdownTimeout
            );
        }
    }

    /**
     * Backoff between step attempts. Workflows may override it in their {@code retry} config.
     */
    public record Retry(
        @DefaultValue("exponential") RetryPolicy.BackoffStrategy backoff,
        @DefaultValue("1s") Duration initialBackoff,
        @DefaultValue("60s") Duration maxBackoff,
        @DefaultValue("2.0") double multiplier,
        @DefaultValue("0.1") double jitter
    ) {
        RetryPolicy toPolicy(int maxAttempts) {
            return RetryPolicy.builder()
                .maxAttempts(maxAttempts)
                .strategy(backoff)
                .initialBackoff(initialBackoff)
                .maxBackoff(maxBackoff)
                .backoffMultiplier(multiplier)
                .jitterFactor(jitter)
                .build();
        }
    }

    public record Recovery(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("10s") Duration sweepInterval
    ) {
    }

    public record Validation(
        @DefaultValue("255") int maxNameLength,
        @DefaultValue("1000") int maxDescriptionLength,
        @DefaultValue("20") int maxTags,
        @DefaultValue("50") int maxTagLength,
        @DefaultValue("100") int maxSteps,
        @DefaultValue("100") int maxStepTypeLength,
        @DefaultValue("255") int maxIdLength,
        @DefaultValue("1") int minTimeoutSeconds,
        @DefaultValue("3600") int maxTimeoutSeconds,
        @DefaultValue("10") int maxRetryCount,
        @DefaultValue("1MB") DataSize maxConfigSize,
        @DefaultValue("1MB") DataSize maxMetadataSize,
        @DefaultValue("10MB") DataSize maxInputSize,
        @DefaultValue("1000") int maxPageSize
    ) {
        public ValidationLimits toLimits() {
            return new ValidationLimits(
                maxNameLength,
                maxDescriptionLength,
                maxTags,
                maxTagLength,
                maxSteps,
                maxStepTypeLength,
                maxIdLength,
                minTimeoutSeconds,
                maxTimeoutSeconds,
                maxRetryCount,
                maxConfigSize.toBytes(),
                maxMetadataSize.toBytes(),
                maxInputSize.toBytes(),
                maxPageSize
            );
        }
    }

    /**
     * A remote agent reached over HTTP, registered under its {@code agent_ref}.
     */
    public record Agent(
        URI url,
        @DefaultValue("5s") Duration connectTimeout
    ) {
    }
}
