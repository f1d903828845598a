package com.agentflow.engine.state;

import com.agentflow.core.exception.StoreUnavailableException;
import com.agentflow.core.exception.TransientStoreException;
import com.agentflow.core.model.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Retries store operations that failed with a {@link TransientStoreException}, backing off
 * exponentially. Once attempts are used up the failure escalates as {@link StoreUnavailableException}.
 */
public class StoreRetrier {

    private static final Logger log = LoggerFactory.getLogger(StoreRetrier.class);

    private final RetryPolicy policy;

    public StoreRetrier(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
        this.policy = RetryPolicy.builder()
            .maxAttempts(maxAttempts)
            .initialBackoff(initialBackoff)
            .maxBackoff(maxBackoff)
            .backoffMultiplier(2.0)
            .jitterFactor(0.1)
            .build();
    }

    public static StoreRetrier defaults() {
        return new StoreRetrier(3, Duration.ofMillis(100), Duration.ofSeconds(2));
    }

    public static StoreRetrier noRetry() {
        return new StoreRetrier(1, Duration.ofMillis(1), Duration.ofMillis(1));
    }

    public <T> T call(String operation, Supplier<T> action) {
        int attempt = 1;
        while (true) {
            try {
                return action.get();
            } catch (TransientStoreException e) {
                if (!policy.hasMoreAttempts(attempt)) {
                    log.error("Store operation '{}' failed after {} attempts", operation, attempt, e);
                    throw new StoreUnavailableException(operation, attempt, e);
                }
                Duration backoff = policy.computeBackoff(attempt);
                log.warn("Store operation '{}' failed (attempt {}), retrying in {}ms: {}",
                    operation, attempt, backoff.toMillis(), e.getMessage());
                sleep(backoff, operation, attempt, e);
                attempt++;
            }
        }
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    private static void sleep(Duration backoff, String operation, int attempt, TransientStoreException cause) {
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException(operation, attempt, cause);
        }
    }
}
