package com.agentflow.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Executors keyed by agent reference or step type.
 * Resolution tries the step's {@code agent_ref} first, then its {@code step_type}.
 */
public class StepExecutorRegistry {

    private static final Logger log = LoggerFactory.getLogger(StepExecutorRegistry.class);

    private final Map<String, StepExecutor> executors = new ConcurrentHashMap<>();

    /**
     * Register an executor.
     */
    public StepExecutorRegistry register(String name, StepExecutor executor) {
        StepExecutor previous = executors.put(name, executor);
        if (previous != null) {
            log.warn("Replaced step executor: {}", name);
        } else {
            log.info("Registered step executor: {}", name);
        }
        return this;
    }

    public Optional<StepExecutor> resolve(String agentRef, String stepType) {
        if (agentRef != null && executors.containsKey(agentRef)) {
            return Optional.of(executors.get(agentRef));
        }
        if (stepType != null && executors.containsKey(stepType)) {
            return Optional.of(executors.get(stepType));
        }
        return Optional.empty();
    }

    public Set<String> names() {
        return Set.copyOf(executors.keySet());
    }
}
