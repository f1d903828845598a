package com.agentflow.core.validation;

import java.util.Set;

/**
 * Shape required of steps of one {@code step_type}.
 *
 * @param stepType           the step type this schema applies to
 * @param requiresAgentRef   whether the step must name the agent that executes it
 * @param requiredParameters keys that must be present in {@code config.parameters}
 */
public record StepConfigSchema(String stepType, boolean requiresAgentRef, Set<String> requiredParameters) {

    public StepConfigSchema {
        requiredParameters = requiredParameters == null ? Set.of() : Set.copyOf(requiredParameters);
    }
}
