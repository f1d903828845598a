package com.agentflow.core.validation;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Schemas keyed by step type. Step types without a registered schema are accepted as-is.
 */
public class StepConfigSchemaRegistry {

    public static final String AGENT_STEP_TYPE = "agent";

    private final Map<String, StepConfigSchema> schemas = new ConcurrentHashMap<>();

    /**
     * Registry with the built-in {@code agent} step type, which must name its agent.
     */
    public static StepConfigSchemaRegistry withDefaults() {
        StepConfigSchemaRegistry registry = new StepConfigSchemaRegistry();
        registry.register(new StepConfigSchema(AGENT_STEP_TYPE, true, Set.of()));
        return registry;
    }

    public void register(StepConfigSchema schema) {
        schemas.put(schema.stepType(), schema);
    }

    public Optional<StepConfigSchema> find(String stepType) {
        return stepType == null ? Optional.empty() : Optional.ofNullable(schemas.get(stepType));
    }
}
