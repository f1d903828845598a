package com.agentflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * Typed view of a step's {@code config} object. Only {@code parameters} is opaque, and it is
 * forwarded to the executor untouched.
 *
 * <pre>
 * {"best_effort": true, "condition": "A.result.flag == true", "await_event": "approved", "parameters": {...}}
 * </pre>
 */
public record StepConfig(
    boolean bestEffort,
    String condition,
    String awaitEvent,
    JsonNode parameters
) {
    public static StepConfig parse(JsonNode config, String path) {
        ConfigReader reader = new ConfigReader(config, path);
        JsonNode parameters = reader.raw("parameters");
        if (parameters != null && !parameters.isObject()) {
            throw new IllegalArgumentException(path + ".parameters must be a JSON object");
        }
        return new StepConfig(
            reader.bool("best_effort", false),
            reader.text("condition"),
            reader.text("await_event"),
            parameters != null ? parameters : JsonNodeFactory.instance.objectNode()
        );
    }
}
