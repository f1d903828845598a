package com.agentflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed access to optional fields of a JSON config object.
 * Type mismatches raise {@link IllegalArgumentException} naming the offending field.
 */
final class ConfigReader {

    private final JsonNode node;
    private final String path;

    ConfigReader(JsonNode node, String path) {
        if (node != null && !node.isNull() && !node.isObject()) {
            throw new IllegalArgumentException(path + " must be a JSON object");
        }
        this.node = node == null || node.isNull() ? null : node;
        this.path = path;
    }

    boolean has(String field) {
        return node != null && node.hasNonNull(field);
    }

    JsonNode raw(String field) {
        return has(field) ? node.get(field) : null;
    }

    ConfigReader object(String field) {
        return new ConfigReader(raw(field), path + "." + field);
    }

    boolean bool(String field, boolean defaultValue) {
        JsonNode value = raw(field);
        if (value == null) {
            return defaultValue;
        }
        if (!value.isBoolean()) {
            throw new IllegalArgumentException(path + "." + field + " must be a boolean");
        }
        return value.booleanValue();
    }

    Integer integer(String field) {
        JsonNode value = raw(field);
        if (value == null) {
            return null;
        }
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new IllegalArgumentException(path + "." + field + " must be an integer");
        }
        return value.intValue();
    }

    Long longValue(String field) {
        JsonNode value = raw(field);
        if (value == null) {
            return null;
        }
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw new IllegalArgumentException(path + "." + field + " must be an integer");
        }
        return value.longValue();
    }

    Double number(String field) {
        JsonNode value = raw(field);
        if (value == null) {
            return null;
        }
        if (!value.isNumber()) {
            throw new IllegalArgumentException(path + "." + field + " must be a number");
        }
        return value.doubleValue();
    }

    String text(String field) {
        JsonNode value = raw(field);
        if (value == null) {
            return null;
        }
        if (!value.isTextual()) {
            throw new IllegalArgumentException(path + "." + field + " must be a string");
        }
        String text = value.textValue().trim();
        return text.isEmpty() ? null : text;
    }

    List<String> textList(String field) {
        JsonNode value = raw(field);
        if (value == null) {
            return null;
        }
        if (!value.isArray()) {
            throw new IllegalArgumentException(path + "." + field + " must be an array of strings");
        }
        List<String> items = new ArrayList<>();
        for (JsonNode item : value) {
            if (!item.isTextual()) {
                throw new IllegalArgumentException(path + "." + field + " must be an array of strings");
            }
            items.add(item.textValue());
        }
        return items;
    }
}
