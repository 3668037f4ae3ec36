package com.containerkit.engine.tool;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Declared input shape of a tool.
 *
 * The engine validates {@link ToolInput#data()} against this before the tool
 * runs, so tool implementations can read their arguments without re-checking
 * presence or basic types. Properties not declared here are passed through.
 *
 * @param properties  argument name to expected type, in declaration order
 * @param required    argument names that must be present and non-null
 * @param output      one-line description of what the tool returns
 */
public record ToolSchema(Map<String, ParamType> properties, Set<String> required, String output) {

    public enum ParamType {
        STRING, NUMBER, INTEGER, BOOLEAN, OBJECT, ARRAY, ANY;

        boolean accepts(Object value) {
            return switch (this) {
                case STRING  -> value instanceof CharSequence;
                case NUMBER  -> value instanceof Number;
                case INTEGER -> value instanceof Integer || value instanceof Long
                                || value instanceof Short || value instanceof Byte;
                case BOOLEAN -> value instanceof Boolean;
                case OBJECT  -> value instanceof Map;
                case ARRAY   -> value instanceof Collection || (value != null && value.getClass().isArray());
                case ANY     -> true;
            };
        }

        String jsonName() {
            return this == ANY ? "any" : name().toLowerCase();
        }
    }

    public ToolSchema {
        properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        required   = required   == null ? Set.of() : Set.copyOf(required);
        for (String name : required) {
            if (!properties.containsKey(name)) {
                throw new IllegalArgumentException("Required property '" + name + "' is not declared");
            }
        }
    }

    /** Schema for tools that take no declared arguments. */
    public static ToolSchema empty() {
        return new ToolSchema(Map.of(), Set.of(), "");
    }

    /** Returns human-readable violations; empty when {@code data} conforms. */
    public List<String> validate(Map<String, Object> data) {
        Map<String, Object> args = data == null ? Map.of() : data;
        List<String> violations = new ArrayList<>();
        for (String name : required) {
            if (args.get(name) == null) {
                violations.add("missing required property '" + name + "'");
            }
        }
        properties.forEach((name, type) -> {
            Object value = args.get(name);
            if (value != null && !type.accepts(value)) {
                violations.add("property '%s' must be %s but was %s"
                        .formatted(name, type.jsonName(), value.getClass().getSimpleName()));
            }
        });
        return violations;
    }

    /** JSON-schema-shaped view for API consumers. */
    public Map<String, Object> toJsonSchema() {
        Map<String, Object> props = new LinkedHashMap<>();
        properties.forEach((name, type) -> props.put(name, Map.of("type", type.jsonName())));
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", props);
        schema.put("required", required.stream().sorted().toList());
        if (output != null && !output.isBlank()) {
            schema.put("description", output);
        }
        return schema;
    }
}
