package com.containerkit.engine.tool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured input for one tool invocation.
 *
 * @param sessionId caller session; may be null for session-less calls
 * @param data      tool arguments, validated against the tool's schema
 * @param context   ambient values (workflow variables, caller hints) not
 *                  covered by the schema
 */
public record ToolInput(String sessionId, Map<String, Object> data, Map<String, Object> context) {

    public ToolInput {
        data    = copy(data);
        context = copy(context);
    }

    public static ToolInput of(Map<String, Object> data) {
        return new ToolInput(null, data, Map.of());
    }

    public static ToolInput of(String sessionId, Map<String, Object> data) {
        return new ToolInput(sessionId, data, Map.of());
    }

    // Tolerates null values, which Map.copyOf does not.
    private static Map<String, Object> copy(Map<String, Object> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
