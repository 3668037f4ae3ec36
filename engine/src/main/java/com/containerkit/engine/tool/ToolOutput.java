package com.containerkit.engine.tool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one tool invocation.
 *
 * A failed output ({@code success == false}) is a tool-level outcome, not an
 * engine error: the call was dispatched and the tool answered.
 */
public record ToolOutput(boolean success,
                         Map<String, Object> data,
                         String error,
                         Map<String, Object> metadata) {

    public ToolOutput {
        data     = copy(data);
        metadata = copy(metadata);
    }

    public static ToolOutput success(Map<String, Object> data) {
        return new ToolOutput(true, data, null, Map.of());
    }

    public static ToolOutput failure(String error) {
        return new ToolOutput(false, Map.of(), error, Map.of());
    }

    // Tolerates null values, which Map.copyOf does not.
    private static Map<String, Object> copy(Map<String, Object> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
