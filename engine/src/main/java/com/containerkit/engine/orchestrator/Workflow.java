package com.containerkit.engine.orchestrator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered sequence of tool steps, run one after another until the first
 * failure.
 *
 * @param variables values shared by every step: merged under each step's own
 *                  input and exposed in {@code ToolInput.context()}. A
 *                  {@code session_id} variable becomes the session of every step.
 */
public record Workflow(String id, String name, List<Step> steps, Map<String, Object> variables) {

    public Workflow {
        steps     = steps == null ? List.of() : List.copyOf(steps);
        variables = variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    /** One tool call within a workflow. */
    public record Step(String name, String tool, Map<String, Object> input) {
        public Step {
            input = input == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(input));
        }
    }
}
