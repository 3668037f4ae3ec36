package com.containerkit.engine.tool;

import java.util.Map;

/** Read-only summary of a registered tool, as shown to API consumers. */
public record ToolDescriptor(String name,
                             String description,
                             ToolCategory category,
                             Map<String, Object> inputSchema) {

    public static ToolDescriptor from(Tool tool) {
        return new ToolDescriptor(tool.name(), tool.description(), tool.category(),
                tool.schema().toJsonSchema());
    }
}
