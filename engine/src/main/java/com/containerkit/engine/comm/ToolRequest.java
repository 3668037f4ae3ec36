package com.containerkit.engine.comm;

import com.containerkit.engine.tool.ToolInput;

/**
 * A tool call routed through the {@link CommunicationManager}.
 *
 * @param id       correlation id; generated when null or blank
 * @param parentId correlation id of the request that issued this one, if any
 */
public record ToolRequest(String id, String toolName, ToolInput input, String parentId) {

    public static ToolRequest of(String toolName, ToolInput input) {
        return new ToolRequest(null, toolName, input, null);
    }

    public ToolRequest childOf(String parentCorrelationId) {
        return new ToolRequest(null, toolName, input, parentCorrelationId);
    }
}
