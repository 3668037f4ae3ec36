package com.containerkit.engine.comm;

import com.containerkit.engine.tool.ToolOutput;

import java.time.Duration;

/**
 * Terminal answer to a {@link ToolRequest}. {@code output.success()} may be
 * false: the tool ran and reported failure.
 *
 * @param attempts dispatches made, including the first
 */
public record ToolResponse(String correlationId, ToolOutput output, int attempts, Duration duration) {}
