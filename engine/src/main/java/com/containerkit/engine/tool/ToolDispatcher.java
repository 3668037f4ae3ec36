package com.containerkit.engine.tool;

/**
 * Anything that can run a tool by name. The {@code Orchestrator} is the
 * production implementation; the communication layer wraps any dispatcher
 * with retries and circuit breaking.
 */
@FunctionalInterface
public interface ToolDispatcher {
    ToolOutput dispatch(ExecutionContext ctx, String toolName, ToolInput input);
}
