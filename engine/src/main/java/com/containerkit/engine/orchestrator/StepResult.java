package com.containerkit.engine.orchestrator;

import com.containerkit.engine.tool.ToolOutput;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one executed workflow step.
 *
 * @param output null when the engine refused the call (unknown tool,
 *               validation error, timeout); {@code error} then holds the reason
 */
public record StepResult(String stepId,
                         String name,
                         String tool,
                         boolean success,
                         ToolOutput output,
                         Instant startTime,
                         Instant endTime,
                         Duration duration,
                         String error) {}
