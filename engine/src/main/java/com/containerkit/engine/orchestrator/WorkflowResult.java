package com.containerkit.engine.orchestrator;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Aggregate outcome of a workflow run.
 *
 * {@code stepResults} holds only the steps that actually ran, so after a
 * failure it is shorter than {@code totalSteps}.
 */
public record WorkflowResult(String workflowId,
                             String name,
                             boolean success,
                             int totalSteps,
                             int successfulSteps,
                             int failedSteps,
                             List<StepResult> stepResults,
                             Instant startTime,
                             Instant endTime,
                             Duration duration) {

    public WorkflowResult {
        stepResults = List.copyOf(stepResults);
    }
}
