package com.containerkit.engine.event;

/**
 * Lifecycle events published on the {@link EventBus}.
 */
public enum EventType {
    // Communication Manager
    REQUEST_STARTED,
    REQUEST_COMPLETED,
    REQUEST_FAILED,
    CIRCUIT_BREAKER_OPEN,

    // Job Orchestrator
    JOB_SUBMITTED,
    JOB_STARTED,
    JOB_COMPLETED,
    JOB_FAILED,
    JOB_CANCELLED,

    // Orchestrator
    TOOL_REGISTERED,
    TOOL_UNREGISTERED,
    WORKFLOW_STARTED,
    WORKFLOW_COMPLETED
}
