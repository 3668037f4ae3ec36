package com.containerkit.engine.job;

/**
 * Lifecycle of a {@link Job}.
 *
 * Transitions:
 *   PENDING → RUNNING   (picked up by a worker)
 *   RUNNING → COMPLETED (handler returned)
 *   RUNNING → FAILED    (handler threw, or timed out)
 *   PENDING → FAILED    (queue full at submission, never started)
 *   PENDING | RUNNING → CANCELLED
 *
 * COMPLETED, FAILED and CANCELLED are terminal.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == FAILED || next == CANCELLED;
            case RUNNING -> next == COMPLETED || next == FAILED || next == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
