package com.containerkit.engine.job;

/** Job counts by status at one point in time. */
public record OrchestratorStats(int total, int pending, int running, int completed, int failed, int cancelled) {}
