package com.containerkit.engine.comm;

public enum CorrelationStatus {
    PENDING,
    CIRCUIT_BREAKER_OPEN,
    COMPLETED,
    FAILED
}
