package com.containerkit.engine.resilience;

/**
 * Legal transitions:
 *   CLOSED    → OPEN       (failureCount reaches maxFailures)
 *   OPEN      → HALF_OPEN  (first allow() after resetTimeout)
 *   HALF_OPEN → CLOSED     (probe succeeded)
 *   HALF_OPEN → OPEN       (probe failed)
 *
 * OPEN never goes straight to CLOSED.
 */
public enum CircuitBreakerState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
