package com.containerkit.engine.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Failure-isolation state machine for a single tool.
 *
 * All methods are synchronized on the breaker; there is one instance per
 * tool name, so contention is limited to concurrent calls of the same tool.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String   name;
    private final int      maxFailures;
    private final Duration resetTimeout;
    private final Clock    clock;

    private int                 failureCount;
    private Instant             lastFailureTime;
    private CircuitBreakerState state = CircuitBreakerState.CLOSED;

    public CircuitBreaker(String name, int maxFailures, Duration resetTimeout) {
        this(name, maxFailures, resetTimeout, Clock.systemUTC());
    }

    public CircuitBreaker(String name, int maxFailures, Duration resetTimeout, Clock clock) {
        if (maxFailures < 1) {
            throw new IllegalArgumentException("maxFailures must be at least 1");
        }
        this.name         = name;
        this.maxFailures  = maxFailures;
        this.resetTimeout = resetTimeout;
        this.clock        = clock;
    }

    /**
     * Whether a call may go through now.
     *
     * In OPEN state, the first call after {@code resetTimeout} has elapsed
     * since the last failure moves the breaker to HALF_OPEN and is let
     * through as the probe.
     */
    public synchronized boolean allow() {
        switch (state) {
            case CLOSED, HALF_OPEN -> {
                return true;
            }
            case OPEN -> {
                if (lastFailureTime != null
                        && !clock.instant().isBefore(lastFailureTime.plus(resetTimeout))) {
                    transitionTo(CircuitBreakerState.HALF_OPEN);
                    return true;
                }
                return false;
            }
            default -> throw new IllegalStateException("Unknown state " + state);
        }
    }

    public synchronized void recordSuccess() {
        if (state == CircuitBreakerState.HALF_OPEN) {
            transitionTo(CircuitBreakerState.CLOSED);
        }
        failureCount = 0;
    }

    public synchronized void recordFailure() {
        failureCount++;
        lastFailureTime = clock.instant();
        if (state == CircuitBreakerState.HALF_OPEN) {
            transitionTo(CircuitBreakerState.OPEN);
        } else if (state == CircuitBreakerState.CLOSED && failureCount >= maxFailures) {
            transitionTo(CircuitBreakerState.OPEN);
        }
    }

    private void transitionTo(CircuitBreakerState next) {
        log.info("Circuit breaker '{}' {} -> {} (failures={})", name, state, next, failureCount);
        state = next;
    }

    public String getName() { return name; }

    public int getMaxFailures() { return maxFailures; }

    public Duration getResetTimeout() { return resetTimeout; }

    public synchronized CircuitBreakerState getState() { return state; }

    public synchronized int getFailureCount() { return failureCount; }

    public synchronized Snapshot snapshot() {
        return new Snapshot(name, state, failureCount, lastFailureTime);
    }

    /** Point-in-time copy for reporting. */
    public record Snapshot(String name, CircuitBreakerState state, int failureCount, Instant lastFailureTime) {}
}
