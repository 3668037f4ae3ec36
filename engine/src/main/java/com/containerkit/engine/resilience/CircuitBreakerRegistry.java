package com.containerkit.engine.resilience;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;

/**
 * Lazily creates one {@link CircuitBreaker} per tool name.
 *
 * Breakers are kept in a size-bounded cache; when more than
 * {@code maxBreakers} distinct names have been seen, the least recently used
 * breaker is discarded and a later call for that name starts CLOSED.
 */
public class CircuitBreakerRegistry {

    private final int      maxFailures;
    private final Duration resetTimeout;
    private final Clock    clock;
    private final Cache<String, CircuitBreaker> breakers;

    public CircuitBreakerRegistry(int maxFailures, Duration resetTimeout, long maxBreakers) {
        this(maxFailures, resetTimeout, maxBreakers, Clock.systemUTC());
    }

    public CircuitBreakerRegistry(int maxFailures, Duration resetTimeout, long maxBreakers, Clock clock) {
        this.maxFailures  = maxFailures;
        this.resetTimeout = resetTimeout;
        this.clock        = clock;
        this.breakers     = Caffeine.newBuilder()
                .maximumSize(maxBreakers)
                .build();
    }

    public CircuitBreaker forTool(String toolName) {
        return breakers.get(toolName, name -> new CircuitBreaker(name, maxFailures, resetTimeout, clock));
    }

    public List<CircuitBreaker.Snapshot> snapshots() {
        return breakers.asMap().values().stream()
                .map(CircuitBreaker::snapshot)
                .sorted(Comparator.comparing(CircuitBreaker.Snapshot::name))
                .toList();
    }
}
