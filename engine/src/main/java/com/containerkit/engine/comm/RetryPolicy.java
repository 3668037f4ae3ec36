package com.containerkit.engine.comm;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Exponential backoff for transient tool failures.
 *
 * Only failures whose message contains one of {@code retryablePatterns}
 * (case-insensitive) are retried; anything else fails on the first attempt.
 *
 * @param maxRetries attempts allowed after the first one
 * @param baseDelay  wait before the first retry; doubles for each later retry
 */
public record RetryPolicy(int maxRetries, Duration baseDelay, List<String> retryablePatterns) {

    public static final List<String> DEFAULT_PATTERNS =
            List.of("timeout", "connection", "temporary", "unavailable");

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        retryablePatterns = retryablePatterns == null
                ? DEFAULT_PATTERNS
                : retryablePatterns.stream().map(p -> p.toLowerCase(Locale.ROOT)).toList();
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(100), DEFAULT_PATTERNS);
    }

    public boolean isRetryable(String message) {
        if (message == null || message.isBlank()) return false;
        String lower = message.toLowerCase(Locale.ROOT);
        return retryablePatterns.stream().anyMatch(lower::contains);
    }

    /** Delay before retry number {@code n} (1-based): {@code baseDelay * 2^(n-1)}. */
    public Duration delayBeforeRetry(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("retry number starts at 1");
        }
        return baseDelay.multipliedBy(1L << Math.min(n - 1, 30));
    }
}
