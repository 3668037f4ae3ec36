package com.containerkit.engine.comm;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    final RetryPolicy policy = RetryPolicy.defaults();

    @Test
    void isRetryable_matchesPatternsCaseInsensitively() {
        assertThat(policy.isRetryable("Connection refused")).isTrue();
        assertThat(policy.isRetryable("registry TEMPORARY failure")).isTrue();
        assertThat(policy.isRetryable("Tool 'x' execution timeout after 10 ms")).isTrue();
        assertThat(policy.isRetryable("service unavailable")).isTrue();
    }

    @Test
    void isRetryable_otherMessages_false() {
        assertThat(policy.isRetryable("Dockerfile syntax error")).isFalse();
        assertThat(policy.isRetryable("")).isFalse();
        assertThat(policy.isRetryable(null)).isFalse();
    }

    @Test
    void customPatterns_replaceDefaults() {
        RetryPolicy custom = new RetryPolicy(1, Duration.ofMillis(10), List.of("Throttled"));

        assertThat(custom.isRetryable("request throttled")).isTrue();
        assertThat(custom.isRetryable("connection reset")).isFalse();
    }

    @Test
    void delayBeforeRetry_doublesEachTime() {
        assertThat(policy.delayBeforeRetry(1)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.delayBeforeRetry(2)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.delayBeforeRetry(3)).isEqualTo(Duration.ofMillis(400));
    }

    @Test
    void delayBeforeRetry_zero_throws() {
        assertThatThrownBy(() -> policy.delayBeforeRetry(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
