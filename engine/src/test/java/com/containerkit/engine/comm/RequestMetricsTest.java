package com.containerkit.engine.comm;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RequestMetricsTest {

    @Test
    void empty_reportsZeroes() {
        RequestMetrics metrics = new RequestMetrics("scan_image", 10);

        assertThat(metrics.p95Millis()).isZero();
        assertThat(metrics.errorRate()).isZero();
        assertThat(metrics.snapshot().lastUpdated()).isNull();
    }

    @Test
    void p95_usesNearestRank() {
        RequestMetrics metrics = new RequestMetrics("scan_image", 100);
        for (int ms = 1; ms <= 20; ms++) {
            metrics.record(Duration.ofMillis(ms), true);
        }

        // ceil(0.95 * 20) = 19th smallest
        assertThat(metrics.p95Millis()).isEqualTo(19);
    }

    @Test
    void window_keepsOnlyMostRecentSamples() {
        RequestMetrics metrics = new RequestMetrics("scan_image", 3);
        metrics.record(Duration.ofMillis(1000), true);
        metrics.record(Duration.ofMillis(10), true);
        metrics.record(Duration.ofMillis(20), true);
        metrics.record(Duration.ofMillis(30), true);

        RequestMetrics.Snapshot snapshot = metrics.snapshot();
        assertThat(snapshot.windowSamples()).isEqualTo(3);
        assertThat(snapshot.p95LatencyMs()).isEqualTo(30);
        assertThat(snapshot.averageLatencyMs()).isCloseTo(20.0, within(0.001));
        assertThat(snapshot.totalRequests()).isEqualTo(4);
    }

    @Test
    void errorRate_isFailuresOverTotal() {
        RequestMetrics metrics = new RequestMetrics("deploy_kubernetes", 10);
        metrics.record(Duration.ofMillis(5), true);
        metrics.record(Duration.ofMillis(5), false);
        metrics.record(Duration.ofMillis(5), true);
        metrics.record(Duration.ofMillis(5), false);

        assertThat(metrics.errorRate()).isEqualTo(0.5);
        assertThat(metrics.snapshot().failureCount()).isEqualTo(2);
    }
}
