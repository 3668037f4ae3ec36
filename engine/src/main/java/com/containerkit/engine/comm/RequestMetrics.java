package com.containerkit.engine.comm;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * Per-tool request counters plus a rolling latency window.
 *
 * All updates and reads are synchronized on the instance, one instance per
 * tool, so a snapshot is always internally consistent.
 */
public class RequestMetrics {

    private final String      toolName;
    private final int         windowSize;
    private final Deque<Long> latenciesMs = new ArrayDeque<>();

    private long    totalRequests;
    private long    successCount;
    private long    failureCount;
    private Instant lastUpdated;

    public RequestMetrics(String toolName, int windowSize) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be positive");
        }
        this.toolName   = toolName;
        this.windowSize = windowSize;
    }

    public synchronized void record(Duration latency, boolean success) {
        totalRequests++;
        if (success) successCount++;
        else failureCount++;
        latenciesMs.addLast(latency.toMillis());
        while (latenciesMs.size() > windowSize) {
            latenciesMs.removeFirst();
        }
        lastUpdated = Instant.now();
    }

    /** Nearest-rank 95th percentile of the window, in milliseconds; 0 when empty. */
    public synchronized long p95Millis() {
        if (latenciesMs.isEmpty()) return 0;
        long[] sorted = latenciesMs.stream().mapToLong(Long::longValue).toArray();
        Arrays.sort(sorted);
        int rank = (int) Math.ceil(0.95 * sorted.length);
        return sorted[Math.max(rank - 1, 0)];
    }

    public synchronized double errorRate() {
        return totalRequests == 0 ? 0.0 : (double) failureCount / totalRequests;
    }

    public synchronized Snapshot snapshot() {
        double avg = latenciesMs.stream().mapToLong(Long::longValue).average().orElse(0.0);
        return new Snapshot(toolName, totalRequests, successCount, failureCount,
                errorRate(), p95Millis(), avg, latenciesMs.size(), lastUpdated);
    }

    public record Snapshot(String toolName,
                           long totalRequests,
                           long successCount,
                           long failureCount,
                           double errorRate,
                           long p95LatencyMs,
                           double averageLatencyMs,
                           int windowSamples,
                           Instant lastUpdated) {}
}
