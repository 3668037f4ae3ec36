package com.containerkit.engine.comm;

import com.containerkit.engine.error.EngineException;
import com.containerkit.engine.event.EventBus;
import com.containerkit.engine.event.EventType;
import com.containerkit.engine.resilience.CircuitBreaker;
import com.containerkit.engine.resilience.CircuitBreakerRegistry;
import com.containerkit.engine.tool.ExecutionContext;
import com.containerkit.engine.tool.ToolDispatcher;
import com.containerkit.engine.tool.ToolInput;
import com.containerkit.engine.tool.ToolOutput;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Resilient front door for tool calls.
 *
 * <p>For each {@link ToolRequest}:
 * <ol>
 *   <li>a {@link RequestCorrelation} is opened (linked to its parent, if any);</li>
 *   <li>the tool's {@link CircuitBreaker} is consulted; an open breaker fails
 *       the request with RESOURCE before anything is dispatched;</li>
 *   <li>the call is dispatched, and retried with exponential backoff while the
 *       failure message matches the {@link RetryPolicy};</li>
 *   <li>the terminal outcome is fed to the breaker, the per-tool
 *       {@link RequestMetrics} and the {@link EventBus}.</li>
 * </ol>
 *
 * Caller-side errors (unknown tool, invalid input) are not retried and do not
 * count against the breaker. Correlations, breakers and metrics are held in
 * bounded caches.
 */
public class CommunicationManager {

    private static final Logger log = LoggerFactory.getLogger(CommunicationManager.class);

    /** Waits out a backoff delay; the production implementation is {@link ExecutionContext#sleep}. */
    @FunctionalInterface
    public interface Backoff {
        void await(ExecutionContext ctx, Duration delay);
    }

    private final ToolDispatcher         dispatcher;
    private final CircuitBreakerRegistry breakers;
    private final EventBus               eventBus;
    private final RetryPolicy            retryPolicy;
    private final int                    latencyWindow;
    private final MeterRegistry          meterRegistry;
    private final Backoff                backoff;

    private final Cache<String, RequestCorrelation> correlations;
    private final Cache<String, RequestMetrics>     metrics;

    public CommunicationManager(ToolDispatcher dispatcher,
                                CircuitBreakerRegistry breakers,
                                EventBus eventBus,
                                RetryPolicy retryPolicy,
                                int latencyWindow,
                                long maxCorrelations,
                                Duration correlationTtl,
                                long maxTrackedTools,
                                MeterRegistry meterRegistry) {
        this(dispatcher, breakers, eventBus, retryPolicy, latencyWindow, maxCorrelations,
                correlationTtl, maxTrackedTools, meterRegistry, ExecutionContext::sleep);
    }

    public CommunicationManager(ToolDispatcher dispatcher,
                                CircuitBreakerRegistry breakers,
                                EventBus eventBus,
                                RetryPolicy retryPolicy,
                                int latencyWindow,
                                long maxCorrelations,
                                Duration correlationTtl,
                                long maxTrackedTools,
                                MeterRegistry meterRegistry,
                                Backoff backoff) {
        this.dispatcher    = dispatcher;
        this.breakers      = breakers;
        this.eventBus      = eventBus;
        this.retryPolicy   = retryPolicy;
        this.latencyWindow = latencyWindow;
        this.meterRegistry = meterRegistry;
        this.backoff       = backoff;
        this.correlations  = Caffeine.newBuilder()
                .maximumSize(maxCorrelations)
                .expireAfterWrite(correlationTtl)
                .build();
        this.metrics = Caffeine.newBuilder()
                .maximumSize(maxTrackedTools)
                .build();
    }

    // ------------------------------------------------------------------
    // Request path
    // ------------------------------------------------------------------

    /**
     * Dispatch a request with circuit breaking and retries.
     *
     * @return the terminal response; its output may be a tool-level failure
     * @throws EngineException RESOURCE when the breaker is open, otherwise the
     *                         last engine error once retries are exhausted or
     *                         the error is not retryable
     */
    public ToolResponse sendRequest(ExecutionContext ctx, ToolRequest request) {
        if (request == null || request.toolName() == null || request.toolName().isBlank()) {
            throw EngineException.validation("Request must name a tool");
        }
        String toolName = request.toolName();
        ToolInput input = request.input() == null ? ToolInput.of(Map.of()) : request.input();
        RequestCorrelation correlation = openCorrelation(request, input);
        String correlationId = correlation.getId();

        MDC.put("correlationId", correlationId);
        MDC.put("tool", toolName);
        try {
            CircuitBreaker breaker = breakers.forTool(toolName);
            if (!breaker.allow()) {
                correlation.finish(CorrelationStatus.CIRCUIT_BREAKER_OPEN);
                meterRegistry.counter("engine.requests.circuit_open", "tool", toolName).increment();
                publish(EventType.CIRCUIT_BREAKER_OPEN, correlation, toolName, input, Map.of(
                        "failure_count", breaker.getFailureCount()));
                log.warn("Circuit breaker open for tool '{}', request {} rejected", toolName, correlationId);
                throw EngineException.resource("Circuit breaker open for tool '" + toolName + "'");
            }

            publish(EventType.REQUEST_STARTED, correlation, toolName, input, Map.of());
            long startNanos = System.nanoTime();
            Attempt outcome = sendWithRetry(ctx, toolName, input, correlationId);
            Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);

            if (outcome.succeeded()) {
                breaker.recordSuccess();
                metricsFor(toolName).record(duration, true);
                correlation.finish(CorrelationStatus.COMPLETED);
                publish(EventType.REQUEST_COMPLETED, correlation, toolName, input, Map.of(
                        "duration_ms", duration.toMillis(),
                        "attempts", outcome.attempts()));
                log.debug("Request {} to '{}' completed in {} ms after {} attempt(s)",
                        correlationId, toolName, duration.toMillis(), outcome.attempts());
                return new ToolResponse(correlationId, outcome.output(), outcome.attempts(), duration);
            }

            if (countsAgainstBreaker(outcome.error())) {
                breaker.recordFailure();
            }
            metricsFor(toolName).record(duration, false);
            correlation.finish(CorrelationStatus.FAILED);
            publish(EventType.REQUEST_FAILED, correlation, toolName, input, Map.of(
                    "duration_ms", duration.toMillis(),
                    "attempts", outcome.attempts(),
                    "error", String.valueOf(outcome.failureMessage())));
            log.warn("Request {} to '{}' failed after {} attempt(s) in {} ms: {}",
                    correlationId, toolName, outcome.attempts(), duration.toMillis(), outcome.failureMessage());

            if (outcome.error() != null) {
                throw outcome.error();
            }
            return new ToolResponse(correlationId, outcome.output(), outcome.attempts(), duration);
        } finally {
            MDC.remove("correlationId");
            MDC.remove("tool");
        }
    }

    private Attempt sendWithRetry(ExecutionContext ctx, String toolName, ToolInput input, String correlationId) {
        int attempt = 0;
        while (true) {
            attempt++;
            ToolOutput output = null;
            EngineException error = null;
            String failure;
            try {
                output = dispatcher.dispatch(ctx, toolName, input);
                if (output.success()) {
                    return new Attempt(output, null, attempt);
                }
                failure = output.error();
            } catch (EngineException e) {
                error = e;
                failure = e.getMessage();
            } catch (RuntimeException e) {
                error = EngineException.internal("Tool '%s' failed: %s".formatted(toolName, e.getMessage()), e);
                failure = error.getMessage();
            }

            if (error != null && isInfrastructureError(error)) {
                return new Attempt(null, error, attempt);
            }
            if (attempt > retryPolicy.maxRetries() || !retryPolicy.isRetryable(failure)) {
                return new Attempt(output, error, attempt);
            }

            Duration delay = retryPolicy.delayBeforeRetry(attempt);
            meterRegistry.counter("engine.requests.retries", "tool", toolName).increment();
            log.warn("Request {} to '{}' attempt {} failed ({}), retrying in {} ms",
                    correlationId, toolName, attempt, failure, delay.toMillis());
            try {
                backoff.await(ctx, delay);
            } catch (EngineException interrupted) {
                log.warn("Retry wait for request {} aborted: {}", correlationId, interrupted.getMessage());
                return new Attempt(output, interrupted, attempt);
            }
        }
    }

    // Refusals by the engine itself; retrying cannot change the answer.
    private static boolean isInfrastructureError(EngineException e) {
        return switch (e.getKind()) {
            case NOT_FOUND, VALIDATION, RESOURCE -> true;
            case TIMEOUT, INTERNAL -> false;
        };
    }

    private static boolean countsAgainstBreaker(EngineException e) {
        return e == null || (e.getKind() != EngineException.Kind.NOT_FOUND
                && e.getKind() != EngineException.Kind.VALIDATION);
    }

    private record Attempt(ToolOutput output, EngineException error, int attempts) {
        boolean succeeded() {
            return error == null && output != null && output.success();
        }

        String failureMessage() {
            if (error != null) return error.getMessage();
            return output == null ? null : output.error();
        }
    }

    // ------------------------------------------------------------------
    // Correlations
    // ------------------------------------------------------------------

    private RequestCorrelation openCorrelation(ToolRequest request, ToolInput input) {
        String id = (request.id() == null || request.id().isBlank()) ? UUID.randomUUID().toString() : request.id();
        RequestCorrelation parent = request.parentId() == null ? null : correlations.getIfPresent(request.parentId());
        String root = parent != null ? parent.getRootRequestId() : id;

        RequestCorrelation correlation = new RequestCorrelation(id, root, request.parentId(),
                input.sessionId(), Instant.now());
        correlation.appendTool(request.toolName());
        if (parent != null) {
            parent.appendTool(request.toolName());
        }
        correlations.put(id, correlation);
        return correlation;
    }

    public Optional<RequestCorrelation.Snapshot> getCorrelation(String id) {
        return Optional.ofNullable(correlations.getIfPresent(id)).map(RequestCorrelation::snapshot);
    }

    public long correlationCount() {
        return correlations.estimatedSize();
    }

    // ------------------------------------------------------------------
    // Metrics and breaker state
    // ------------------------------------------------------------------

    private RequestMetrics metricsFor(String toolName) {
        return metrics.get(toolName, name -> new RequestMetrics(name, latencyWindow));
    }

    public Optional<RequestMetrics.Snapshot> getMetrics(String toolName) {
        return Optional.ofNullable(metrics.getIfPresent(toolName)).map(RequestMetrics::snapshot);
    }

    public Map<String, RequestMetrics.Snapshot> getAllMetrics() {
        Map<String, RequestMetrics.Snapshot> all = new LinkedHashMap<>();
        metrics.asMap().values().stream()
                .map(RequestMetrics::snapshot)
                .sorted(Comparator.comparing(RequestMetrics.Snapshot::toolName))
                .forEach(s -> all.put(s.toolName(), s));
        return all;
    }

    public List<CircuitBreaker.Snapshot> getCircuitBreakerStates() {
        return breakers.snapshots();
    }

    // ------------------------------------------------------------------
    // Events
    // ------------------------------------------------------------------

    private void publish(EventType type, RequestCorrelation correlation, String toolName,
                         ToolInput input, Map<String, Object> extra) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("correlation_id", correlation.getId());
        data.put("root_request_id", correlation.getRootRequestId());
        data.put("tool", toolName);
        if (input.sessionId() != null) {
            data.put("session_id", input.sessionId());
        }
        data.putAll(extra);
        eventBus.publish(type, data);
    }
}
