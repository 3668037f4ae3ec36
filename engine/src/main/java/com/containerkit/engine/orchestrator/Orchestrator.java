package com.containerkit.engine.orchestrator;

import com.containerkit.engine.error.EngineException;
import com.containerkit.engine.error.ToolNotFoundException;
import com.containerkit.engine.event.EventBus;
import com.containerkit.engine.event.EventType;
import com.containerkit.engine.tool.ExecutionContext;
import com.containerkit.engine.tool.Tool;
import com.containerkit.engine.tool.ToolDispatcher;
import com.containerkit.engine.tool.ToolInput;
import com.containerkit.engine.tool.ToolOutput;
import com.containerkit.engine.tool.ToolRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Synchronous tool dispatch and workflow sequencing.
 *
 * <p>Every call to {@link #execute}:
 * <ol>
 *   <li>rejects if the orchestrator is closed (RESOURCE);</li>
 *   <li>resolves the tool (NOT_FOUND) and validates its input (VALIDATION);</li>
 *   <li>runs the tool on the dispatch pool under the caller's deadline, or the
 *       default timeout when the caller has none;</li>
 *   <li>records timing and outcome in Micrometer:
 *       <pre>
 *   engine.tool.calls{tool, status="success|failure|error|timeout|not_found|validation"}
 *   engine.tool.duration{tool, status}
 *       </pre></li>
 * </ol>
 *
 * A timed-out tool keeps running on its dispatch thread until it notices its
 * context is done; the caller is released immediately.
 */
public class Orchestrator implements ToolDispatcher, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final ToolRegistry    registry;
    private final EventBus        eventBus;
    private final MeterRegistry   meterRegistry;
    private final Duration        defaultTimeout;
    private final ExecutorService dispatchPool;
    private final Instant         startedAt = Instant.now();

    private final AtomicBoolean closed        = new AtomicBoolean(false);
    private final AtomicLong    totalRequests = new AtomicLong();
    private final AtomicLong    totalErrors   = new AtomicLong();

    public Orchestrator(ToolRegistry registry,
                        EventBus eventBus,
                        MeterRegistry meterRegistry,
                        Duration defaultTimeout,
                        int dispatchThreads) {
        this.registry       = registry;
        this.eventBus       = eventBus;
        this.meterRegistry  = meterRegistry;
        this.defaultTimeout = defaultTimeout;
        this.dispatchPool   = Executors.newFixedThreadPool(dispatchThreads,
                new CustomizableThreadFactory("tool-dispatch-"));
    }

    // ------------------------------------------------------------------
    // Registration
    // ------------------------------------------------------------------

    public void register(Tool tool) {
        registry.register(tool);
        eventBus.publish(EventType.TOOL_REGISTERED, Map.of("tool", tool.name()));
    }

    public void unregister(String name) {
        registry.unregister(name);
        eventBus.publish(EventType.TOOL_UNREGISTERED, Map.of("tool", name));
    }

    public List<String> list() {
        return registry.list();
    }

    // ------------------------------------------------------------------
    // Single dispatch
    // ------------------------------------------------------------------

    @Override
    public ToolOutput dispatch(ExecutionContext ctx, String toolName, ToolInput input) {
        return execute(ctx, toolName, input);
    }

    /**
     * Run one tool and return its output unchanged.
     *
     * @throws EngineException NOT_FOUND, VALIDATION, RESOURCE (closed),
     *                         TIMEOUT, or INTERNAL wrapping whatever the tool threw
     */
    public ToolOutput execute(ExecutionContext ctx, String toolName, ToolInput input) {
        if (closed.get()) {
            throw EngineException.resource("Orchestrator is closed");
        }
        ToolInput args = input == null ? ToolInput.of(Map.of()) : input;

        Tool tool = registry.get(toolName).orElse(null);
        if (tool == null) {
            count(toolName, "not_found");
            throw new ToolNotFoundException(toolName);
        }
        List<String> violations = tool.schema().validate(args.data());
        if (!violations.isEmpty()) {
            count(toolName, "validation");
            throw EngineException.validation("Invalid input for tool '%s': %s"
                    .formatted(toolName, String.join("; ", violations)));
        }
        ctx.throwIfDone();

        ExecutionContext callCtx = ctx.hasDeadline() ? ctx.child() : ctx.withTimeout(defaultTimeout);
        totalRequests.incrementAndGet();

        MDC.put("tool", toolName);
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        long startNanos = System.nanoTime();
        try {
            log.debug("Executing tool '{}' (session={})", toolName, args.sessionId());
            Future<ToolOutput> future;
            try {
                future = dispatchPool.submit(() -> tool.execute(callCtx, args));
            } catch (RejectedExecutionException e) {
                status = "error";
                throw EngineException.resource("Orchestrator is closed");
            }
            ToolOutput output = awaitOutput(toolName, future, callCtx);
            if (!output.success()) {
                status = "failure";
                log.warn("Tool '{}' reported failure after {} ms: {}",
                        toolName, elapsedMs(startNanos), output.error());
            } else {
                log.debug("Tool '{}' succeeded in {} ms", toolName, elapsedMs(startNanos));
            }
            return output;
        } catch (EngineException e) {
            if ("success".equals(status)) {
                status = e.getKind() == EngineException.Kind.TIMEOUT ? "timeout" : "error";
            }
            log.warn("Tool '{}' failed after {} ms: {}", toolName, elapsedMs(startNanos), e.getMessage());
            throw e;
        } finally {
            if (!"success".equals(status)) {
                totalErrors.incrementAndGet();
            }
            sample.stop(meterRegistry.timer("engine.tool.duration", "tool", toolName, "status", status));
            count(toolName, status);
            MDC.remove("tool");
        }
    }

    private ToolOutput awaitOutput(String toolName, Future<ToolOutput> future, ExecutionContext callCtx) {
        long waitMs = callCtx.remaining().map(Duration::toMillis).orElse(defaultTimeout.toMillis());
        try {
            ToolOutput output = future.get(waitMs, TimeUnit.MILLISECONDS);
            if (output == null) {
                throw EngineException.internal("Tool '" + toolName + "' returned no output", null);
            }
            return output;
        } catch (TimeoutException e) {
            future.cancel(true);
            callCtx.cancel();
            throw EngineException.timeout("Tool '%s' execution timeout after %d ms".formatted(toolName, waitMs));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            callCtx.cancel();
            throw EngineException.timeout("Interrupted while waiting for tool '" + toolName + "'");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof EngineException engineException) {
                throw engineException;
            }
            throw EngineException.internal("Tool '%s' failed: %s".formatted(toolName, cause.getMessage()), cause);
        } finally {
            callCtx.cancel();
        }
    }

    // ------------------------------------------------------------------
    // Workflows
    // ------------------------------------------------------------------

    /**
     * Run the workflow's steps in order, stopping at the first step that
     * throws or returns an unsuccessful output. Nothing is rolled back.
     *
     * @throws EngineException RESOURCE if closed, VALIDATION if the workflow has no steps
     */
    public WorkflowResult executeWorkflow(ExecutionContext ctx, Workflow workflow) {
        if (closed.get()) {
            throw EngineException.resource("Orchestrator is closed");
        }
        if (workflow == null || workflow.steps().isEmpty()) {
            throw EngineException.validation("Workflow must contain at least one step");
        }
        Instant start = Instant.now();
        log.info("Starting workflow '{}' ({} steps)", workflow.name(), workflow.steps().size());
        eventBus.publish(EventType.WORKFLOW_STARTED, withSession(workflow, Map.of(
                "workflow_id", String.valueOf(workflow.id()),
                "workflow_name", String.valueOf(workflow.name()),
                "steps", workflow.steps().size())));

        List<StepResult> results = new ArrayList<>();
        boolean success = true;
        for (int i = 0; i < workflow.steps().size(); i++) {
            Workflow.Step step = workflow.steps().get(i);
            StepResult result = runStep(ctx, workflow, step, workflow.id() + "-step-" + (i + 1));
            results.add(result);
            if (!result.success()) {
                success = false;
                log.warn("Workflow '{}' stopped at step '{}': {}", workflow.name(), step.name(), result.error());
                break;
            }
        }

        Instant end = Instant.now();
        int succeeded = (int) results.stream().filter(StepResult::success).count();
        WorkflowResult result = new WorkflowResult(workflow.id(), workflow.name(), success,
                workflow.steps().size(), succeeded, results.size() - succeeded,
                results, start, end, Duration.between(start, end));

        eventBus.publish(EventType.WORKFLOW_COMPLETED, withSession(workflow, Map.of(
                "workflow_id", String.valueOf(workflow.id()),
                "success", success,
                "duration_ms", result.duration().toMillis())));
        log.info("Workflow '{}' finished: success={} ({}/{} steps)",
                workflow.name(), success, succeeded, workflow.steps().size());
        return result;
    }

    private StepResult runStep(ExecutionContext ctx, Workflow workflow, Workflow.Step step, String stepId) {
        Map<String, Object> data = new LinkedHashMap<>(workflow.variables());
        data.putAll(step.input());
        Map<String, Object> context = new LinkedHashMap<>(workflow.variables());
        context.put("workflow_id", workflow.id());
        context.put("step_id", stepId);
        Object session = workflow.variables().get("session_id");
        ToolInput input = new ToolInput(session == null ? null : session.toString(), data, context);

        Instant stepStart = Instant.now();
        ToolOutput output = null;
        String error;
        boolean ok;
        try {
            output = execute(ctx, step.tool(), input);
            ok = output.success();
            error = output.error();
        } catch (EngineException e) {
            ok = false;
            error = e.getMessage();
        }
        Instant stepEnd = Instant.now();
        return new StepResult(stepId, step.name(), step.tool(), ok, output,
                stepStart, stepEnd, Duration.between(stepStart, stepEnd), error);
    }

    private static Map<String, Object> withSession(Workflow workflow, Map<String, Object> data) {
        Object session = workflow.variables().get("session_id");
        if (session == null) return data;
        Map<String, Object> copy = new LinkedHashMap<>(data);
        copy.put("session_id", session);
        return copy;
    }

    // ------------------------------------------------------------------
    // Health and lifecycle
    // ------------------------------------------------------------------

    public Map<String, Object> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", closed.get() ? "closed" : "healthy");
        health.put("registered_tools", registry.size());
        health.put("total_requests", totalRequests.get());
        health.put("total_errors", totalErrors.get());
        health.put("default_timeout_ms", defaultTimeout.toMillis());
        health.put("uptime_seconds", Duration.between(startedAt, Instant.now()).toSeconds());
        return health;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Refuse further calls. In-flight tool calls are left to finish on their
     * own. Safe to call more than once.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            dispatchPool.shutdown();
            log.info("Orchestrator closed after {} requests ({} errors)", totalRequests.get(), totalErrors.get());
        }
    }

    private void count(String toolName, String status) {
        meterRegistry.counter("engine.tool.calls", "tool", toolName, "status", status).increment();
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
