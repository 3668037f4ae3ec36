package com.containerkit.engine.orchestrator;

import com.containerkit.engine.error.EngineException;
import com.containerkit.engine.error.ToolNotFoundException;
import com.containerkit.engine.event.EventBus;
import com.containerkit.engine.event.EventType;
import com.containerkit.engine.tool.ExecutionContext;
import com.containerkit.engine.tool.Tool;
import com.containerkit.engine.tool.ToolInput;
import com.containerkit.engine.tool.ToolOutput;
import com.containerkit.engine.tool.ToolRegistry;
import com.containerkit.engine.tool.ToolSchema;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for Orchestrator. No Spring context; tools are lambdas.
 */
class OrchestratorTest {

    ToolRegistry        registry;
    EventBus            eventBus;
    SimpleMeterRegistry meterRegistry;
    Orchestrator        orchestrator;
    List<String>        invoked;
    ExecutionContext    ctx;

    @BeforeEach
    void setUp() {
        registry      = new ToolRegistry();
        eventBus      = mock(EventBus.class);
        meterRegistry = new SimpleMeterRegistry();
        orchestrator  = new Orchestrator(registry, eventBus, meterRegistry, Duration.ofMillis(200), 4);
        invoked       = new CopyOnWriteArrayList<>();
        ctx           = ExecutionContext.background();
    }

    @AfterEach
    void tearDown() {
        orchestrator.close();
    }

    private void register(String name, Behaviour behaviour) {
        orchestrator.register(new LambdaTool(name, ToolSchema.empty(), (c, in) -> {
            invoked.add(name);
            return behaviour.run(c, in);
        }));
    }

    // ------------------------------------------------------------------
    // execute
    // ------------------------------------------------------------------

    @Test
    void execute_success_returnsOutputAndCountsMetric() {
        register("analyze_repository", (c, in) -> ToolOutput.success(Map.of("language", "java")));

        ToolOutput output = orchestrator.execute(ctx, "analyze_repository",
                ToolInput.of(Map.of("repo_path", "/src")));

        assertThat(output.success()).isTrue();
        assertThat(output.data()).containsEntry("language", "java");
        assertThat(meterRegistry.counter("engine.tool.calls",
                "tool", "analyze_repository", "status", "success").count()).isEqualTo(1.0);
        assertThat(orchestrator.health()).containsEntry("total_requests", 1L)
                .containsEntry("total_errors", 0L);
    }

    @Test
    void execute_unknownTool_throwsNotFound() {
        assertThatThrownBy(() -> orchestrator.execute(ctx, "no_such_tool", ToolInput.of(Map.of())))
                .isInstanceOf(ToolNotFoundException.class)
                .hasMessageContaining("no_such_tool");
        assertThat(meterRegistry.counter("engine.tool.calls",
                "tool", "no_such_tool", "status", "not_found").count()).isEqualTo(1.0);
    }

    @Test
    void execute_invalidInput_throwsValidationWithoutRunningTool() {
        orchestrator.register(new LambdaTool("build_image",
                new ToolSchema(Map.of("image_name", ToolSchema.ParamType.STRING), Set.of("image_name"), ""),
                (c, in) -> {
                    invoked.add("build_image");
                    return ToolOutput.success(Map.of());
                }));

        assertThatThrownBy(() -> orchestrator.execute(ctx, "build_image", ToolInput.of(Map.of())))
                .isInstanceOfSatisfying(EngineException.class,
                        e -> assertThat(e.getKind()).isEqualTo(EngineException.Kind.VALIDATION))
                .hasMessageContaining("image_name");
        assertThat(invoked).isEmpty();
    }

    @Test
    void execute_toolFailureOutput_returnedNotThrown() {
        register("scan_image", (c, in) -> ToolOutput.failure("3 critical vulnerabilities"));

        ToolOutput output = orchestrator.execute(ctx, "scan_image", ToolInput.of(Map.of()));

        assertThat(output.success()).isFalse();
        assertThat(output.error()).isEqualTo("3 critical vulnerabilities");
        assertThat(meterRegistry.counter("engine.tool.calls",
                "tool", "scan_image", "status", "failure").count()).isEqualTo(1.0);
    }

    @Test
    void execute_toolThrows_wrappedAsInternal() {
        register("push_image", (c, in) -> {
            throw new IllegalStateException("registry refused credentials");
        });

        assertThatThrownBy(() -> orchestrator.execute(ctx, "push_image", ToolInput.of(Map.of())))
                .isInstanceOfSatisfying(EngineException.class,
                        e -> assertThat(e.getKind()).isEqualTo(EngineException.Kind.INTERNAL))
                .hasMessageContaining("registry refused credentials");
    }

    @Test
    void execute_slowTool_defaultTimeoutApplies() {
        AtomicReference<ExecutionContext> seen = new AtomicReference<>();
        register("deploy_kubernetes", (c, in) -> {
            seen.set(c);
            c.sleep(Duration.ofSeconds(30));
            return ToolOutput.success(Map.of());
        });

        assertThatThrownBy(() -> orchestrator.execute(ctx, "deploy_kubernetes", ToolInput.of(Map.of())))
                .isInstanceOfSatisfying(EngineException.class,
                        e -> assertThat(e.getKind()).isEqualTo(EngineException.Kind.TIMEOUT))
                .hasMessageContaining("timeout");
        assertThat(seen.get().isDone()).isTrue();
    }

    @Test
    void execute_callerDeadline_takesPrecedence() {
        register("generate_manifests", (c, in) -> {
            c.sleep(Duration.ofSeconds(30));
            return ToolOutput.success(Map.of());
        });
        Orchestrator patient = new Orchestrator(registry, eventBus, meterRegistry, Duration.ofMinutes(10), 1);
        try {
            ExecutionContext shortCtx = ctx.withTimeout(Duration.ofMillis(100));
            long start = System.nanoTime();

            assertThatThrownBy(() -> patient.execute(shortCtx, "generate_manifests", ToolInput.of(Map.of())))
                    .isInstanceOf(EngineException.class);
            assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
        } finally {
            patient.close();
        }
    }

    @Test
    void execute_cancelledCaller_rejectedBeforeDispatch() {
        register("analyze_repository", (c, in) -> ToolOutput.success(Map.of()));
        ctx.cancel();

        assertThatThrownBy(() -> orchestrator.execute(ctx, "analyze_repository", ToolInput.of(Map.of())))
                .isInstanceOfSatisfying(EngineException.class,
                        e -> assertThat(e.getKind()).isEqualTo(EngineException.Kind.TIMEOUT));
        assertThat(invoked).isEmpty();
    }

    @Test
    void execute_afterClose_throwsResource() {
        register("analyze_repository", (c, in) -> ToolOutput.success(Map.of()));
        orchestrator.close();
        orchestrator.close();

        assertThatThrownBy(() -> orchestrator.execute(ctx, "analyze_repository", ToolInput.of(Map.of())))
                .isInstanceOfSatisfying(EngineException.class,
                        e -> assertThat(e.getKind()).isEqualTo(EngineException.Kind.RESOURCE));
        assertThat(orchestrator.health()).containsEntry("status", "closed");
    }

    @Test
    void register_publishesToolRegisteredEvent() {
        register("analyze_repository", (c, in) -> ToolOutput.success(Map.of()));

        verify(eventBus).publish(eq(EventType.TOOL_REGISTERED), anyMap());
        assertThat(orchestrator.list()).containsExactly("analyze_repository");
    }

    @Test
    void unregister_removesToolAndPublishesEvent() {
        register("analyze_repository", (c, in) -> ToolOutput.success(Map.of()));

        orchestrator.unregister("analyze_repository");

        verify(eventBus).publish(eq(EventType.TOOL_UNREGISTERED), anyMap());
        assertThat(orchestrator.list()).isEmpty();
        assertThatThrownBy(() -> orchestrator.execute(ctx, "analyze_repository", ToolInput.of(Map.of())))
                .isInstanceOf(ToolNotFoundException.class);
    }

    // ------------------------------------------------------------------
    // executeWorkflow
    // ------------------------------------------------------------------

    @Test
    void workflow_allStepsSucceed_passesVariablesAndContext() {
        AtomicReference<ToolInput> received = new AtomicReference<>();
        register("analyze_repository", (c, in) -> ToolOutput.success(Map.of()));
        register("build_image", (c, in) -> {
            received.set(in);
            return ToolOutput.success(Map.of("image_id", "img-1"));
        });
        Workflow workflow = new Workflow("wf-1", "containerize", List.of(
                new Workflow.Step("analyze", "analyze_repository", Map.of()),
                new Workflow.Step("build", "build_image", Map.of("tag", "v2"))),
                Map.of("session_id", "sess-9", "tag", "latest", "image_name", "app"));

        WorkflowResult result = orchestrator.executeWorkflow(ctx, workflow);

        assertThat(result.success()).isTrue();
        assertThat(result.totalSteps()).isEqualTo(2);
        assertThat(result.successfulSteps()).isEqualTo(2);
        assertThat(result.stepResults()).extracting(StepResult::stepId)
                .containsExactly("wf-1-step-1", "wf-1-step-2");
        assertThat(received.get().sessionId()).isEqualTo("sess-9");
        assertThat(received.get().data()).containsEntry("tag", "v2").containsEntry("image_name", "app");
        assertThat(received.get().context()).containsEntry("workflow_id", "wf-1")
                .containsEntry("step_id", "wf-1-step-2");
        verify(eventBus).publish(eq(EventType.WORKFLOW_STARTED), anyMap());
        verify(eventBus).publish(eq(EventType.WORKFLOW_COMPLETED), anyMap());
    }

    @Test
    void workflow_stopsAtFirstFailure() {
        register("tool_a", (c, in) -> ToolOutput.success(Map.of()));
        register("tool_b", (c, in) -> ToolOutput.failure("build failed"));
        register("tool_c", (c, in) -> ToolOutput.success(Map.of()));
        Workflow workflow = new Workflow("wf-2", "abc", List.of(
                new Workflow.Step("A", "tool_a", Map.of()),
                new Workflow.Step("B", "tool_b", Map.of()),
                new Workflow.Step("C", "tool_c", Map.of())), Map.of());

        WorkflowResult result = orchestrator.executeWorkflow(ctx, workflow);

        assertThat(result.success()).isFalse();
        assertThat(result.totalSteps()).isEqualTo(3);
        assertThat(result.stepResults()).hasSize(2);
        assertThat(result.successfulSteps()).isEqualTo(1);
        assertThat(result.failedSteps()).isEqualTo(1);
        assertThat(result.stepResults().get(1).error()).isEqualTo("build failed");
        assertThat(invoked).containsExactly("tool_a", "tool_b");
    }

    @Test
    void workflow_stepThrowing_recordedAsFailedStep() {
        register("tool_a", (c, in) -> ToolOutput.success(Map.of()));
        Workflow workflow = new Workflow("wf-3", "missing", List.of(
                new Workflow.Step("A", "tool_a", Map.of()),
                new Workflow.Step("B", "not_registered", Map.of())), Map.of());

        WorkflowResult result = orchestrator.executeWorkflow(ctx, workflow);

        assertThat(result.success()).isFalse();
        assertThat(result.stepResults().get(1).output()).isNull();
        assertThat(result.stepResults().get(1).error()).contains("not_registered");
    }

    @Test
    void workflow_withoutSteps_throwsValidation() {
        Workflow empty = new Workflow("wf-4", "empty", List.of(), Map.of());

        assertThatThrownBy(() -> orchestrator.executeWorkflow(ctx, empty))
                .isInstanceOfSatisfying(EngineException.class,
                        e -> assertThat(e.getKind()).isEqualTo(EngineException.Kind.VALIDATION));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    @FunctionalInterface
    interface Behaviour {
        ToolOutput run(ExecutionContext ctx, ToolInput input) throws Exception;
    }

    record LambdaTool(String name, ToolSchema schema, Behaviour behaviour) implements Tool {
        @Override
        public String description() {
            return "test tool " + name;
        }

        @Override
        public ToolOutput execute(ExecutionContext ctx, ToolInput input) throws Exception {
            return behaviour.run(ctx, input);
        }
    }
}
