package com.containerkit.engine.config;

import com.containerkit.engine.comm.CommunicationManager;
import com.containerkit.engine.comm.ToolRequest;
import com.containerkit.engine.event.EventBus;
import com.containerkit.engine.job.JobHandler;
import com.containerkit.engine.job.JobOrchestrator;
import com.containerkit.engine.job.JobType;
import com.containerkit.engine.job.ToolJobHandler;
import com.containerkit.engine.orchestrator.Orchestrator;
import com.containerkit.engine.resilience.CircuitBreakerRegistry;
import com.containerkit.engine.tool.Tool;
import com.containerkit.engine.tool.ToolRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Wires the engine components from {@link EngineProperties}.
 *
 * Components are plain classes; this is the only place that knows about
 * Spring. Every {@link Tool} bean is registered at startup, and every
 * {@link JobHandler} bean joins the job orchestrator alongside the
 * tool-backed handlers configured under {@code engine.jobs.tools}.
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean(destroyMethod = "close")
    public EventBus eventBus(EngineProperties props, MeterRegistry meterRegistry) {
        EngineProperties.Events cfg = props.getEvents();
        return new EventBus(cfg.getWorkers(), cfg.getBufferSize(), cfg.getMaxHistory(),
                cfg.getHandlerTimeout(), cfg.getSource(), meterRegistry);
    }

    @Bean
    public ToolRegistry toolRegistry(ObjectProvider<Tool> tools) {
        return new ToolRegistry(tools.orderedStream().toList());
    }

    @Bean(destroyMethod = "close")
    public Orchestrator orchestrator(ToolRegistry registry, EventBus eventBus,
                                     EngineProperties props, MeterRegistry meterRegistry) {
        EngineProperties.Orchestrator cfg = props.getOrchestrator();
        return new Orchestrator(registry, eventBus, meterRegistry,
                cfg.getDefaultTimeout(), cfg.getExecutorThreads());
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(EngineProperties props) {
        EngineProperties.CircuitBreaker cfg = props.getCircuitBreaker();
        return new CircuitBreakerRegistry(cfg.getMaxFailures(), cfg.getResetTimeout(), cfg.getMaxBreakers());
    }

    @Bean
    public CommunicationManager communicationManager(Orchestrator orchestrator,
                                                     CircuitBreakerRegistry breakers,
                                                     EventBus eventBus,
                                                     EngineProperties props,
                                                     MeterRegistry meterRegistry) {
        EngineProperties.Communication cfg = props.getCommunication();
        return new CommunicationManager(orchestrator, breakers, eventBus, cfg.toRetryPolicy(),
                cfg.getLatencyWindow(), cfg.getMaxCorrelations(), cfg.getCorrelationTtl(),
                cfg.getMaxTrackedTools(), meterRegistry);
    }

    @Bean(destroyMethod = "stop")
    public JobOrchestrator jobOrchestrator(ObjectProvider<JobHandler> customHandlers,
                                           CommunicationManager communicationManager,
                                           EventBus eventBus,
                                           EngineProperties props,
                                           MeterRegistry meterRegistry) {
        EngineProperties.Jobs cfg = props.getJobs();
        List<JobHandler> handlers = new ArrayList<>(customHandlers.orderedStream().toList());
        for (Map.Entry<String, String> entry : cfg.getTools().entrySet()) {
            JobType type = JobType.fromValue(entry.getKey());
            if (handlers.stream().anyMatch(h -> h.type() == type)) {
                log.info("Job type '{}' has a custom handler; ignoring tool mapping '{}'",
                        type.value(), entry.getValue());
                continue;
            }
            // Job tool calls go through the communication layer for retries and breaking.
            handlers.add(new ToolJobHandler(type, entry.getValue(),
                    (ctx, tool, input) -> communicationManager
                            .sendRequest(ctx, ToolRequest.of(tool, input))
                            .output()));
        }
        return new JobOrchestrator(handlers, cfg.getWorkers(), cfg.getQueueCapacity(),
                cfg.getJobTimeout(), cfg.getMaxRetainedTerminal(), eventBus, meterRegistry);
    }
}
