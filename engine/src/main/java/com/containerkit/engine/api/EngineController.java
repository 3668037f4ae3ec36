package com.containerkit.engine.api;

import com.containerkit.engine.comm.CommunicationManager;
import com.containerkit.engine.comm.RequestMetrics;
import com.containerkit.engine.event.Event;
import com.containerkit.engine.event.EventBus;
import com.containerkit.engine.event.EventType;
import com.containerkit.engine.event.SubscriptionStats;
import com.containerkit.engine.orchestrator.Orchestrator;
import com.containerkit.engine.resilience.CircuitBreaker;
import com.containerkit.engine.tool.ToolDescriptor;
import com.containerkit.engine.tool.ToolRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Read-only monitoring endpoints over the running engine.
 */
@RestController
@RequestMapping("/engine")
public class EngineController {

    private final Orchestrator         orchestrator;
    private final ToolRegistry         toolRegistry;
    private final EventBus             eventBus;
    private final CommunicationManager communicationManager;

    public EngineController(Orchestrator orchestrator,
                            ToolRegistry toolRegistry,
                            EventBus eventBus,
                            CommunicationManager communicationManager) {
        this.orchestrator         = orchestrator;
        this.toolRegistry         = toolRegistry;
        this.eventBus             = eventBus;
        this.communicationManager = communicationManager;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        return orchestrator.health();
    }

    @GetMapping("/tools")
    public List<ToolDescriptor> tools() {
        return toolRegistry.descriptors();
    }

    /** Most recent events, oldest first. {@code limit <= 0} returns the whole history. */
    @GetMapping("/events")
    public List<Event> events(@RequestParam(defaultValue = "100") int limit,
                              @RequestParam(required = false) EventType type) {
        return type == null
                ? eventBus.getEventHistory(limit)
                : eventBus.getEventHistory(type, limit);
    }

    @GetMapping("/events/subscriptions")
    public Map<EventType, SubscriptionStats> subscriptions() {
        return eventBus.getSubscriptionStats();
    }

    @GetMapping("/metrics")
    public Map<String, RequestMetrics.Snapshot> metrics() {
        return communicationManager.getAllMetrics();
    }

    @GetMapping("/circuit-breakers")
    public List<CircuitBreaker.Snapshot> circuitBreakers() {
        return communicationManager.getCircuitBreakerStates();
    }
}
