package com.containerkit.engine.comm;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Tracing record for one logical request and the tools it touched.
 *
 * Mutated only by the {@link CommunicationManager}; readers get a
 * {@link Snapshot}.
 */
public class RequestCorrelation {

    private final String  id;
    private final String  rootRequestId;
    private final String  parentId;
    private final String  sessionId;
    private final Instant startTime;

    private final List<String> toolChain = new ArrayList<>();
    private CorrelationStatus  status    = CorrelationStatus.PENDING;
    private Instant            endTime;

    RequestCorrelation(String id, String rootRequestId, String parentId, String sessionId, Instant startTime) {
        this.id            = id;
        this.rootRequestId = rootRequestId;
        this.parentId      = parentId;
        this.sessionId     = sessionId;
        this.startTime     = startTime;
    }

    public String getId()            { return id; }
    public String getRootRequestId() { return rootRequestId; }
    public String getParentId()      { return parentId; }

    synchronized void appendTool(String toolName) {
        toolChain.add(toolName);
    }

    synchronized void finish(CorrelationStatus finalStatus) {
        status  = finalStatus;
        endTime = Instant.now();
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(id, rootRequestId, parentId, sessionId, startTime, endTime, status, List.copyOf(toolChain));
    }

    public record Snapshot(String id,
                           String rootRequestId,
                           String parentId,
                           String sessionId,
                           Instant startTime,
                           Instant endTime,
                           CorrelationStatus status,
                           List<String> toolChain) {}
}
