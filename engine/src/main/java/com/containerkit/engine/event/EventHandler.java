package com.containerkit.engine.event;

import com.containerkit.engine.tool.ExecutionContext;

/**
 * Callback registered with {@link EventBus#subscribe}.
 *
 * Runs on an event-bus worker thread. The context carries the per-handler
 * timeout; handlers doing slow work should honour it. Exceptions are counted
 * against the subscription and logged, never seen by the publisher.
 */
@FunctionalInterface
public interface EventHandler {
    void handle(ExecutionContext ctx, Event event) throws Exception;
}
