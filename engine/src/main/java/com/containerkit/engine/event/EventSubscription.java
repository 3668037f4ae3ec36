package com.containerkit.engine.event;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One handler bound to one event type. Owned by the {@link EventBus}; only
 * {@link EventBus#unsubscribe} deactivates it.
 */
public final class EventSubscription {

    private final String       id;
    private final EventType    eventType;
    private final EventHandler handler;
    private final AtomicBoolean active       = new AtomicBoolean(true);
    private final AtomicLong    handledCount = new AtomicLong();
    private final AtomicLong    errorCount   = new AtomicLong();

    EventSubscription(String id, EventType eventType, EventHandler handler) {
        this.id        = id;
        this.eventType = eventType;
        this.handler   = handler;
    }

    public String    getId()           { return id; }
    public EventType getEventType()    { return eventType; }
    public boolean   isActive()        { return active.get(); }
    public long      getHandledCount() { return handledCount.get(); }
    public long      getErrorCount()   { return errorCount.get(); }

    EventHandler handler()  { return handler; }
    void deactivate()       { active.set(false); }
    void recordHandled()    { handledCount.incrementAndGet(); }
    void recordError()      { errorCount.incrementAndGet(); }
}
