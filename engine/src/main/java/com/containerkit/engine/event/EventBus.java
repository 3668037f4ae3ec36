package com.containerkit.engine.event;

import com.containerkit.engine.tool.ExecutionContext;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-process publish/subscribe with asynchronous delivery.
 *
 * <p>Delivery model:
 * <ul>
 *   <li>{@link #publish} never blocks. The event is recorded in history and
 *       offered to a bounded buffer; if the buffer is full the event is
 *       dropped (newest first) and a warning is logged.</li>
 *   <li>A fixed pool of workers drains the buffer. One worker handles one
 *       event at a time and calls that event's handlers sequentially, each
 *       with its own timeout context. Different events may be handled
 *       concurrently by different workers.</li>
 *   <li>Handler failures are counted on the subscription and logged.</li>
 * </ul>
 */
public class EventBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private static final long POLL_INTERVAL_MS = 100;
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(10);

    private final BlockingQueue<Event> buffer;
    private final int                  maxHistory;
    private final Duration             handlerTimeout;
    private final String               source;
    private final MeterRegistry        meterRegistry;
    private final ExecutorService      workers;
    private final ExecutionContext     rootContext = ExecutionContext.background();

    private final Map<EventType, List<EventSubscription>> subscriptions = new ConcurrentHashMap<>();

    private final Deque<Event>  history     = new ArrayDeque<>();
    private final ReadWriteLock historyLock = new ReentrantReadWriteLock();

    private final AtomicBoolean closed  = new AtomicBoolean(false);
    private final AtomicLong    dropped = new AtomicLong();
    private final Counter       droppedCounter;

    public EventBus(int workerCount, int bufferSize, int maxHistory, Duration handlerTimeout,
                    String source, MeterRegistry meterRegistry) {
        if (workerCount < 1 || bufferSize < 1 || maxHistory < 1) {
            throw new IllegalArgumentException("workerCount, bufferSize and maxHistory must be positive");
        }
        this.buffer         = new ArrayBlockingQueue<>(bufferSize);
        this.maxHistory     = maxHistory;
        this.handlerTimeout = handlerTimeout;
        this.source         = source;
        this.meterRegistry  = meterRegistry;
        this.droppedCounter = meterRegistry.counter("engine.events.dropped");
        this.workers = Executors.newFixedThreadPool(workerCount, new CustomizableThreadFactory("event-worker-"));
        for (int i = 0; i < workerCount; i++) {
            workers.submit(this::workerLoop);
        }
        log.info("Event bus started: workers={}, buffer={}, maxHistory={}", workerCount, bufferSize, maxHistory);
    }

    // ------------------------------------------------------------------
    // Publishing
    // ------------------------------------------------------------------

    public void publish(EventType type, Map<String, Object> data) {
        publish(type, source, data);
    }

    public void publish(EventType type, String eventSource, Map<String, Object> data) {
        if (closed.get()) {
            log.warn("Event bus closed, ignoring {} event", type);
            return;
        }
        Map<String, Object> payload = data == null ? Map.of() : data;
        Object session = payload.get("session_id");
        Event event = new Event(UUID.randomUUID().toString(), type, eventSource, payload,
                Instant.now(), session == null ? null : session.toString());

        appendToHistory(event);
        meterRegistry.counter("engine.events.published", "type", type.name()).increment();

        if (!buffer.offer(event)) {
            dropped.incrementAndGet();
            droppedCounter.increment();
            log.warn("Event buffer full, dropping {} event {}", type, event.id());
        }
    }

    private void appendToHistory(Event event) {
        historyLock.writeLock().lock();
        try {
            history.addLast(event);
            while (history.size() > maxHistory) {
                history.removeFirst();
            }
        } finally {
            historyLock.writeLock().unlock();
        }
    }

    // ------------------------------------------------------------------
    // Subscriptions
    // ------------------------------------------------------------------

    /** @return the subscription id, used to {@link #unsubscribe} */
    public String subscribe(EventType type, EventHandler handler) {
        String id = "sub-" + UUID.randomUUID();
        subscriptions.computeIfAbsent(type, t -> new CopyOnWriteArrayList<>())
                .add(new EventSubscription(id, type, handler));
        log.debug("Subscription {} added for {}", id, type);
        return id;
    }

    /** @return false if no subscription has that id */
    public boolean unsubscribe(String subscriptionId) {
        for (List<EventSubscription> bucket : subscriptions.values()) {
            for (EventSubscription sub : bucket) {
                if (sub.getId().equals(subscriptionId)) {
                    sub.deactivate();
                    bucket.remove(sub);
                    log.debug("Subscription {} removed from {}", subscriptionId, sub.getEventType());
                    return true;
                }
            }
        }
        return false;
    }

    public Map<EventType, SubscriptionStats> getSubscriptionStats() {
        Map<EventType, SubscriptionStats> stats = new EnumMap<>(EventType.class);
        subscriptions.forEach((type, bucket) -> {
            if (bucket.isEmpty()) return;
            int active = 0;
            long handled = 0;
            long errors = 0;
            for (EventSubscription sub : bucket) {
                if (sub.isActive()) active++;
                handled += sub.getHandledCount();
                errors  += sub.getErrorCount();
            }
            stats.put(type, new SubscriptionStats(bucket.size(), active, handled, errors));
        });
        return stats;
    }

    // ------------------------------------------------------------------
    // History
    // ------------------------------------------------------------------

    /**
     * Most recent events, oldest first.
     *
     * @param limit maximum number of events; zero or negative means all retained
     */
    public List<Event> getEventHistory(int limit) {
        historyLock.readLock().lock();
        try {
            List<Event> all = new ArrayList<>(history);
            if (limit <= 0 || limit >= all.size()) {
                return all;
            }
            return List.copyOf(all.subList(all.size() - limit, all.size()));
        } finally {
            historyLock.readLock().unlock();
        }
    }

    public List<Event> getEventHistory(EventType type, int limit) {
        List<Event> matching = getEventHistory(0).stream()
                .filter(e -> e.type() == type)
                .toList();
        if (limit <= 0 || limit >= matching.size()) {
            return matching;
        }
        return matching.subList(matching.size() - limit, matching.size());
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    // ------------------------------------------------------------------
    // Delivery
    // ------------------------------------------------------------------

    private void workerLoop() {
        while (true) {
            Event event;
            try {
                event = buffer.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (event == null) {
                if (closed.get()) return;
                continue;
            }
            dispatch(event);
        }
    }

    private void dispatch(Event event) {
        List<EventSubscription> bucket = subscriptions.getOrDefault(event.type(), List.of());
        MDC.put("eventId", event.id());
        try {
            for (EventSubscription sub : bucket) {
                if (!sub.isActive()) continue;
                ExecutionContext ctx = rootContext.withTimeout(handlerTimeout);
                try {
                    sub.handler().handle(ctx, event);
                    sub.recordHandled();
                } catch (Exception e) {
                    sub.recordError();
                    log.warn("Handler {} failed for {} event {}: {}",
                            sub.getId(), event.type(), event.id(), e.getMessage());
                } finally {
                    ctx.cancel();
                }
            }
        } finally {
            MDC.remove("eventId");
        }
    }

    /**
     * Stop accepting events, let workers drain what is already buffered, and
     * wait for them to exit. Safe to call more than once.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Event workers did not drain within {}; {} events left undelivered",
                        CLOSE_TIMEOUT, buffer.size());
                rootContext.cancel();
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        log.info("Event bus closed ({} events dropped over lifetime)", dropped.get());
    }
}
