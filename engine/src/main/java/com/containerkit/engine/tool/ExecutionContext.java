package com.containerkit.engine.tool;

import com.containerkit.engine.error.EngineException;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cooperative cancellation and deadline token passed to every tool, job
 * handler and event handler.
 *
 * Contexts form a chain: a child is done as soon as its parent is done, and
 * a child's deadline is never later than its parent's. Nothing here stops a
 * thread; code that wants to be cancellable polls {@link #isDone()} or waits
 * through {@link #sleep(Duration)}.
 */
public final class ExecutionContext {

    // Upper bound on how long sleep() waits before re-checking ancestors.
    private static final long POLL_SLICE_MS = 25;

    private final ExecutionContext parent;
    private final Instant deadline;
    private final CompletableFuture<Void> cancelSignal = new CompletableFuture<>();

    private ExecutionContext(ExecutionContext parent, Instant deadline) {
        this.parent   = parent;
        this.deadline = deadline;
    }

    /** A fresh root context with no deadline. */
    public static ExecutionContext background() {
        return new ExecutionContext(null, null);
    }

    public ExecutionContext withTimeout(Duration timeout) {
        return withDeadline(Instant.now().plus(timeout));
    }

    public ExecutionContext withDeadline(Instant newDeadline) {
        Instant effective = (deadline != null && deadline.isBefore(newDeadline)) ? deadline : newDeadline;
        return new ExecutionContext(this, effective);
    }

    /** A child that can be cancelled on its own without affecting this context. */
    public ExecutionContext child() {
        return new ExecutionContext(this, deadline);
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    public boolean hasDeadline() {
        return deadline != null;
    }

    /** Time left until the deadline, clamped at zero; empty when there is no deadline. */
    public Optional<Duration> remaining() {
        if (deadline == null) return Optional.empty();
        Duration left = Duration.between(Instant.now(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    public void cancel() {
        cancelSignal.complete(null);
    }

    public boolean isCancelled() {
        return cancelSignal.isDone() || (parent != null && parent.isCancelled());
    }

    public boolean isExpired() {
        return deadline != null && !Instant.now().isBefore(deadline);
    }

    public boolean isDone() {
        return isCancelled() || isExpired();
    }

    /** Throws TIMEOUT if the context is cancelled or past its deadline. */
    public void throwIfDone() {
        if (isCancelled()) {
            throw EngineException.timeout("context cancelled");
        }
        if (isExpired()) {
            throw EngineException.timeout("context deadline exceeded");
        }
    }

    /**
     * Sleep for {@code duration}, waking early when the context is cancelled
     * or its deadline passes.
     *
     * @throws EngineException TIMEOUT if the wait was cut short
     */
    public void sleep(Duration duration) {
        Instant wakeAt = Instant.now().plus(duration);
        while (true) {
            throwIfDone();
            Instant now = Instant.now();
            if (!now.isBefore(wakeAt)) {
                return;
            }
            long waitMs = Math.min(POLL_SLICE_MS, Duration.between(now, wakeAt).toMillis() + 1);
            try {
                cancelSignal.get(waitMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                // slice elapsed; loop re-checks deadline and ancestors
            } catch (ExecutionException e) {
                throw EngineException.internal("cancel signal failed", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw EngineException.timeout("interrupted while waiting");
            }
        }
    }
}
