package com.containerkit.engine.job;

import com.containerkit.engine.error.EngineException;
import com.containerkit.engine.event.EventBus;
import com.containerkit.engine.event.EventType;
import com.containerkit.engine.tool.ExecutionContext;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Queued, asynchronous execution of long-running jobs.
 *
 * <p>Submission never blocks: the job is offered to a bounded queue and,
 * if the queue is full, marked FAILED on the spot. A fixed pool of workers
 * drains the queue; each worker runs one job at a time under the configured
 * job timeout, dispatching on {@link JobType} to the registered
 * {@link JobHandler}. Types without a handler complete with an empty result.
 *
 * <p>Cancellation is cooperative: {@link #cancelJob} marks the job
 * CANCELLED and cancels its context, but a handler that never checks the
 * context runs to the end (its result is then discarded).
 *
 * <p>Finished jobs are retained for polling up to {@code maxRetainedTerminal};
 * beyond that the oldest terminal jobs are evicted.
 */
public class JobOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JobOrchestrator.class);

    private static final long     POLL_INTERVAL_MS = 100;
    private static final Duration STOP_TIMEOUT     = Duration.ofSeconds(30);

    private final BlockingQueue<Job>         queue;
    private final Map<JobType, JobHandler>   handlers = new EnumMap<>(JobType.class);
    private final Duration                   jobTimeout;
    private final int                        maxRetainedTerminal;
    private final EventBus                   eventBus;
    private final MeterRegistry              meterRegistry;
    private final ExecutorService            workers;
    private final ExecutionContext           rootContext = ExecutionContext.background();

    // Insertion order doubles as creation order for listing and eviction.
    private final Map<String, Job> jobs     = new LinkedHashMap<>();
    private final ReadWriteLock    jobsLock = new ReentrantReadWriteLock();

    private final Map<String, ExecutionContext> runningContexts = new ConcurrentHashMap<>();
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public JobOrchestrator(List<JobHandler> jobHandlers,
                           int workerCount,
                           int queueCapacity,
                           Duration jobTimeout,
                           int maxRetainedTerminal,
                           EventBus eventBus,
                           MeterRegistry meterRegistry) {
        if (workerCount < 1 || queueCapacity < 1) {
            throw new IllegalArgumentException("workerCount and queueCapacity must be positive");
        }
        for (JobHandler handler : jobHandlers) {
            JobHandler previous = handlers.put(handler.type(), handler);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate handler for job type " + handler.type());
            }
        }
        this.queue               = new ArrayBlockingQueue<>(queueCapacity);
        this.jobTimeout          = jobTimeout;
        this.maxRetainedTerminal = maxRetainedTerminal;
        this.eventBus            = eventBus;
        this.meterRegistry       = meterRegistry;
        meterRegistry.gauge("engine.jobs.queue.size", queue, BlockingQueue::size);

        this.workers = Executors.newFixedThreadPool(workerCount, new CustomizableThreadFactory("job-worker-"));
        for (int i = 0; i < workerCount; i++) {
            workers.submit(this::workerLoop);
        }
        log.info("Job orchestrator started: workers={}, queue={}, handlers={}",
                workerCount, queueCapacity, handlers.keySet());
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /** Convenience wrapper creating the job; returns a snapshot after submission. */
    public Job submit(JobType type, Map<String, Object> parameters) {
        Job job = new Job(type, parameters);
        submitJob(job);
        return job.copy();
    }

    /**
     * Store the job and queue it for execution without blocking.
     *
     * A full queue is not an error for the caller: the job is stored as
     * FAILED with a queue-full message and this method returns normally.
     *
     * @throws EngineException RESOURCE if stopped; VALIDATION if the id is
     *                         taken or the job is not PENDING
     */
    public void submitJob(Job job) {
        if (stopped.get()) {
            throw EngineException.resource("Job orchestrator is stopped");
        }
        if (job.getStatus() != JobStatus.PENDING) {
            throw EngineException.validation("Job " + job.getId() + " is already " + job.getStatus());
        }
        jobsLock.writeLock().lock();
        try {
            if (jobs.containsKey(job.getId())) {
                throw EngineException.validation("Job " + job.getId() + " already exists");
            }
            jobs.put(job.getId(), job);
        } finally {
            jobsLock.writeLock().unlock();
        }
        publish(EventType.JOB_SUBMITTED, job);

        if (!queue.offer(job)) {
            job.markFailed("job queue is full");
            log.warn("Job queue full, job {} ({}) marked FAILED", job.getId(), job.getType().value());
            recordOutcome(job);
            publish(EventType.JOB_FAILED, job);
            pruneTerminalJobs();
            return;
        }
        log.info("Job {} ({}) queued", job.getId(), job.getType().value());
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public Optional<Job> getJob(String id) {
        jobsLock.readLock().lock();
        try {
            Job job = jobs.get(id);
            return job == null ? Optional.empty() : Optional.of(job.copy());
        } finally {
            jobsLock.readLock().unlock();
        }
    }

    /** Jobs in creation order; {@code status == null} lists every job. */
    public List<Job> listJobs(JobStatus status) {
        List<Job> snapshot;
        jobsLock.readLock().lock();
        try {
            snapshot = new ArrayList<>(jobs.values());
        } finally {
            jobsLock.readLock().unlock();
        }
        return snapshot.stream()
                .map(Job::copy)
                .filter(j -> status == null || j.getStatus() == status)
                .toList();
    }

    public OrchestratorStats getStats() {
        int pending = 0, running = 0, completed = 0, failed = 0, cancelled = 0;
        for (Job job : listJobs(null)) {
            switch (job.getStatus()) {
                case PENDING   -> pending++;
                case RUNNING   -> running++;
                case COMPLETED -> completed++;
                case FAILED    -> failed++;
                case CANCELLED -> cancelled++;
            }
        }
        return new OrchestratorStats(pending + running + completed + failed + cancelled,
                pending, running, completed, failed, cancelled);
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    /**
     * Cancel a PENDING or RUNNING job. A running handler is not interrupted;
     * it only sees its context cancelled.
     *
     * @throws EngineException NOT_FOUND for an unknown id, VALIDATION if the
     *                         job already finished
     */
    public void cancelJob(String id) {
        Job job;
        jobsLock.readLock().lock();
        try {
            job = jobs.get(id);
        } finally {
            jobsLock.readLock().unlock();
        }
        if (job == null) {
            throw EngineException.notFound("Job not found: " + id);
        }
        if (!job.markCancelled()) {
            throw EngineException.validation("Job " + id + " cannot be cancelled in status " + job.getStatus());
        }
        ExecutionContext ctx = runningContexts.get(id);
        if (ctx != null) {
            ctx.cancel();
        }
        log.info("Job {} cancelled", id);
        recordOutcome(job);
        publish(EventType.JOB_CANCELLED, job);
        pruneTerminalJobs();
    }

    // ------------------------------------------------------------------
    // Workers
    // ------------------------------------------------------------------

    private void workerLoop() {
        while (!stopped.get()) {
            Job job;
            try {
                job = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (job == null) continue;
            if (stopped.get()) {
                cancelUnstarted(job);
                return;
            }
            try {
                process(job);
            } catch (RuntimeException e) {
                // process() handles handler failures; this guards the loop itself
                log.error("Unexpected error processing job {}: {}", job.getId(), e.getMessage(), e);
            }
        }
    }

    private void process(Job job) {
        if (!job.markRunning()) {
            log.debug("Skipping job {}: already {}", job.getId(), job.getStatus());
            return;
        }
        ExecutionContext ctx = rootContext.withTimeout(jobTimeout);
        runningContexts.put(job.getId(), ctx);
        MDC.put("jobId", job.getId());
        try {
            log.info("Running job {} ({})", job.getId(), job.getType().value());
            publish(EventType.JOB_STARTED, job);

            JobHandler handler = handlers.get(job.getType());
            Map<String, Object> result = handler == null ? Map.of() : handler.handle(ctx, job.copy());

            if (job.markCompleted(result)) {
                log.info("Job {} COMPLETED", job.getId());
                recordOutcome(job);
                publish(EventType.JOB_COMPLETED, job);
            } else {
                log.info("Job {} finished after it was {}; result discarded", job.getId(), job.getStatus());
            }
        } catch (Exception e) {
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            if (ctx.isExpired() && !ctx.isCancelled()) {
                reason = "job timed out after " + jobTimeout + ": " + reason;
            }
            if (job.markFailed(reason)) {
                log.error("Job {} FAILED: {}", job.getId(), reason);
                recordOutcome(job);
                publish(EventType.JOB_FAILED, job);
            } else {
                log.info("Job {} errored after it was {}: {}", job.getId(), job.getStatus(), reason);
            }
        } finally {
            runningContexts.remove(job.getId());
            ctx.cancel();
            MDC.remove("jobId");
            pruneTerminalJobs();
        }
    }

    private void cancelUnstarted(Job job) {
        if (job.markCancelled()) {
            recordOutcome(job);
            publish(EventType.JOB_CANCELLED, job);
        }
    }

    // ------------------------------------------------------------------
    // Retention
    // ------------------------------------------------------------------

    private void pruneTerminalJobs() {
        jobsLock.writeLock().lock();
        try {
            long terminal = jobs.values().stream().filter(j -> j.getStatus().isTerminal()).count();
            Iterator<Job> it = jobs.values().iterator();
            while (terminal > maxRetainedTerminal && it.hasNext()) {
                Job job = it.next();
                if (job.getStatus().isTerminal()) {
                    it.remove();
                    terminal--;
                    log.debug("Evicted finished job {}", job.getId());
                }
            }
        } finally {
            jobsLock.writeLock().unlock();
        }
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    /**
     * Stop accepting jobs, cancel queued ones, signal running handlers and
     * wait for workers to exit. Safe to call more than once.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        rootContext.cancel();
        workers.shutdown();
        List<Job> unstarted = new ArrayList<>();
        queue.drainTo(unstarted);
        unstarted.forEach(this::cancelUnstarted);
        try {
            if (!workers.awaitTermination(STOP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Job workers still busy after {}; interrupting", STOP_TIMEOUT);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        log.info("Job orchestrator stopped ({} queued jobs cancelled)", unstarted.size());
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isStopped() {
        return stopped.get();
    }

    private void recordOutcome(Job job) {
        meterRegistry.counter("engine.jobs.completed",
                "type", job.getType().value(),
                "status", job.getStatus().name().toLowerCase()).increment();
    }

    private void publish(EventType type, Job job) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("job_id", job.getId());
        data.put("job_type", job.getType().value());
        data.put("status", job.getStatus().name());
        if (job.getError() != null) {
            data.put("error", job.getError());
        }
        Object session = job.getParameters().get("session_id");
        if (session != null) {
            data.put("session_id", session);
        }
        eventBus.publish(type, data);
    }
}
