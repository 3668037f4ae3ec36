package com.containerkit.engine.job;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One asynchronously tracked unit of work.
 *
 * State changes go through the package-private {@code mark*} methods, which
 * refuse any transition {@link JobStatus#canTransitionTo} does not allow, so
 * a terminal job never changes again. Callers outside the package only ever
 * see copies.
 */
public class Job {

    private final String              id;
    private final JobType             type;
    private final Map<String, Object> parameters;
    private final Instant             createdAt;

    private JobStatus           status = JobStatus.PENDING;
    private Map<String, Object> result = Map.of();
    private String              error;
    private Instant             startedAt;
    private Instant             completedAt;

    public Job(JobType type, Map<String, Object> parameters) {
        this(UUID.randomUUID().toString(), type, parameters);
    }

    public Job(String id, JobType type, Map<String, Object> parameters) {
        this(id, type, parameters, Instant.now());
    }

    private Job(String id, JobType type, Map<String, Object> parameters, Instant createdAt) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Job id must not be blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("Job type is required");
        }
        this.id         = id;
        this.type       = type;
        this.parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.createdAt  = createdAt;
    }

    // ------------------------------------------------------------------
    // Transitions (JobOrchestrator only)
    // ------------------------------------------------------------------

    synchronized boolean markRunning() {
        if (!status.canTransitionTo(JobStatus.RUNNING)) return false;
        status    = JobStatus.RUNNING;
        startedAt = Instant.now();
        return true;
    }

    synchronized boolean markCompleted(Map<String, Object> output) {
        if (!status.canTransitionTo(JobStatus.COMPLETED)) return false;
        status      = JobStatus.COMPLETED;
        result      = output == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(output));
        completedAt = Instant.now();
        return true;
    }

    synchronized boolean markFailed(String reason) {
        if (!status.canTransitionTo(JobStatus.FAILED)) return false;
        status      = JobStatus.FAILED;
        error       = reason;
        completedAt = Instant.now();
        return true;
    }

    synchronized boolean markCancelled() {
        if (!status.canTransitionTo(JobStatus.CANCELLED)) return false;
        status      = JobStatus.CANCELLED;
        completedAt = Instant.now();
        return true;
    }

    synchronized Job copy() {
        Job copy = new Job(id, type, parameters, createdAt);
        copy.status      = status;
        copy.result      = result;
        copy.error       = error;
        copy.startedAt   = startedAt;
        copy.completedAt = completedAt;
        return copy;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public String              getId()          { return id; }
    public JobType             getType()        { return type; }
    public Map<String, Object> getParameters()  { return parameters; }
    public Instant             getCreatedAt()   { return createdAt; }

    public synchronized JobStatus           getStatus()      { return status; }
    public synchronized Map<String, Object> getResult()      { return result; }
    public synchronized String              getError()       { return error; }
    public synchronized Instant             getStartedAt()   { return startedAt; }
    public synchronized Instant             getCompletedAt() { return completedAt; }
}
