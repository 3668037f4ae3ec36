package com.containerkit.engine.api;

import com.containerkit.engine.api.dto.JobResponse;
import com.containerkit.engine.api.dto.SubmitJobRequest;
import com.containerkit.engine.error.EngineException;
import com.containerkit.engine.job.Job;
import com.containerkit.engine.job.JobOrchestrator;
import com.containerkit.engine.job.JobStatus;
import com.containerkit.engine.job.JobType;
import com.containerkit.engine.job.OrchestratorStats;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * REST API for the asynchronous job queue.
 *
 * POST /jobs               - submit a job
 * GET  /jobs?status=       - list jobs, optionally filtered by status
 * GET  /jobs/{id}          - poll the current state of a job
 * POST /jobs/{id}/cancel   - cancel a pending or running job
 * GET  /jobs/stats         - counts per status
 */
@RestController
@RequestMapping("/jobs")
public class JobController {

    private final JobOrchestrator jobOrchestrator;

    public JobController(JobOrchestrator jobOrchestrator) {
        this.jobOrchestrator = jobOrchestrator;
    }

    /**
     * Submit a new job.
     *
     * Example:
     *   curl -X POST http://localhost:8080/jobs \
     *     -H "Content-Type: application/json" \
     *     -d '{"type":"build","parameters":{"image_name":"app","tag":"v1"}}'
     *
     * A full queue still returns 201; the job comes back already FAILED.
     */
    @PostMapping
    public ResponseEntity<JobResponse> submit(@RequestBody SubmitJobRequest req) {
        if (req.type() == null || req.type().isBlank()) {
            throw EngineException.validation("Job type is required");
        }
        Map<String, Object> params = req.parameters() == null ? Map.of() : req.parameters();
        Job job = jobOrchestrator.submit(JobType.fromValue(req.type()), params);
        return ResponseEntity.status(HttpStatus.CREATED).body(JobResponse.from(job));
    }

    @GetMapping
    public List<JobResponse> list(@RequestParam(required = false) String status) {
        return jobOrchestrator.listJobs(parseStatus(status)).stream()
                .map(JobResponse::from)
                .toList();
    }

    /**
     * Poll the current state of a job.
     * Returns 404 if the job ID is not found.
     */
    @GetMapping("/{id}")
    public JobResponse getJob(@PathVariable String id) {
        return jobOrchestrator.getJob(id)
                .map(JobResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Job not found: " + id));
    }

    /**
     * Returns 404 for an unknown job and 400 when the job already finished.
     */
    @PostMapping("/{id}/cancel")
    public JobResponse cancel(@PathVariable String id) {
        jobOrchestrator.cancelJob(id);
        return getJob(id);
    }

    @GetMapping("/stats")
    public OrchestratorStats stats() {
        return jobOrchestrator.getStats();
    }

    private static JobStatus parseStatus(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return JobStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw EngineException.validation("Unknown job status: " + raw);
        }
    }
}
