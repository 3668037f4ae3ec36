package com.containerkit.engine.api;

import com.containerkit.engine.error.EngineException;
import com.containerkit.engine.job.Job;
import com.containerkit.engine.job.JobOrchestrator;
import com.containerkit.engine.job.JobStatus;
import com.containerkit.engine.job.JobType;
import com.containerkit.engine.job.OrchestratorStats;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for JobController.
 *
 * @WebMvcTest spins up only the web layer; JobOrchestrator is replaced by a
 * mock so no workers start.
 */
@WebMvcTest(JobController.class)
class JobControllerTest {

    @Autowired MockMvc mockMvc;
    @MockitoBean JobOrchestrator jobOrchestrator;

    private static Job fakeJob(JobType type) {
        return new Job("job-123", type, Map.of("image_name", "app"));
    }

    // ------------------------------------------------------------------
    // POST /jobs
    // ------------------------------------------------------------------

    @Test
    void submitJob_validRequest_returns201WithJob() throws Exception {
        when(jobOrchestrator.submit(eq(JobType.BUILD), any())).thenReturn(fakeJob(JobType.BUILD));

        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"type":"build","parameters":{"image_name":"app"}}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("job-123"))
                .andExpect(jsonPath("$.type").value("build"))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.parameters.image_name").value("app"));
    }

    @Test
    void submitJob_unknownType_returns400() throws Exception {
        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"type":"compile"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION"));

        verifyNoInteractions(jobOrchestrator);
    }

    @Test
    void submitJob_missingType_returns400() throws Exception {
        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void submitJob_orchestratorStopped_returns503() throws Exception {
        when(jobOrchestrator.submit(any(), any()))
                .thenThrow(EngineException.resource("Job orchestrator is stopped"));

        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"type":"deploy"}
                                """))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.detail").value("Job orchestrator is stopped"));
    }

    // ------------------------------------------------------------------
    // GET /jobs, GET /jobs/{id}
    // ------------------------------------------------------------------

    @Test
    void getJob_existingId_returns200() throws Exception {
        when(jobOrchestrator.getJob("job-123")).thenReturn(Optional.of(fakeJob(JobType.ANALYSIS)));

        mockMvc.perform(get("/jobs/{id}", "job-123"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("analysis"));
    }

    @Test
    void getJob_unknownId_returns404() throws Exception {
        when(jobOrchestrator.getJob("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/jobs/{id}", "missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void listJobs_statusFilter_passedThrough() throws Exception {
        when(jobOrchestrator.listJobs(JobStatus.PENDING)).thenReturn(List.of(fakeJob(JobType.BUILD)));

        mockMvc.perform(get("/jobs").param("status", "pending"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].id").value("job-123"));
    }

    @Test
    void listJobs_unknownStatus_returns400() throws Exception {
        mockMvc.perform(get("/jobs").param("status", "sleeping"))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // POST /jobs/{id}/cancel, GET /jobs/stats
    // ------------------------------------------------------------------

    @Test
    void cancel_existingJob_returnsJob() throws Exception {
        when(jobOrchestrator.getJob("job-123")).thenReturn(Optional.of(fakeJob(JobType.BUILD)));

        mockMvc.perform(post("/jobs/{id}/cancel", "job-123"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("job-123"));

        verify(jobOrchestrator).cancelJob("job-123");
    }

    @Test
    void cancel_unknownJob_returns404() throws Exception {
        doThrow(EngineException.notFound("Job not found: nope")).when(jobOrchestrator).cancelJob("nope");

        mockMvc.perform(post("/jobs/{id}/cancel", "nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("NOT_FOUND"));
    }

    @Test
    void cancel_finishedJob_returns400() throws Exception {
        doThrow(EngineException.validation("Job job-123 cannot be cancelled in status COMPLETED"))
                .when(jobOrchestrator).cancelJob("job-123");

        mockMvc.perform(post("/jobs/{id}/cancel", "job-123"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void stats_returnsCounts() throws Exception {
        when(jobOrchestrator.getStats()).thenReturn(new OrchestratorStats(5, 1, 1, 2, 1, 0));

        mockMvc.perform(get("/jobs/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(5))
                .andExpect(jsonPath("$.completed").value(2));
    }
}
