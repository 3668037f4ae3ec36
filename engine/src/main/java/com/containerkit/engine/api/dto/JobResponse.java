package com.containerkit.engine.api.dto;

import com.containerkit.engine.job.Job;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Response body for the /jobs endpoints.
 * Contains enough information for the caller to poll job progress.
 * Timestamps and error are omitted until the job reaches that point.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        String              id,
        String              type,
        String              status,
        Map<String, Object> parameters,
        Map<String, Object> result,
        String              error,
        Instant             createdAt,
        Instant             startedAt,
        Instant             completedAt
) {
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.getId(),
                job.getType().value(),
                job.getStatus().name(),
                job.getParameters(),
                job.getResult(),
                job.getError(),
                job.getCreatedAt(),
                job.getStartedAt(),
                job.getCompletedAt()
        );
    }
}
