package com.containerkit.engine.api.dto;

import java.util.Map;

/**
 * Request body for POST /jobs.
 *
 * @param type       job type wire value: "analysis", "build" or "deploy"
 * @param parameters handler input; may be omitted
 */
public record SubmitJobRequest(
        String              type,
        Map<String, Object> parameters
) {}
