package com.containerkit.engine.job;

import com.containerkit.engine.tool.ExecutionContext;

import java.util.Map;

/**
 * Executes jobs of one {@link JobType} on a job-worker thread.
 *
 * The context carries the job timeout and is cancelled when the job is
 * cancelled or the orchestrator stops; long handlers should check it.
 * Throwing fails the job with the exception message.
 */
public interface JobHandler {

    JobType type();

    Map<String, Object> handle(ExecutionContext ctx, Job job) throws Exception;
}
