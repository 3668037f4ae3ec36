package com.containerkit.engine.job;

import com.containerkit.engine.tool.ExecutionContext;
import com.containerkit.engine.tool.ToolDispatcher;
import com.containerkit.engine.tool.ToolInput;
import com.containerkit.engine.tool.ToolOutput;

import java.util.Map;

/**
 * Backs a job type with a registered tool.
 *
 * Job parameters become the tool's arguments; a {@code session_id}
 * parameter becomes the call's session. A tool-level failure fails the job
 * with the tool's error message.
 */
public class ToolJobHandler implements JobHandler {

    private final JobType        type;
    private final String         toolName;
    private final ToolDispatcher dispatcher;

    public ToolJobHandler(JobType type, String toolName, ToolDispatcher dispatcher) {
        this.type       = type;
        this.toolName   = toolName;
        this.dispatcher = dispatcher;
    }

    @Override
    public JobType type() {
        return type;
    }

    public String toolName() {
        return toolName;
    }

    @Override
    public Map<String, Object> handle(ExecutionContext ctx, Job job) {
        Object session = job.getParameters().get("session_id");
        ToolInput input = new ToolInput(
                session == null ? null : session.toString(),
                job.getParameters(),
                Map.of("job_id", job.getId(), "job_type", type.value()));

        ToolOutput output = dispatcher.dispatch(ctx, toolName, input);
        if (!output.success()) {
            throw new JobHandlerException(output.error() == null
                    ? "Tool '" + toolName + "' reported failure"
                    : output.error());
        }
        return output.data();
    }
}
