package com.containerkit.engine.tool;

/**
 * A named, schema-described unit of executable capability.
 *
 * Implementations are the concrete domain operations (repository analysis,
 * image build, manifest generation, ...). The engine only sees this
 * contract: it looks tools up by {@link #name()}, validates input against
 * {@link #schema()}, and calls {@link #execute} on a dispatch thread.
 *
 * <p>Failure reporting:
 * <ul>
 *   <li>Return {@code ToolOutput.failure(...)} when the operation ran but did
 *       not succeed (bad Dockerfile, failing scan). The caller sees it as a
 *       tool-level result.</li>
 *   <li>Throw when the tool could not do its job at all (registry unreachable,
 *       connection timeout). Exception messages are matched against the retry
 *       patterns, so keep them descriptive.</li>
 * </ul>
 *
 * Long-running tools should poll {@link ExecutionContext#isDone()} and stop
 * early when it returns true; the engine never kills a running tool.
 */
public interface Tool {

    /** Unique key in the registry. */
    String name();

    String description();

    ToolSchema schema();

    default ToolCategory category() {
        return ToolCategory.GENERAL;
    }

    ToolOutput execute(ExecutionContext ctx, ToolInput input) throws Exception;
}
