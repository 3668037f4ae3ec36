package com.containerkit.engine.tool;

/** Coarse grouping used when listing tools. */
public enum ToolCategory {
    ANALYZE,
    BUILD,
    DEPLOY,
    SCAN,
    GENERAL
}
