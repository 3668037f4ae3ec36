package com.containerkit.engine.job;

import com.containerkit.engine.error.EngineException;

import java.util.Arrays;

/**
 * Kinds of long-running work, each dispatched to its own {@link JobHandler}.
 * The wire value is what API clients send.
 */
public enum JobType {
    ANALYSIS("analysis"),
    BUILD("build"),
    DEPLOY("deploy");

    private final String value;

    JobType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /** @throws EngineException VALIDATION for an unknown wire value */
    public static JobType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> EngineException.validation("Unknown job type: '" + value + "'"));
    }
}
