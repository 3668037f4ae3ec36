package com.containerkit.engine.job;

/** Thrown by a {@link JobHandler} when the work ran but did not succeed. */
public class JobHandlerException extends RuntimeException {

    public JobHandlerException(String message) {
        super(message);
    }
}
