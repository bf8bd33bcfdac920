package com.github.dimitryivaniuta.governance.scheduler;

import lombok.Getter;

/**
 * A maintenance run that did not complete. Logged and recorded, never thrown into request handling.
 */
@Getter
public class SchedulerJobFailedException extends RuntimeException {

    private final String jobName;

    public SchedulerJobFailedException(String jobName, Throwable cause) {
        super("Maintenance job '" + jobName + "' failed: " + describe(cause), cause);
        this.jobName = jobName;
    }

    private static String describe(Throwable cause) {
        if (cause == null) return "unknown cause";
        String msg = cause.getMessage();
        return (msg == null || msg.isBlank()) ? cause.getClass().getSimpleName() : msg;
    }
}
