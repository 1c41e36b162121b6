package com.scoutmind.core.engine;

/**
 * A research run failed outside the per-task error boundaries.
 */
public class ResearchExecutionException extends RuntimeException {

    private final String runId;

    public ResearchExecutionException(String runId, String message, Throwable cause) {
        super(message, cause);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
