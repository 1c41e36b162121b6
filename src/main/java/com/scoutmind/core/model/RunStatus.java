package com.scoutmind.core.model;

/**
 * Lifecycle of a research run, used for display only.
 */
public enum RunStatus {
    PLANNING,
    EXECUTING,
    FINALIZING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }
}
