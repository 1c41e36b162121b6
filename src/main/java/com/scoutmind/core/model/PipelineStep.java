package com.scoutmind.core.model;

/**
 * Graph steps that report progress to streaming callers.
 */
public enum PipelineStep {
    PLANNER("planner"),
    TASK_EXECUTOR("task_executor"),
    FINALIZE("finalize");

    private final String wireName;

    PipelineStep(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
