package com.scoutmind.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Scoutmind-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String TASK_INDEX = "taskIndex";
    public static final String ACTION = "action";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setTask(String runId, int taskIndex, String action) {
        MDC.put(RUN_ID, runId);
        MDC.put(TASK_INDEX, String.valueOf(taskIndex));
        MDC.put(ACTION, action);
    }

    /**
     * Drops the task keys and keeps the run key.
     */
    public static void clearTask() {
        MDC.remove(TASK_INDEX);
        MDC.remove(ACTION);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(TASK_INDEX);
        MDC.remove(ACTION);
    }
}
