package com.scoutmind.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a research run executes, used for SSE streaming and CLI progress.
 *
 * @param eventType event type (e.g. "run.created", "step", "run.completed", "run.failed")
 * @param runId     the run this event belongs to
 * @param taskIndex the task this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record ResearchEvent(
    String eventType,
    String runId,
    Integer taskIndex,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String RUN_CREATED = "run.created";
    public static final String STEP = "step";
    public static final String RUN_COMPLETED = "run.completed";
    public static final String RUN_FAILED = "run.failed";
    public static final String RUN_CANCELLED = "run.cancelled";

    public boolean isTerminal() {
        return RUN_COMPLETED.equals(eventType)
                || RUN_FAILED.equals(eventType)
                || RUN_CANCELLED.equals(eventType);
    }
}
