package com.scoutmind.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks runs that have been asked to stop. The graph checks this at every
 * routing decision, so a cancelled run stops before its next task; the task
 * already running finishes and its result is kept.
 */
@Component
public class CancellationRegistry {

    private static final Logger log = LoggerFactory.getLogger(CancellationRegistry.class);

    private final Set<String> cancelled = ConcurrentHashMap.newKeySet();

    public void cancel(String runId) {
        if (runId != null && cancelled.add(runId)) {
            log.info("Cancellation requested for run {}", runId);
        }
    }

    public boolean isCancelled(String runId) {
        return runId != null && cancelled.contains(runId);
    }

    public void clear(String runId) {
        if (runId != null) {
            cancelled.remove(runId);
        }
    }
}
