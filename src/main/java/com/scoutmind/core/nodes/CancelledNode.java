package com.scoutmind.core.nodes;

import com.scoutmind.core.model.RunStatus;
import com.scoutmind.core.state.ResearchState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Terminal step for a run stopped by a cancellation request. Results written
 * before the request are kept.
 */
@Component
public class CancelledNode {

    private static final Logger log = LoggerFactory.getLogger(CancelledNode.class);

    public Map<String, Object> apply(ResearchState state) {
        log.info("Run {} cancelled after {} of {} task(s)", state.runId(),
                state.currentTaskIndex(), state.totalTasks());
        return Map.of(
                ResearchState.STATUS, RunStatus.CANCELLED.name(),
                ResearchState.MESSAGE, "Research cancelled");
    }
}
