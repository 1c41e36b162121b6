package com.scoutmind.core.events;

import com.scoutmind.core.model.PipelineStep;
import com.scoutmind.core.progress.Progress;
import com.scoutmind.core.state.ResearchState;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publishes a {@link ResearchEvent#STEP} event for each completed graph step.
 * The event carries the state as it will look once the step's update is
 * applied.
 */
@Component
public class StepEventPublisher {

    private final EventBus eventBus;

    public StepEventPublisher(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    public void publish(ResearchState state,
                        PipelineStep step,
                        Map<String, Object> update,
                        Progress progress,
                        Integer taskIndex,
                        Map<String, Object> metadata) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("step", step.wireName());
        payload.put("state", state.snapshotWith(update));
        payload.put("progress", progress.percent());
        payload.put("completed_steps", progress.completedSteps());
        payload.put("total_steps", progress.totalSteps());
        payload.put("description", progress.description());
        payload.put("metadata", metadata != null ? metadata : Map.of());
        eventBus.publish(new ResearchEvent(ResearchEvent.STEP, state.runId(), taskIndex, payload, Instant.now()));
    }
}
