package com.scoutmind.core.events;

import com.scoutmind.core.model.PipelineStep;
import com.scoutmind.core.progress.Progress;
import com.scoutmind.core.state.ResearchState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StepEventPublisherTest {

    @Test
    @DisplayName("step payload carries the post-update state and progress fields")
    void payload() {
        var bus = new EventBus();
        List<ResearchEvent> received = new ArrayList<>();
        bus.subscribe("run-1", received::add);
        var state = new ResearchState(Map.of(ResearchState.RUN_ID, "run-1", ResearchState.QUERY, "q"));

        new StepEventPublisher(bus).publish(state, PipelineStep.FINALIZE,
                Map.of(ResearchState.FINAL_OUTPUT, "# Done"),
                new Progress(83, 5, 6, "Finalizing research report"), null, null);

        assertEquals(1, received.size());
        ResearchEvent event = received.get(0);
        assertEquals(ResearchEvent.STEP, event.eventType());
        assertNull(event.taskIndex());
        Map<String, Object> payload = event.payload();
        assertEquals("finalize", payload.get("step"));
        assertEquals(83, payload.get("progress"));
        assertEquals(5, payload.get("completed_steps"));
        assertEquals(6, payload.get("total_steps"));
        assertEquals("Finalizing research report", payload.get("description"));
        assertEquals(Map.of(), payload.get("metadata"));
        @SuppressWarnings("unchecked")
        var snapshot = (Map<String, Object>) payload.get("state");
        assertEquals("# Done", snapshot.get("final_output"));
        assertEquals("q", snapshot.get("query"));
    }
}
