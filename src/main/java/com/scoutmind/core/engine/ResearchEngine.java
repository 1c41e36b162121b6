package com.scoutmind.core.engine;

import com.scoutmind.core.events.EventBus;
import com.scoutmind.core.events.ResearchEvent;
import com.scoutmind.core.graph.ResearchGraph;
import com.scoutmind.core.logging.MdcContext;
import com.scoutmind.core.metrics.ScoutmindMetrics;
import com.scoutmind.core.model.RunStatus;
import com.scoutmind.core.progress.Progress;
import com.scoutmind.core.progress.ProgressReporter;
import com.scoutmind.core.state.ResearchState;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Runs a research query through the LangGraph4j graph.
 * <p>
 * Publishes {@code run.created} before the graph starts and exactly one
 * terminal event when it stops: {@code run.completed}, {@code run.cancelled}
 * or {@code run.failed}.
 */
@Service
public class ResearchEngine {

    private static final Logger log = LoggerFactory.getLogger(ResearchEngine.class);

    private final ResearchGraph researchGraph;
    private final EventBus eventBus;
    private final ScoutmindMetrics metrics;
    private final ProgressReporter progressReporter;
    private final CancellationRegistry cancellations;

    public ResearchEngine(ResearchGraph researchGraph,
                          EventBus eventBus,
                          ScoutmindMetrics metrics,
                          ProgressReporter progressReporter,
                          CancellationRegistry cancellations) {
        this.researchGraph = researchGraph;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.progressReporter = progressReporter;
        this.cancellations = cancellations;
    }

    public ResearchState runResearch(String query, boolean deepResearch) {
        return runResearch(newRunId(), query, deepResearch);
    }

    /**
     * Runs the full pipeline for a query under a caller-chosen run id.
     *
     * @return the final graph state
     * @throws ResearchExecutionException if the graph itself fails
     */
    public ResearchState runResearch(String runId, String query, boolean deepResearch) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query must not be blank");
        }
        MdcContext.setRun(runId);
        long start = System.currentTimeMillis();
        try {
            log.info("Starting research run {} (deep: {}) for query: {}", runId, deepResearch, query);
            eventBus.publish(new ResearchEvent(ResearchEvent.RUN_CREATED, runId, null,
                    Map.of("query", query, "deep_research", deepResearch), Instant.now()));

            var stateMap = new HashMap<String, Object>();
            stateMap.put(ResearchState.RUN_ID, runId);
            stateMap.put(ResearchState.QUERY, query);
            stateMap.put(ResearchState.DEEP_RESEARCH, deepResearch);
            stateMap.put(ResearchState.STATUS, RunStatus.PLANNING.name());
            Map<String, Object> initialState = Map.copyOf(stateMap);

            var config = RunnableConfig.builder()
                    .threadId(runId)
                    .build();

            ResearchState state;
            try {
                state = researchGraph.getCompiledGraph()
                        .invoke(initialState, config)
                        .orElseThrow(() -> new IllegalStateException(
                                "Graph execution returned empty state for run " + runId));
            } catch (Exception e) {
                log.error("Research run {} failed: {}", runId, e.getMessage(), e);
                metrics.recordRunResult(RunStatus.FAILED.name());
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
                payload.put("type", e.getClass().getSimpleName());
                eventBus.publish(new ResearchEvent(ResearchEvent.RUN_FAILED, runId, null, payload, Instant.now()));
                throw new ResearchExecutionException(runId, "Research run " + runId + " failed: " + e.getMessage(), e);
            }

            metrics.recordRunResult(state.status().name());
            publishTerminal(state);
            log.info("Research run {} finished with status {}", runId, state.status());
            return state;
        } finally {
            metrics.recordRunDuration(System.currentTimeMillis() - start);
            cancellations.clear(runId);
            MdcContext.clear();
        }
    }

    public void cancel(String runId) {
        cancellations.cancel(runId);
    }

    public String newRunId() {
        return UUID.randomUUID().toString();
    }

    private void publishTerminal(ResearchState state) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("state", state.snapshot());
        if (state.status() == RunStatus.CANCELLED) {
            payload.put("message", state.message());
            eventBus.publish(new ResearchEvent(ResearchEvent.RUN_CANCELLED, state.runId(), null, payload, Instant.now()));
            return;
        }
        Progress done = progressReporter.completed(state.totalTasks());
        payload.put("final_output", state.finalOutput().orElse(""));
        payload.put("progress", done.percent());
        payload.put("description", done.description());
        eventBus.publish(new ResearchEvent(ResearchEvent.RUN_COMPLETED, state.runId(), null, payload, Instant.now()));
    }
}
