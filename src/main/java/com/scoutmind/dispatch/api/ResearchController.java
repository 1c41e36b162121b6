package com.scoutmind.dispatch.api;

import com.scoutmind.core.engine.ResearchEngine;
import com.scoutmind.core.events.EventBus;
import com.scoutmind.core.events.ResearchEvent;
import com.scoutmind.core.model.RunStatus;
import com.scoutmind.core.state.ResearchState;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * REST controller for research runs.
 */
@RestController
@RequestMapping("/api/v1/research")
public class ResearchController {

    private static final Logger log = LoggerFactory.getLogger(ResearchController.class);

    private final ResearchEngine researchEngine;
    private final BaseCheckpointSaver checkpointSaver;
    private final SseStreamingService sseStreamingService;
    private final EventBus eventBus;

    private final int retainedRuns;

    /** Running and finished run states, keyed by runId. */
    private final ConcurrentHashMap<String, ResearchState> runStates = new ConcurrentHashMap<>();

    /** Finished run ids, oldest first; only the newest {@code retainedRuns} stay in {@link #runStates}. */
    private final ConcurrentLinkedDeque<String> finishedRuns = new ConcurrentLinkedDeque<>();

    public ResearchController(ResearchEngine researchEngine,
                              BaseCheckpointSaver checkpointSaver,
                              SseStreamingService sseStreamingService,
                              EventBus eventBus,
                              @Value("${scoutmind.api.retained-runs:200}") int retainedRuns) {
        this.researchEngine = researchEngine;
        this.checkpointSaver = checkpointSaver;
        this.sseStreamingService = sseStreamingService;
        this.eventBus = eventBus;
        this.retainedRuns = Math.max(1, retainedRuns);
    }

    /**
     * POST /api/v1/research: Start a run in the background.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> submitResearch(@RequestBody ResearchRequest request) {
        if (!request.hasQuery()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Query is required"));
        }
        String runId = researchEngine.newRunId();
        log.info("Accepted research run {}, launching async execution", runId);
        launchAsync(runId, request);
        return ResponseEntity.accepted().body(Map.of(
                "run_id", runId,
                "status", RunStatus.PLANNING.name()
        ));
    }

    /**
     * POST /api/v1/research/stream: Start a run and stream its events. The run
     * is cancelled if the client disconnects before it finishes.
     */
    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamResearch(@RequestBody ResearchRequest request) {
        if (!request.hasQuery()) {
            return ResponseEntity.badRequest().build();
        }
        String runId = researchEngine.newRunId();
        log.info("Accepted streaming research run {}", runId);
        SseEmitter emitter = sseStreamingService.createEmitter(runId, () -> researchEngine.cancel(runId));
        launchAsync(runId, request);
        return ResponseEntity.ok(emitter);
    }

    /**
     * POST /api/v1/research/sync: Run to completion and return the full report.
     */
    @PostMapping("/sync")
    public ResponseEntity<ResearchReportResponse> researchSync(@RequestBody ResearchRequest request) {
        if (!request.hasQuery()) {
            return ResponseEntity.badRequest().body(
                    ResearchReportResponse.failed(null, request.query(), "Query is required"));
        }
        String runId = researchEngine.newRunId();
        try {
            ResearchState state = researchEngine.runResearch(runId, request.query(), request.isDeepResearch());
            return ResponseEntity.ok(ResearchReportResponse.from(state));
        } catch (Exception e) {
            log.error("Synchronous research run {} failed", runId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                    ResearchReportResponse.failed(runId, request.query(), errorMessage(e)));
        } finally {
            cleanupRunResources(runId);
        }
    }

    /**
     * GET /api/v1/research: List tracked runs.
     */
    @GetMapping
    public ResponseEntity<List<RunResponse>> listRuns() {
        return ResponseEntity.ok(runStates.values().stream().map(RunResponse::from).toList());
    }

    /**
     * GET /api/v1/research/{id}: Run status. While the run is active the latest
     * checkpoint is read for live progress.
     */
    @GetMapping("/{id}")
    public ResponseEntity<RunResponse> getRun(@PathVariable String id) {
        ResearchState state = runStates.get(id);
        if (state == null) {
            return ResponseEntity.notFound().build();
        }
        if (!state.status().isTerminal()) {
            state = liveState(id).orElse(state);
        }
        return ResponseEntity.ok(RunResponse.from(state));
    }

    /**
     * GET /api/v1/research/{id}/events: SSE stream of a run's events. A run
     * that has already finished gets its final state as a single terminal event.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable String id) {
        ResearchState state = runStates.get(id);
        if (state == null) {
            return ResponseEntity.notFound().build();
        }
        if (state.status().isTerminal()) {
            return ResponseEntity.ok(sseStreamingService.createFinishedEmitter(terminalEvent(state)));
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(id));
    }

    /**
     * POST /api/v1/research/{id}/cancel: Stop a run before its next task.
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<Map<String, String>> cancelRun(@PathVariable String id) {
        ResearchState state = runStates.get(id);
        if (state == null) {
            return ResponseEntity.notFound().build();
        }
        if (state.status().isTerminal()) {
            return ResponseEntity.badRequest().body(
                    Map.of("error", "Run is not active; current status: " + state.status()));
        }
        log.info("Cancelling research run {}", id);
        researchEngine.cancel(id);
        return ResponseEntity.accepted().body(Map.of(
                "run_id", id,
                "status", "CANCELLING"
        ));
    }

    private void launchAsync(String runId, ResearchRequest request) {
        runStates.put(runId, placeholderState(runId, request.query(), RunStatus.PLANNING, ""));

        CompletableFuture.runAsync(() -> {
            ResearchState finalState;
            try {
                finalState = researchEngine.runResearch(runId, request.query(), request.isDeepResearch());
            } catch (Exception e) {
                log.error("Research run {} failed", runId, e);
                finalState = placeholderState(runId, request.query(), RunStatus.FAILED, errorMessage(e));
            }
            try {
                recordFinished(runId, finalState);
            } finally {
                cleanupRunResources(runId);
            }
        });
    }

    private void recordFinished(String runId, ResearchState finalState) {
        runStates.put(runId, finalState);
        finishedRuns.addLast(runId);
        while (finishedRuns.size() > retainedRuns) {
            String evicted = finishedRuns.pollFirst();
            if (evicted != null) {
                runStates.remove(evicted);
                log.debug("Evicted finished run {} from the run index", evicted);
            }
        }
    }

    /**
     * Rebuilds the terminal event of a finished run from its stored state.
     */
    static ResearchEvent terminalEvent(ResearchState state) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("state", state.snapshot());
        String type;
        switch (state.status()) {
            case CANCELLED -> {
                type = ResearchEvent.RUN_CANCELLED;
                payload.put("message", state.message());
            }
            case FAILED -> {
                type = ResearchEvent.RUN_FAILED;
                payload.put("error", state.message());
            }
            default -> {
                type = ResearchEvent.RUN_COMPLETED;
                payload.put("final_output", state.finalOutput().orElse(""));
                payload.put("progress", 100);
                payload.put("description", "Research complete");
            }
        }
        return new ResearchEvent(type, state.runId(), null, payload, Instant.now());
    }

    private Optional<ResearchState> liveState(String runId) {
        try {
            RunnableConfig config = RunnableConfig.builder().threadId(runId).build();
            Optional<Checkpoint> latest = checkpointSaver.get(config);
            return latest.map(c -> new ResearchState(c.getState()));
        } catch (Exception e) {
            log.debug("Failed to read checkpoint for {}, using in-memory state", runId);
            return Optional.empty();
        }
    }

    private void cleanupRunResources(String runId) {
        eventBus.clearRun(runId);
        try {
            checkpointSaver.release(RunnableConfig.builder().threadId(runId).build());
        } catch (Exception e) {
            log.debug("Failed to release checkpoints for {}: {}", runId, e.getMessage());
        }
    }

    private static ResearchState placeholderState(String runId, String query, RunStatus status, String message) {
        var data = new HashMap<String, Object>();
        data.put(ResearchState.RUN_ID, runId);
        data.put(ResearchState.QUERY, query);
        data.put(ResearchState.STATUS, status.name());
        data.put(ResearchState.MESSAGE, message);
        return new ResearchState(data);
    }

    private static String errorMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
