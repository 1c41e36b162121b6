package com.scoutmind.core.nodes;

import com.scoutmind.core.events.EventBus;
import com.scoutmind.core.events.StepEventPublisher;
import com.scoutmind.core.metrics.ScoutmindMetrics;
import com.scoutmind.core.model.ResultKeys;
import com.scoutmind.core.model.TaskResult;
import com.scoutmind.core.persistence.InMemoryReportStore;
import com.scoutmind.core.persistence.ReportStore;
import com.scoutmind.core.persistence.ReportStoreException;
import com.scoutmind.core.progress.ProgressReporter;
import com.scoutmind.core.state.ResearchState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link FinalizeNode}.
 */
class FinalizeNodeTest {

    private ScoutmindMetrics metrics;

    @BeforeEach
    void setUp() {
        metrics = mock(ScoutmindMetrics.class);
    }

    private FinalizeNode node(ReportStore store) {
        return new FinalizeNode(store, new ProgressReporter(), new StepEventPublisher(new EventBus()), metrics);
    }

    private static ResearchState state(Map<Integer, TaskResult> results) {
        var channel = new HashMap<String, TaskResult>();
        results.forEach((index, result) -> channel.putAll(ResearchState.resultEntry(index, result)));
        return new ResearchState(Map.of(
                ResearchState.RUN_ID, "run-1",
                ResearchState.QUERY, "airpods",
                ResearchState.TASK_RESULTS, channel));
    }

    @Test
    @DisplayName("first final report in index order wins and is stored")
    void firstReportWins() {
        var results = new HashMap<Integer, TaskResult>();
        results.put(3, TaskResult.builder().put(ResultKeys.FINAL_REPORT, "# Later").build());
        results.put(1, TaskResult.builder().put(ResultKeys.FINAL_REPORT, "# Earlier").build());
        results.put(0, TaskResult.builder().put(ResultKeys.FINAL_REPORT, null).put(ResultKeys.ERROR, "x").build());
        var store = new InMemoryReportStore();

        var update = node(store).apply(state(results));

        assertEquals("# Earlier", update.get(ResearchState.FINAL_OUTPUT));
        assertEquals("COMPLETED", update.get(ResearchState.STATUS));
        assertEquals("# Earlier", store.findById("run-1").orElseThrow().content());
        assertEquals("airpods", store.findById("run-1").orElseThrow().query());
        verify(metrics).recordReportPersistence(true);
    }

    @Test
    @DisplayName("without a report lists task errors and stores nothing")
    void incompleteReport() {
        var store = new InMemoryReportStore();
        var results = Map.of(
                0, TaskResult.error("Search API key is not configured"),
                1, TaskResult.error("No URL provided"));

        var update = node(store).apply(state(results));

        assertEquals("""
                # Research Incomplete

                **Query:** airpods

                No final report was generated.

                **Task errors:**

                - Task 0: Search API key is not configured
                - Task 1: No URL provided
                """, update.get(ResearchState.FINAL_OUTPUT));
        assertTrue(store.findRecent(10).isEmpty());
        verify(metrics, never()).recordReportPersistence(anyBoolean());
    }

    @Test
    @DisplayName("without results or errors says so")
    void noErrors() {
        assertEquals("# Research Incomplete\n\n**Query:** q\n\nNo final report was generated. No task reported an error.\n",
                FinalizeNode.incompleteReport("q", Map.of()));
    }

    @Test
    @DisplayName("storage failure does not fail finalization")
    void storageFailure() {
        var store = mock(ReportStore.class);
        doThrow(new ReportStoreException("db down", null)).when(store).save(anyString(), anyString(), anyString());

        var update = node(store).apply(state(Map.of(0, TaskResult.builder().put(ResultKeys.FINAL_REPORT, "# R").build())));

        assertEquals("# R", update.get(ResearchState.FINAL_OUTPUT));
        assertEquals("COMPLETED", update.get(ResearchState.STATUS));
        verify(metrics).recordReportPersistence(false);
    }

    @Test
    @DisplayName("findFinalReport ignores results without a report")
    void findFinalReport() {
        assertEquals(Optional.empty(), FinalizeNode.findFinalReport(Map.of(0, TaskResult.error("x"))));
    }
}
