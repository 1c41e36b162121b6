package com.scoutmind.core.state;

import com.scoutmind.core.model.ActionType;
import com.scoutmind.core.model.ProductData;
import com.scoutmind.core.model.ResearchPlan;
import com.scoutmind.core.model.ResearchTask;
import com.scoutmind.core.model.ResultKeys;
import com.scoutmind.core.model.RunStatus;
import com.scoutmind.core.model.SearchHit;
import com.scoutmind.core.model.TaskResult;
import org.bsc.langgraph4j.serializer.std.ObjectStreamStateSerializer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResearchStateTest {

    private static ResearchPlan twoTaskPlan() {
        return new ResearchPlan("product_research", List.of(
                ResearchTask.of(ActionType.SEARCH, "q"),
                ResearchTask.of(ActionType.FINAL_REPORT, null)), null);
    }

    @Test
    @DisplayName("defaults when fields are absent")
    void defaults() {
        var state = new ResearchState(Map.of());

        assertEquals("", state.runId());
        assertEquals(0, state.currentTaskIndex());
        assertEquals(0, state.totalTasks());
        assertFalse(state.hasRemainingTasks());
        assertEquals(RunStatus.PLANNING, state.status());
        assertTrue(state.taskResults().isEmpty());
        assertTrue(state.currentTask().isEmpty());
    }

    @Test
    @DisplayName("current task follows the cursor until the plan is exhausted")
    void currentTask() {
        var plan = twoTaskPlan();
        assertEquals("search", new ResearchState(Map.of(ResearchState.PLAN, plan)).currentTask().orElseThrow().action());
        var done = new ResearchState(Map.of(ResearchState.PLAN, plan, ResearchState.CURRENT_TASK_INDEX, 2));
        assertTrue(done.currentTask().isEmpty());
        assertFalse(done.hasRemainingTasks());
    }

    @Test
    @DisplayName("result reducer never replaces a key already written")
    void reducerIsAddOnly() {
        Map<String, TaskResult> existing = Map.of("0", TaskResult.error("first"));
        Map<String, TaskResult> update = Map.of("0", TaskResult.error("second"), "1", TaskResult.error("other"));

        Map<String, TaskResult> merged = ResearchState.appendResults(existing, update);

        assertEquals("first", merged.get("0").error().orElseThrow());
        assertEquals("other", merged.get("1").error().orElseThrow());
        assertEquals(2, merged.size());
    }

    @Test
    @DisplayName("reducer tolerates null sides")
    void reducerNulls() {
        assertTrue(ResearchState.appendResults(null, null).isEmpty());
        assertEquals(1, ResearchState.appendResults(null, ResearchState.resultEntry(3, TaskResult.empty())).size());
    }

    @Test
    @DisplayName("task results are ordered by index")
    void resultsOrdered() {
        var results = new HashMap<String, TaskResult>();
        results.putAll(ResearchState.resultEntry(10, TaskResult.error("ten")));
        results.putAll(ResearchState.resultEntry(2, TaskResult.error("two")));
        var state = new ResearchState(Map.of(ResearchState.TASK_RESULTS, results));

        assertEquals(List.of(2, 10), List.copyOf(state.taskResults().keySet()));
    }

    @Test
    @DisplayName("snapshotWith previews an update without losing earlier results")
    void snapshotWith() {
        var state = new ResearchState(Map.of(
                ResearchState.RUN_ID, "run-1",
                ResearchState.QUERY, "headphones",
                ResearchState.PLAN, twoTaskPlan(),
                ResearchState.TASK_RESULTS, ResearchState.resultEntry(0, TaskResult.error("kept"))));

        Map<String, Object> snapshot = state.snapshotWith(Map.of(
                ResearchState.TASK_RESULTS, Map.of("0", TaskResult.error("ignored"), "1", TaskResult.error("new")),
                ResearchState.CURRENT_TASK_INDEX, 2,
                ResearchState.STATUS, RunStatus.FINALIZING.name()));

        assertEquals("run-1", snapshot.get("run_id"));
        assertEquals(2, snapshot.get("current_task_index"));
        assertEquals("FINALIZING", snapshot.get("status"));
        @SuppressWarnings("unchecked")
        var results = (Map<Integer, TaskResult>) snapshot.get("task_results");
        assertEquals("kept", results.get(0).error().orElseThrow());
        assertEquals("new", results.get(1).error().orElseThrow());
        assertEquals(0, state.currentTaskIndex(), "original state is untouched");
    }

    @Test
    @DisplayName("state with task results survives the graph's object-stream clone")
    void resultsSurviveStateClone() throws Exception {
        var product = new ProductData("https://a", "Widget", "$10", 4.5, 12,
                List.of("light"), null, null, null, null, List.of());
        var results = new HashMap<String, TaskResult>();
        results.putAll(ResearchState.resultEntry(0, TaskResult.builder()
                .put(ResultKeys.PRODUCT_URLS, List.of("http://a", "http://b"))
                .put(ResultKeys.SEARCH_RESULTS, List.of(new SearchHit("A", "http://a", "text", 0.9)))
                .build()));
        results.putAll(ResearchState.resultEntry(1, TaskResult.builder()
                .put(ResultKeys.PRODUCT_DATA, product)
                .put(ResultKeys.URL, "http://a")
                .build()));
        var data = new HashMap<String, Object>();
        data.put(ResearchState.RUN_ID, "run-1");
        data.put(ResearchState.PLAN, twoTaskPlan());
        data.put(ResearchState.PLAN_SUMMARY, new HashMap<>(twoTaskPlan().summary()));
        data.put(ResearchState.TASK_RESULTS, results);
        data.put(ResearchState.CURRENT_TASK_INDEX, 2);

        ObjectStreamStateSerializer<ResearchState> serializer = new ObjectStreamStateSerializer<>(ResearchState::new);
        ResearchState copy = serializer.cloneObject(new ResearchState(data));

        assertEquals(List.of(0, 1), List.copyOf(copy.taskResults().keySet()));
        assertEquals(List.of("http://a", "http://b"), copy.result(0).orElseThrow().productUrls());
        assertEquals(product, copy.result(1).orElseThrow().productData().orElseThrow());
        assertEquals(2, copy.currentTaskIndex());
        assertEquals(2, copy.totalTasks());
    }
}
