package com.scoutmind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scoutmind.core.model.TaskResult;
import com.scoutmind.core.state.ResearchState;

import java.util.Map;

/**
 * JSON response describing a tracked research run.
 */
public record RunResponse(
    @JsonProperty("run_id") String runId,
    String status,
    String query,
    @JsonProperty("deep_research") boolean deepResearch,
    @JsonProperty("plan_summary") Map<String, Object> planSummary,
    @JsonProperty("current_task_index") int currentTaskIndex,
    @JsonProperty("total_tasks") int totalTasks,
    @JsonProperty("task_results") Map<Integer, TaskResult> taskResults,
    @JsonProperty("final_output") String finalOutput,
    String message
) {

    public static RunResponse from(ResearchState state) {
        return new RunResponse(
                state.runId(),
                state.status().name(),
                state.query(),
                state.deepResearch(),
                state.planSummary().orElse(null),
                state.currentTaskIndex(),
                state.totalTasks(),
                state.taskResults(),
                state.finalOutput().orElse(null),
                state.message());
    }
}
