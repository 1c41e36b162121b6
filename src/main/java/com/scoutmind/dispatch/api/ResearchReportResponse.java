package com.scoutmind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scoutmind.core.model.ProductData;
import com.scoutmind.core.model.ResearchPlan;
import com.scoutmind.core.model.SentimentAnalysis;
import com.scoutmind.core.model.TaskResult;
import com.scoutmind.core.state.ResearchState;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Full result of a synchronous research run.
 * <p>
 * {@code url}, {@code product_data}, {@code summary}, {@code sentiment} and
 * {@code comparison} repeat the first value of each found in the task results,
 * in task order, for clients that predate {@code task_results}.
 */
public record ResearchReportResponse(
    @JsonProperty("run_id") String runId,
    String query,
    ResearchPlan plan,
    @JsonProperty("task_results") Map<Integer, TaskResult> taskResults,
    @JsonProperty("final_report") String finalReport,
    String error,
    String url,
    @JsonProperty("product_data") ProductData productData,
    String summary,
    SentimentAnalysis sentiment,
    String comparison
) {

    public static ResearchReportResponse from(ResearchState state) {
        Map<Integer, TaskResult> results = state.taskResults();
        return new ResearchReportResponse(
                state.runId(),
                state.query(),
                state.plan().orElse(null),
                results,
                state.finalOutput().orElse(null),
                null,
                firstOf(results, TaskResult::url),
                firstOf(results, TaskResult::productData),
                firstOf(results, TaskResult::summary),
                firstOf(results, TaskResult::sentiment),
                firstOf(results, TaskResult::comparison));
    }

    public static ResearchReportResponse failed(String runId, String query, String error) {
        return new ResearchReportResponse(runId, query, null, Map.of(), null, error,
                null, null, null, null, null);
    }

    private static <T> T firstOf(Map<Integer, TaskResult> results, Function<TaskResult, Optional<T>> accessor) {
        return results.values().stream()
                .map(accessor)
                .flatMap(Optional::stream)
                .findFirst()
                .orElse(null);
    }
}
