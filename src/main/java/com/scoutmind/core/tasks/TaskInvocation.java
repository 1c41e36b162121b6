package com.scoutmind.core.tasks;

import com.scoutmind.core.model.ResearchPlan;
import com.scoutmind.core.model.ResearchTask;
import com.scoutmind.core.model.TaskResult;

import java.util.Map;

/**
 * Everything a handler may read while executing one task.
 *
 * @param runId        run identifier
 * @param taskIndex    index of {@code task} in the plan
 * @param task         the task being executed
 * @param query        the user's original query
 * @param deepResearch whether the run asked for deep research
 * @param plan         the full plan
 * @param priorResults read-only results of earlier tasks, keyed by index
 */
public record TaskInvocation(
    String runId,
    int taskIndex,
    ResearchTask task,
    String query,
    boolean deepResearch,
    ResearchPlan plan,
    Map<Integer, TaskResult> priorResults
) {

    public TaskInvocation {
        priorResults = priorResults == null ? Map.of() : Map.copyOf(priorResults);
    }

    /**
     * The task's own query, or the run query when the task has none.
     */
    public String effectiveQuery() {
        return task.hasQuery() ? task.query() : query;
    }

    public String intent() {
        return plan == null || plan.intent() == null ? "" : plan.intent();
    }
}
