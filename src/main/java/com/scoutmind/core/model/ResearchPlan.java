package com.scoutmind.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered task list produced by the planner. Task order is the execution order.
 *
 * @param intent    classification of the user's goal (e.g. product_research, product_comparison)
 * @param tasks     tasks in execution order
 * @param reasoning planner's explanation, diagnostic only
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResearchPlan(
    String intent,
    List<ResearchTask> tasks,
    String reasoning
) implements Serializable {

    public ResearchPlan {
        tasks = tasks == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(tasks.stream().filter(Objects::nonNull).toList()));
    }

    public int size() {
        return tasks.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return tasks.isEmpty();
    }

    /**
     * Display summary: intent, total task count and the action names in order.
     */
    public Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("intent", intent);
        summary.put("total_tasks", tasks.size());
        summary.put("task_types", tasks.stream().map(ResearchTask::action).toList());
        return summary;
    }
}
