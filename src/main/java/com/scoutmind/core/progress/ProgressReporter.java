package com.scoutmind.core.progress;

import com.scoutmind.core.model.ActionType;
import com.scoutmind.core.model.ResearchTask;
import org.springframework.stereotype.Component;

/**
 * Derives a completion percentage and a description for each graph step.
 * <p>
 * Total steps are the task count plus two (planning and finalizing). After
 * planning one step is complete, after a task {@code 1 + currentTaskIndex}
 * steps are, and at finalization {@code tasks + 1} are. Percentages are integer
 * and capped at 100; the terminal event reports 100 through {@link #completed}.
 * Nothing here feeds back into control flow.
 */
@Component
public class ProgressReporter {

    public Progress afterPlanning(int totalTasks, String intent) {
        int total = totalSteps(totalTasks);
        String description = "Planned " + totalTasks + " task" + (totalTasks == 1 ? "" : "s")
                + (intent != null && !intent.isBlank() ? " for " + intent : "");
        return new Progress(percent(1, total), 1, total, description);
    }

    /**
     * @param totalTasks       tasks in the plan
     * @param currentTaskIndex index after the increment, i.e. the number of tasks attempted
     * @param task             the task that was just attempted, may be {@code null}
     */
    public Progress afterTask(int totalTasks, int currentTaskIndex, ResearchTask task) {
        int total = totalSteps(totalTasks);
        int completed = Math.min(1 + currentTaskIndex, total);
        return new Progress(percent(completed, total), completed, total, describe(task));
    }

    public Progress atFinalize(int totalTasks) {
        int total = totalSteps(totalTasks);
        int completed = totalTasks + 1;
        return new Progress(percent(completed, total), completed, total, "Finalizing research report");
    }

    public Progress completed(int totalTasks) {
        int total = totalSteps(totalTasks);
        return new Progress(100, total, total, "Research complete");
    }

    /**
     * Human-readable description of a task. A planner-supplied description wins;
     * otherwise a per-action template is filled from the task's query or
     * reference, and tasks with neither get a generic line.
     */
    public String describe(ResearchTask task) {
        if (task == null) {
            return "Running task...";
        }
        if (task.hasDescription()) {
            return task.description();
        }
        String subject = task.hasQuery() ? task.query() : task.fromTask();
        ActionType type = task.actionType().orElse(null);
        if (type == ActionType.FINAL_REPORT) {
            return "Generating final research report";
        }
        if (type == null || subject == null || subject.isBlank()) {
            return "Running " + task.action() + " task...";
        }
        return switch (type) {
            case SEARCH -> "Searching for: " + subject;
            case SCRAPE -> "Scraping product page: " + subject;
            case SUMMARIZE -> "Summarizing product data from " + subject;
            case SENTIMENT -> "Analyzing sentiment from " + subject;
            case COMPARE -> "Comparing products from " + subject;
            case FINAL_REPORT -> "Generating final research report";
        };
    }

    static int totalSteps(int totalTasks) {
        return Math.max(0, totalTasks) + 2;
    }

    static int percent(int completed, int total) {
        if (total <= 0) {
            return 0;
        }
        return Math.min(100, 100 * completed / total);
    }
}
