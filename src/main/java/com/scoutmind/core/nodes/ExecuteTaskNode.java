package com.scoutmind.core.nodes;

import com.scoutmind.core.events.StepEventPublisher;
import com.scoutmind.core.logging.MdcContext;
import com.scoutmind.core.model.PipelineStep;
import com.scoutmind.core.model.ResearchPlan;
import com.scoutmind.core.model.ResearchTask;
import com.scoutmind.core.model.RunStatus;
import com.scoutmind.core.model.TaskResult;
import com.scoutmind.core.progress.Progress;
import com.scoutmind.core.progress.ProgressReporter;
import com.scoutmind.core.state.ResearchState;
import com.scoutmind.core.tasks.TaskInvocation;
import com.scoutmind.core.tasks.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs the task at {@code currentTaskIndex} and advances the cursor.
 * <p>
 * The cursor moves forward by exactly one on every pass whatever the task's
 * outcome, so a plan of N tasks always takes N passes. The result is written
 * under the task's index and is never replaced afterwards.
 */
@Component
public class ExecuteTaskNode {

    private static final Logger log = LoggerFactory.getLogger(ExecuteTaskNode.class);

    private final TaskRegistry registry;
    private final ProgressReporter progressReporter;
    private final StepEventPublisher stepEvents;

    public ExecuteTaskNode(TaskRegistry registry,
                           ProgressReporter progressReporter,
                           StepEventPublisher stepEvents) {
        this.registry = registry;
        this.progressReporter = progressReporter;
        this.stepEvents = stepEvents;
    }

    public Map<String, Object> apply(ResearchState state) {
        int index = state.currentTaskIndex();
        int total = state.totalTasks();
        ResearchTask task = state.currentTask().orElse(null);

        TaskResult result;
        if (task == null) {
            result = TaskResult.error("No task at index " + index);
        } else {
            MdcContext.setTask(state.runId(), index, task.action());
            log.info("Executing task {}/{}: {}", index + 1, total, task.action());
            try {
                result = registry.execute(invocationFor(state, index, task));
            } catch (Throwable t) {
                log.error("Task {} escaped the registry: {}", index, t.getMessage(), t);
                result = TaskResult.error(t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName());
            } finally {
                MdcContext.clearTask();
            }
        }
        if (result.isError()) {
            log.warn("Task {} failed: {}", index, result.error().orElse(""));
        }

        int next = index + 1;
        var update = new HashMap<String, Object>();
        update.put(ResearchState.TASK_RESULTS, ResearchState.resultEntry(index, result));
        update.put(ResearchState.CURRENT_TASK_INDEX, next);
        update.put(ResearchState.STATUS, next < total ? RunStatus.EXECUTING.name() : RunStatus.FINALIZING.name());
        update.put(ResearchState.MESSAGE, result.isError()
                ? "Task " + index + " failed: " + result.error().orElse("")
                : "Task " + index + " completed");

        Progress progress = progressReporter.afterTask(total, next, task);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("action", task != null && task.action() != null ? task.action() : "");
        metadata.put("task_index", index);
        metadata.put("total_tasks", total);
        metadata.put("outcome", result.isError() ? "error" : "ok");
        stepEvents.publish(state, PipelineStep.TASK_EXECUTOR, update, progress, index, metadata);
        return update;
    }

    private static TaskInvocation invocationFor(ResearchState state, int index, ResearchTask task) {
        ResearchPlan plan = state.plan().orElse(null);
        return new TaskInvocation(state.runId(), index, task, state.query(), state.deepResearch(),
                plan, state.taskResults());
    }
}
