package com.scoutmind.core.state;

import com.scoutmind.core.model.ResearchPlan;
import com.scoutmind.core.model.ResearchTask;
import com.scoutmind.core.model.RunStatus;
import com.scoutmind.core.model.TaskResult;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Graph state for one research run.
 * <p>
 * {@code currentTaskIndex} is the only field that drives control flow. Task
 * results live in an integer-keyed map whose channel only ever adds keys: a
 * result written for index {@code i} is never replaced, so later tasks always
 * observe the value originally written. The channel keeps the index as a
 * decimal string because the checkpoint serializer only accepts string map
 * keys; {@link #taskResults()} hands it back keyed by integer. {@code status}
 * and {@code message} are display fields and are overwritten on every
 * transition.
 */
public class ResearchState extends AgentState {

    public static final String RUN_ID = "runId";
    public static final String QUERY = "query";
    public static final String DEEP_RESEARCH = "deepResearch";
    public static final String PLAN = "plan";
    public static final String PLAN_SUMMARY = "planSummary";
    public static final String TASK_RESULTS = "taskResults";
    public static final String CURRENT_TASK_INDEX = "currentTaskIndex";
    public static final String FINAL_OUTPUT = "finalOutput";
    public static final String STATUS = "status";
    public static final String MESSAGE = "message";

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        Map.entry(RUN_ID,             Channels.base(() -> "")),
        Map.entry(QUERY,              Channels.base(() -> "")),
        Map.entry(DEEP_RESEARCH,      Channels.base(() -> false)),
        Map.entry(PLAN,               Channels.base((Reducer<ResearchPlan>) null)),
        Map.entry(PLAN_SUMMARY,       Channels.base((Reducer<Map<String, Object>>) null)),
        Map.entry(TASK_RESULTS,       Channels.base((Reducer<Map<String, TaskResult>>) ResearchState::appendResults, HashMap::new)),
        Map.entry(CURRENT_TASK_INDEX, Channels.base(() -> 0)),
        Map.entry(FINAL_OUTPUT,       Channels.base((Reducer<String>) null)),
        Map.entry(STATUS,             Channels.base(() -> RunStatus.PLANNING.name())),
        Map.entry(MESSAGE,            Channels.base(() -> ""))
    );

    public ResearchState(Map<String, Object> initData) {
        super(initData);
    }

    /**
     * Reducer for the task-result channel: keys already present keep their
     * original value.
     */
    static Map<String, TaskResult> appendResults(Map<String, TaskResult> existing,
                                                 Map<String, TaskResult> update) {
        var merged = new HashMap<String, TaskResult>();
        if (existing != null) {
            merged.putAll(existing);
        }
        if (update != null) {
            update.forEach(merged::putIfAbsent);
        }
        return merged;
    }

    /**
     * Channel update that records {@code result} under task {@code index}.
     */
    public static Map<String, TaskResult> resultEntry(int index, TaskResult result) {
        var entry = new HashMap<String, TaskResult>();
        entry.put(Integer.toString(index), result);
        return entry;
    }

    // ── Scalar accessors ─────────────────────────────────────────────

    public String runId() {
        return this.<String>value(RUN_ID).orElse("");
    }

    public String query() {
        return this.<String>value(QUERY).orElse("");
    }

    public boolean deepResearch() {
        return this.<Boolean>value(DEEP_RESEARCH).orElse(false);
    }

    public Optional<ResearchPlan> plan() {
        return this.<ResearchPlan>value(PLAN);
    }

    public Optional<Map<String, Object>> planSummary() {
        return this.<Map<String, Object>>value(PLAN_SUMMARY);
    }

    public int totalTasks() {
        return plan().map(ResearchPlan::size).orElse(0);
    }

    public int currentTaskIndex() {
        return this.<Integer>value(CURRENT_TASK_INDEX).orElse(0);
    }

    /**
     * The task at {@link #currentTaskIndex()}, or empty once the plan is exhausted.
     */
    public Optional<ResearchTask> currentTask() {
        int index = currentTaskIndex();
        return plan()
                .filter(p -> index >= 0 && index < p.size())
                .map(p -> p.tasks().get(index));
    }

    public boolean hasRemainingTasks() {
        return currentTaskIndex() < totalTasks();
    }

    public Optional<String> finalOutput() {
        return this.<String>value(FINAL_OUTPUT);
    }

    public RunStatus status() {
        String raw = this.<String>value(STATUS).orElse(RunStatus.PLANNING.name());
        return RunStatus.valueOf(raw);
    }

    public String message() {
        return this.<String>value(MESSAGE).orElse("");
    }

    // ── Task results ─────────────────────────────────────────────────

    /**
     * Read-only view of the results written so far, ordered by task index.
     */
    public Map<Integer, TaskResult> taskResults() {
        return byIndex(this.<Map<String, TaskResult>>value(TASK_RESULTS).orElse(Map.of()));
    }

    public Optional<TaskResult> result(int index) {
        return Optional.ofNullable(taskResults().get(index));
    }

    // ── Snapshots ────────────────────────────────────────────────────

    /**
     * Wire-form snapshot of this state, for streaming and status responses.
     */
    public Map<String, Object> snapshot() {
        return snapshotWith(Map.of());
    }

    /**
     * Wire-form snapshot of the state a node update will produce, computed
     * before the graph applies it. Task results follow the same add-only rule as
     * the channel.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> snapshotWith(Map<String, Object> update) {
        var merged = new HashMap<String, Object>(data());
        update.forEach((key, value) -> {
            if (TASK_RESULTS.equals(key)) {
                merged.put(key, appendResults(this.<Map<String, TaskResult>>value(TASK_RESULTS).orElse(null),
                        (Map<String, TaskResult>) value));
            } else {
                merged.put(key, value);
            }
        });
        var view = new ResearchState(merged);

        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("run_id", view.runId());
        snapshot.put("query", view.query());
        snapshot.put("deep_research", view.deepResearch());
        snapshot.put("plan", view.plan().orElse(null));
        snapshot.put("plan_summary", view.planSummary().orElse(null));
        snapshot.put("task_results", view.taskResults());
        snapshot.put("current_task_index", view.currentTaskIndex());
        snapshot.put("final_output", view.finalOutput().orElse(null));
        snapshot.put("status", view.status().name());
        snapshot.put("message", view.message());
        return snapshot;
    }

    private static Map<Integer, TaskResult> byIndex(Map<String, TaskResult> raw) {
        var ordered = new TreeMap<Integer, TaskResult>();
        raw.forEach((key, result) -> ordered.put(Integer.valueOf(key), result));
        return Collections.unmodifiableMap(ordered);
    }
}
