package com.scoutmind.core.nodes;

import com.scoutmind.core.events.StepEventPublisher;
import com.scoutmind.core.metrics.ScoutmindMetrics;
import com.scoutmind.core.model.PipelineStep;
import com.scoutmind.core.model.RunStatus;
import com.scoutmind.core.model.TaskResult;
import com.scoutmind.core.persistence.ReportStore;
import com.scoutmind.core.progress.Progress;
import com.scoutmind.core.progress.ProgressReporter;
import com.scoutmind.core.state.ResearchState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Last graph step: picks the final report and stores it.
 * <p>
 * The first non-null {@code final_report} in index order wins. When no task
 * produced one, a short markdown note listing the task errors is written
 * instead and nothing is stored.
 */
@Component
public class FinalizeNode {

    private static final Logger log = LoggerFactory.getLogger(FinalizeNode.class);

    private final ReportStore reportStore;
    private final ProgressReporter progressReporter;
    private final StepEventPublisher stepEvents;
    private final ScoutmindMetrics metrics;

    public FinalizeNode(ReportStore reportStore,
                        ProgressReporter progressReporter,
                        StepEventPublisher stepEvents,
                        ScoutmindMetrics metrics) {
        this.reportStore = reportStore;
        this.progressReporter = progressReporter;
        this.stepEvents = stepEvents;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(ResearchState state) {
        Map<Integer, TaskResult> results = state.taskResults();
        Optional<String> report = findFinalReport(results);

        String output;
        if (report.isPresent()) {
            output = report.get();
            save(state, output);
        } else {
            log.warn("No final report produced by {} task(s)", results.size());
            output = incompleteReport(state.query(), results);
        }

        var update = new HashMap<String, Object>();
        update.put(ResearchState.FINAL_OUTPUT, output);
        update.put(ResearchState.STATUS, RunStatus.COMPLETED.name());
        update.put(ResearchState.MESSAGE, report.isPresent()
                ? "Research completed" : "Research completed without a final report");

        Progress progress = progressReporter.atFinalize(state.totalTasks());
        stepEvents.publish(state, PipelineStep.FINALIZE, update, progress, null,
                Map.of("total_tasks", state.totalTasks(), "report_found", report.isPresent()));
        return update;
    }

    static Optional<String> findFinalReport(Map<Integer, TaskResult> results) {
        return results.values().stream()
                .map(TaskResult::finalReport)
                .flatMap(Optional::stream)
                .findFirst();
    }

    static String incompleteReport(String query, Map<Integer, TaskResult> results) {
        StringBuilder sb = new StringBuilder("# Research Incomplete\n\n");
        sb.append("**Query:** ").append(query).append("\n\n");
        sb.append("No final report was generated.");
        boolean anyErrors = false;
        for (Map.Entry<Integer, TaskResult> entry : results.entrySet()) {
            Optional<String> error = entry.getValue().error();
            if (error.isPresent()) {
                if (!anyErrors) {
                    sb.append("\n\n**Task errors:**\n");
                    anyErrors = true;
                }
                sb.append("\n- Task ").append(entry.getKey()).append(": ").append(error.get());
            }
        }
        if (!anyErrors) {
            sb.append(" No task reported an error.");
        }
        return sb.append('\n').toString();
    }

    private void save(ResearchState state, String report) {
        try {
            reportStore.save(state.runId(), state.query(), report);
            metrics.recordReportPersistence(true);
            log.info("Report saved for run {}", state.runId());
        } catch (Exception e) {
            metrics.recordReportPersistence(false);
            log.warn("Failed to save report for run {}: {}", state.runId(), e.getMessage());
        }
    }
}
