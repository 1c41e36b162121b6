package com.scoutmind.core.nodes;

import com.scoutmind.core.events.StepEventPublisher;
import com.scoutmind.core.model.PipelineStep;
import com.scoutmind.core.model.ResearchPlan;
import com.scoutmind.core.model.RunStatus;
import com.scoutmind.core.planner.PlannerService;
import com.scoutmind.core.progress.Progress;
import com.scoutmind.core.progress.ProgressReporter;
import com.scoutmind.core.state.ResearchState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * First graph step: plans the run and resets the task cursor.
 */
@Component
public class PlanResearchNode {

    private static final Logger log = LoggerFactory.getLogger(PlanResearchNode.class);

    private final PlannerService planner;
    private final ProgressReporter progressReporter;
    private final StepEventPublisher stepEvents;

    public PlanResearchNode(PlannerService planner,
                            ProgressReporter progressReporter,
                            StepEventPublisher stepEvents) {
        this.planner = planner;
        this.progressReporter = progressReporter;
        this.stepEvents = stepEvents;
    }

    public Map<String, Object> apply(ResearchState state) {
        log.info("Planning research for query: {}", state.query());
        ResearchPlan plan = planner.plan(state.query());

        var update = new HashMap<String, Object>();
        update.put(ResearchState.PLAN, plan);
        update.put(ResearchState.PLAN_SUMMARY, new HashMap<>(plan.summary()));
        update.put(ResearchState.CURRENT_TASK_INDEX, 0);
        update.put(ResearchState.STATUS, plan.isEmpty() ? RunStatus.FINALIZING.name() : RunStatus.EXECUTING.name());
        update.put(ResearchState.MESSAGE, "Created research plan with " + plan.size() + " tasks");

        Progress progress = progressReporter.afterPlanning(plan.size(), plan.intent());
        stepEvents.publish(state, PipelineStep.PLANNER, update, progress, null,
                Map.of("total_tasks", plan.size()));
        log.info("Plan created: {} with {} tasks", plan.intent(), plan.size());
        return update;
    }
}
