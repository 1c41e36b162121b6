package com.scoutmind.core.graph;

import com.scoutmind.core.engine.CancellationRegistry;
import com.scoutmind.core.engine.ResearchProperties;
import com.scoutmind.core.nodes.CancelledNode;
import com.scoutmind.core.nodes.ExecuteTaskNode;
import com.scoutmind.core.nodes.FinalizeNode;
import com.scoutmind.core.nodes.PlanResearchNode;
import com.scoutmind.core.state.ResearchState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that drives a
 * research run.
 * <pre>
 *   START -> planner -> [routeAfterPlan]
 *            -> task_executor -> [routeAfterTask]
 *               -> task_executor (one pass per task)
 *               -> finalize -> END
 *               -> cancelled -> END
 *            -> finalize -> END   (empty plan)
 *            -> cancelled -> END
 * </pre>
 * Routing reads only {@code currentTaskIndex}, the plan size and the
 * cancellation flag.
 */
@Component
public class ResearchGraph {

    private static final Logger log = LoggerFactory.getLogger(ResearchGraph.class);

    static final String PLANNER = "planner";
    static final String TASK_EXECUTOR = "task_executor";
    static final String FINALIZE = "finalize";
    static final String CANCELLED = "cancelled";

    private final CompiledGraph<ResearchState> compiledGraph;
    private final CancellationRegistry cancellations;

    public ResearchGraph(
            PlanResearchNode planNode,
            ExecuteTaskNode executeNode,
            FinalizeNode finalizeNode,
            CancelledNode cancelledNode,
            CancellationRegistry cancellations,
            ResearchProperties properties,
            @Autowired(required = false) BaseCheckpointSaver checkpointSaver) throws Exception {
        this.cancellations = cancellations;

        var graph = new StateGraph<>(ResearchState.SCHEMA, ResearchState::new)
                .addNode(PLANNER, node_async(planNode::apply))
                .addNode(TASK_EXECUTOR, node_async(executeNode::apply))
                .addNode(FINALIZE, node_async(finalizeNode::apply))
                .addNode(CANCELLED, node_async(cancelledNode::apply))
                .addEdge(START, PLANNER)
                .addConditionalEdges(PLANNER,
                        edge_async(this::routeAfterPlan),
                        Map.of(TASK_EXECUTOR, TASK_EXECUTOR,
                                FINALIZE, FINALIZE,
                                CANCELLED, CANCELLED))
                .addConditionalEdges(TASK_EXECUTOR,
                        edge_async(this::routeAfterTask),
                        Map.of(TASK_EXECUTOR, TASK_EXECUTOR,
                                FINALIZE, FINALIZE,
                                CANCELLED, CANCELLED))
                .addEdge(FINALIZE, END)
                .addEdge(CANCELLED, END);

        var configBuilder = CompileConfig.builder();
        if (checkpointSaver != null) {
            configBuilder.checkpointSaver(checkpointSaver);
            log.info("Graph compiled with checkpoint saver: {}", checkpointSaver.getClass().getSimpleName());
        } else {
            log.info("Graph compiled without checkpoint saver (live state is not queryable)");
        }
        this.compiledGraph = graph.compile(configBuilder.build());
        // one iteration per node visit: planner, N tasks, then finalize or cancelled
        this.compiledGraph.setMaxIterations(properties.getRecursionLimit());
    }

    /**
     * Starts executing when the plan has tasks, otherwise goes straight to
     * finalization.
     */
    String routeAfterPlan(ResearchState state) {
        if (cancellations.isCancelled(state.runId())) {
            return CANCELLED;
        }
        return state.hasRemainingTasks() ? TASK_EXECUTOR : FINALIZE;
    }

    /**
     * Loops while {@code currentTaskIndex < tasks.size()}.
     */
    String routeAfterTask(ResearchState state) {
        if (cancellations.isCancelled(state.runId())) {
            return CANCELLED;
        }
        return state.hasRemainingTasks() ? TASK_EXECUTOR : FINALIZE;
    }

    public CompiledGraph<ResearchState> getCompiledGraph() {
        return compiledGraph;
    }
}
