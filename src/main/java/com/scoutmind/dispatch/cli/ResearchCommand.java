package com.scoutmind.dispatch.cli;

import com.scoutmind.core.engine.ResearchEngine;
import com.scoutmind.core.events.EventBus;
import com.scoutmind.core.events.ResearchEvent;
import com.scoutmind.core.model.RunStatus;
import com.scoutmind.core.progress.Progress;
import com.scoutmind.core.state.ResearchState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: scoutmind research "&lt;query&gt;"
 * <p>
 * Runs a query through the research graph in the foreground, printing one
 * progress line per completed step, then prints the final markdown report.
 * Exits with 1 when the run fails or is cancelled.
 */
@Command(name = "research", mixinStandardHelpOptions = true, description = "Research a product query")
@Component
public class ResearchCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Product question, optionally containing a product URL")
    private String query;

    @Option(names = {"--deep", "-d"}, description = "Use the deep-research model with larger token budgets")
    private boolean deep;

    @Option(names = {"--output", "-o"}, description = "Also write the final report to this markdown file")
    private Path output;

    private final ResearchEngine researchEngine;
    private final EventBus eventBus;

    public ResearchCommand(ResearchEngine researchEngine, EventBus eventBus) {
        this.researchEngine = researchEngine;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (query == null || query.isBlank()) {
            ConsoleOutput.error("Query is required");
            return 2;
        }

        String runId = researchEngine.newRunId();
        ConsoleOutput.info("Run " + runId + (deep ? " (deep research)" : ""));
        ConsoleOutput.info("Planning research for: " + query);

        long start = System.currentTimeMillis();
        EventBus.Subscription subscription = eventBus.subscribe(runId, ResearchCommand::printEvent);
        ResearchState finalState;
        try {
            finalState = researchEngine.runResearch(runId, query, deep);
        } catch (Exception e) {
            ConsoleOutput.error("Research failed: " + rootCauseMessage(e));
            return 1;
        } finally {
            subscription.unsubscribe();
        }

        System.out.println();
        if (finalState.status() == RunStatus.CANCELLED) {
            ConsoleOutput.warn("Research cancelled.");
            return 1;
        }

        String report = finalState.finalOutput().orElse("");
        ConsoleOutput.report(report);
        if (output != null) {
            try {
                Files.writeString(output, report, StandardCharsets.UTF_8);
                ConsoleOutput.success("Report written to " + output);
            } catch (IOException e) {
                ConsoleOutput.error("Could not write report to " + output + ": " + e.getMessage());
                return 1;
            }
        }
        ConsoleOutput.duration(System.currentTimeMillis() - start);
        ConsoleOutput.success("Research complete.");
        return 0;
    }

    static void printEvent(ResearchEvent event) {
        if (!ResearchEvent.STEP.equals(event.eventType())) {
            return;
        }
        Map<String, Object> payload = event.payload();
        if (event.taskIndex() != null && payload.get("metadata") instanceof Map<?, ?> metadata
                && metadata.get("outcome") != null) {
            Object action = metadata.get("action");
            ConsoleOutput.task(event.taskIndex(), action != null ? action.toString() : "",
                    metadata.get("outcome").toString());
        }
        int percent = payload.get("progress") instanceof Number n ? n.intValue() : 0;
        int completed = payload.get("completed_steps") instanceof Number n ? n.intValue() : 0;
        int total = payload.get("total_steps") instanceof Number n ? n.intValue() : 0;
        Object description = payload.get("description");
        ConsoleOutput.progress(new Progress(percent, completed, total,
                description != null ? description.toString() : ""));
    }

    private static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
