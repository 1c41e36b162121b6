package com.scoutmind.core.planner;

import com.scoutmind.core.llm.LlmProperties;
import com.scoutmind.core.llm.LlmParseException;
import com.scoutmind.core.llm.LlmService;
import com.scoutmind.core.metrics.ScoutmindMetrics;
import com.scoutmind.core.model.ResearchPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Turns a user query into a {@link ResearchPlan} by calling the LLM with a
 * planning prompt and worked examples.
 * <p>
 * Planning never fails a run: without an API key, on any LLM error, and when
 * the model returns no tasks, the plan from {@link FallbackPlanFactory} is used
 * instead. Structural problems in a returned plan are logged but the plan is
 * executed as written.
 */
@Service
public class PlannerService {

    private static final Logger log = LoggerFactory.getLogger(PlannerService.class);

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.ENGLISH);

    static final String SYSTEM_PROMPT = """
            You are an expert research planner for e-commerce product analysis.
            Your job is to analyze user queries and create structured research plans.

            Available actions:
            - "search": Search the web for product information (requires 'query')
            - "scrape": Scrape a product page (requires 'from_task' reference or URL in query)
            - "summarize": Generate product summary (requires 'from_task' with product data)
            - "sentiment": Analyze product sentiment (requires 'from_task' with product data)
            - "compare": Compare multiple products (requires 'from_task' with multiple products)
            - "final_report": Synthesize all results into final report (always last)

            Rules:
            1. If the query contains a URL, start with "scrape"
            2. If there is no URL, start with "search" then generate MULTIPLE "scrape" tasks for top results
            3. For "scrape" tasks following a "search", use 'url_index' to target different results (0, 1, 2)
            4. Always include "final_report" as the last task
            5. Use "from_task" to reference previous task outputs (e.g. "task:0", "task:1");
               a task may only reference tasks that come before it
            6. For comparison, ensure multiple products are scraped first and list them
               comma-separated (e.g. "task:1,task:3")

            Examples:

            Query: "Apple AirPods 4"
            {
              "intent": "product_research",
              "reasoning": "Search, scrape the top 3 products, then summarize and analyze sentiment for each.",
              "tasks": [
                {"action": "search", "query": "Apple AirPods 4 product page"},
                {"action": "scrape", "from_task": "task:0", "url_index": 0},
                {"action": "summarize", "from_task": "task:1"},
                {"action": "sentiment", "from_task": "task:1"},
                {"action": "scrape", "from_task": "task:0", "url_index": 1},
                {"action": "summarize", "from_task": "task:4"},
                {"action": "sentiment", "from_task": "task:4"},
                {"action": "scrape", "from_task": "task:0", "url_index": 2},
                {"action": "summarize", "from_task": "task:7"},
                {"action": "sentiment", "from_task": "task:7"},
                {"action": "final_report"}
              ]
            }

            Query: "Compare Apple AirPods 4 vs Samsung Galaxy Buds"
            {
              "intent": "product_comparison",
              "tasks": [
                {"action": "search", "query": "Apple AirPods 4"},
                {"action": "scrape", "from_task": "task:0", "url_index": 0},
                {"action": "search", "query": "Samsung Galaxy Buds"},
                {"action": "scrape", "from_task": "task:2", "url_index": 0},
                {"action": "compare", "from_task": "task:1,task:3"},
                {"action": "final_report"}
              ]
            }

            Query: "https://www.amazon.com/dp/B0D1XD1ZV3"
            {
              "intent": "product_analysis",
              "tasks": [
                {"action": "scrape", "query": "https://www.amazon.com/dp/B0D1XD1ZV3"},
                {"action": "summarize", "from_task": "task:0"},
                {"action": "sentiment", "from_task": "task:0"},
                {"action": "final_report"}
              ]
            }
            """;

    private final LlmService llmService;
    private final LlmProperties llmProperties;
    private final ScoutmindMetrics metrics;

    public PlannerService(LlmService llmService, LlmProperties llmProperties, ScoutmindMetrics metrics) {
        this.llmService = llmService;
        this.llmProperties = llmProperties;
        this.metrics = metrics;
    }

    /**
     * Plans research for {@code query}. Never returns {@code null}.
     */
    public ResearchPlan plan(String query) {
        if (!llmProperties.hasApiKey()) {
            log.info("No LLM API key configured, using fallback plan");
            return fallback(query, "no_api_key");
        }

        long start = System.currentTimeMillis();
        try {
            ResearchPlan plan = llmService.structuredCall(
                    SYSTEM_PROMPT, buildUserPrompt(query), ResearchPlan.class, llmProperties.plannerOptions());
            metrics.recordPlanningDuration(System.currentTimeMillis() - start);
            if (plan == null || plan.isEmpty()) {
                log.warn("Planner returned no tasks, using fallback plan");
                return fallback(query, "empty_plan");
            }
            List<String> warnings = PlanValidator.warnings(plan);
            warnings.forEach(w -> log.warn("Plan check: {}", w));
            log.info("Created plan with {} tasks for intent: {}", plan.size(), plan.intent());
            metrics.recordPlanSize(plan.size());
            return plan;
        } catch (LlmParseException e) {
            log.warn("Planner answer was not a plan, using fallback plan. Answer began: {}", e.getExcerpt());
            return fallback(query, "error");
        } catch (Exception e) {
            log.warn("Planning failed, using fallback plan: {}", e.getMessage());
            return fallback(query, "error");
        }
    }

    private ResearchPlan fallback(String query, String reason) {
        ResearchPlan plan = FallbackPlanFactory.create(query);
        metrics.recordPlanFallback(reason);
        metrics.recordPlanSize(plan.size());
        return plan;
    }

    private static String buildUserPrompt(String query) {
        return """
                Current Date: %s

                Create a research plan for this query:

                Query: %s
                """.formatted(LocalDate.now().format(DATE_FORMAT), query);
    }
}
