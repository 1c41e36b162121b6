package com.scoutmind.core.planner;

import com.scoutmind.core.model.ActionType;
import com.scoutmind.core.model.ResearchPlan;
import com.scoutmind.core.model.ResearchTask;
import com.scoutmind.core.scrape.TextExtractors;

import java.util.List;

/**
 * Builds the deterministic plan used when the planner LLM is unavailable.
 */
public final class FallbackPlanFactory {

    public static final String REASONING = "Fallback plan (LLM unavailable)";
    public static final String INTENT_ANALYSIS = "product_analysis";
    public static final String INTENT_RESEARCH = "product_research";

    private FallbackPlanFactory() {}

    /**
     * A query carrying a URL is scraped directly; anything else is searched
     * first and the top hit scraped.
     */
    public static ResearchPlan create(String query) {
        if (TextExtractors.containsUrl(query)) {
            return new ResearchPlan(INTENT_ANALYSIS, List.of(
                    ResearchTask.of(ActionType.SCRAPE, query),
                    ResearchTask.following(ActionType.SUMMARIZE, "task:0"),
                    ResearchTask.following(ActionType.SENTIMENT, "task:0"),
                    ResearchTask.of(ActionType.FINAL_REPORT, null)
            ), REASONING);
        }
        return new ResearchPlan(INTENT_RESEARCH, List.of(
                ResearchTask.of(ActionType.SEARCH, query),
                ResearchTask.following(ActionType.SCRAPE, "task:0"),
                ResearchTask.following(ActionType.SUMMARIZE, "task:1"),
                ResearchTask.following(ActionType.SENTIMENT, "task:1"),
                ResearchTask.of(ActionType.FINAL_REPORT, null)
        ), REASONING);
    }
}
