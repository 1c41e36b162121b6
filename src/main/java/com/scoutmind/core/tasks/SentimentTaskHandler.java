package com.scoutmind.core.tasks;

import com.scoutmind.core.llm.LlmProperties;
import com.scoutmind.core.llm.LlmService;
import com.scoutmind.core.model.ActionType;
import com.scoutmind.core.model.ProductData;
import com.scoutmind.core.model.ResultKeys;
import com.scoutmind.core.model.SentimentAnalysis;
import com.scoutmind.core.model.TaskResult;
import com.scoutmind.core.resolve.ReferenceResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Estimates customer sentiment for one scraped product.
 */
@Component
public class SentimentTaskHandler implements TaskHandler {

    private static final Logger log = LoggerFactory.getLogger(SentimentTaskHandler.class);

    private static final double TEMPERATURE = 0.5;

    static final String SYSTEM_PROMPT = """
            You are a sentiment analysis expert. Analyze product reviews and data to
            determine overall sentiment, identify key themes, and provide percentage breakdowns.
            Be data-driven and specific.
            """;

    private final LlmService llmService;
    private final LlmProperties llmProperties;

    public SentimentTaskHandler(LlmService llmService, LlmProperties llmProperties) {
        this.llmService = llmService;
        this.llmProperties = llmProperties;
    }

    @Override
    public ActionType action() {
        return ActionType.SENTIMENT;
    }

    @Override
    public TaskResult execute(TaskInvocation invocation) {
        Optional<ProductData> product = ReferenceResolver.resolveProductData(invocation.task(), invocation.priorResults());
        if (product.isEmpty()) {
            log.warn("Task {} has no product data for sentiment analysis", invocation.taskIndex());
            return missing("No product data");
        }
        try {
            SentimentAnalysis sentiment = llmService.structuredCall(SYSTEM_PROMPT, buildPrompt(product.get()),
                    SentimentAnalysis.class, llmProperties.taskOptions(invocation.deepResearch(), TEMPERATURE));
            log.info("Sentiment for {}: {} (score {})", product.get().title(), sentiment.overall(), sentiment.score());
            return TaskResult.builder()
                    .put(ResultKeys.SENTIMENT, sentiment)
                    .put(ResultKeys.RATING, product.get().rating())
                    .put(ResultKeys.REVIEW_COUNT, product.get().reviewCount())
                    .build();
        } catch (Exception e) {
            log.warn("Sentiment analysis failed: {}", e.getMessage());
            return missing(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private static TaskResult missing(String error) {
        return TaskResult.builder()
                .put(ResultKeys.SENTIMENT, null)
                .put(ResultKeys.ERROR, error)
                .build();
    }

    private static String buildPrompt(ProductData product) {
        return """
                Analyze the sentiment for this product based on all available information.

                Product Data:
                %s

                Perform a comprehensive sentiment analysis considering:
                - Product rating and review count
                - Product features and description
                - Price positioning
                - Availability
                - Overall value proposition

                Determine:
                1. Overall sentiment (positive/neutral/negative)
                2. Sentiment score (-1.0 to 1.0, where 1.0 is most positive)
                3. Percentage breakdown (positive/neutral/negative must sum to 100)
                4. Key positive themes (list of 3-5 items)
                5. Key negative themes (list of 3-5 items)
                6. Confidence in analysis (0.0 to 1.0)
                7. Brief analysis summary

                Be objective and data-driven.
                """.formatted(PromptJson.pretty(product));
    }
}
