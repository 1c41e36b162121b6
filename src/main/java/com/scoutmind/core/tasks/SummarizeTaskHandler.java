package com.scoutmind.core.tasks;

import com.scoutmind.core.llm.LlmProperties;
import com.scoutmind.core.llm.LlmService;
import com.scoutmind.core.model.ActionType;
import com.scoutmind.core.model.ProductData;
import com.scoutmind.core.model.ResultKeys;
import com.scoutmind.core.model.TaskResult;
import com.scoutmind.core.resolve.ReferenceResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Writes a markdown summary of one scraped product.
 */
@Component
public class SummarizeTaskHandler implements TaskHandler {

    private static final Logger log = LoggerFactory.getLogger(SummarizeTaskHandler.class);

    private static final double TEMPERATURE = 0.7;

    static final String SYSTEM_PROMPT = """
            You are an expert product analyst. Create concise, informative summaries
            that highlight key features, value proposition, and target audience. Be objective and factual.
            """;

    private final LlmService llmService;
    private final LlmProperties llmProperties;

    public SummarizeTaskHandler(LlmService llmService, LlmProperties llmProperties) {
        this.llmService = llmService;
        this.llmProperties = llmProperties;
    }

    @Override
    public ActionType action() {
        return ActionType.SUMMARIZE;
    }

    @Override
    public TaskResult execute(TaskInvocation invocation) {
        Optional<ProductData> product = ReferenceResolver.resolveProductData(invocation.task(), invocation.priorResults());
        if (product.isEmpty()) {
            log.warn("Task {} has no product data to summarize", invocation.taskIndex());
            return missing("No product data");
        }
        log.info("Summarizing {}", product.get().title());
        try {
            String summary = llmService.call(SYSTEM_PROMPT, buildPrompt(product.get()),
                    llmProperties.taskOptions(invocation.deepResearch(), TEMPERATURE));
            return TaskResult.builder().put(ResultKeys.SUMMARY, summary).build();
        } catch (Exception e) {
            log.warn("Summarization failed: {}", e.getMessage());
            return missing(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private static TaskResult missing(String error) {
        return TaskResult.builder()
                .put(ResultKeys.SUMMARY, null)
                .put(ResultKeys.ERROR, error)
                .build();
    }

    private static String buildPrompt(ProductData product) {
        return """
                Analyze this product and provide a comprehensive summary.

                Product Information:
                %s

                Create a summary that includes:
                1. **Overview**: Brief introduction to the product
                2. **Key Features**: Highlight 3-5 most important features
                3. **Value Proposition**: What makes this product stand out
                4. **Target Audience**: Who would benefit most from this product
                5. **Pros & Cons**: Balanced assessment

                Format as markdown with clear sections. Be concise but informative (300-400 words).
                """.formatted(PromptJson.pretty(product));
    }
}
