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

import java.util.List;

/**
 * Compares two or more scraped products side by side.
 */
@Component
public class CompareTaskHandler implements TaskHandler {

    private static final Logger log = LoggerFactory.getLogger(CompareTaskHandler.class);

    private static final double TEMPERATURE = 0.6;
    private static final int MAX_TOKENS = 3000;

    static final String SYSTEM_PROMPT = """
            You are a product comparison expert. Compare products objectively across
            features, price, quality, and value. Provide clear recommendations for different use cases.
            Use tables and structured comparisons.
            """;

    private final LlmService llmService;
    private final LlmProperties llmProperties;

    public CompareTaskHandler(LlmService llmService, LlmProperties llmProperties) {
        this.llmService = llmService;
        this.llmProperties = llmProperties;
    }

    @Override
    public ActionType action() {
        return ActionType.COMPARE;
    }

    @Override
    public TaskResult execute(TaskInvocation invocation) {
        List<ProductData> products = ReferenceResolver.resolveAllProductData(invocation.task(), invocation.priorResults());
        if (products.size() < ActionType.COMPARE.minimumReferences()) {
            log.warn("Task {} needs at least 2 products, got {}", invocation.taskIndex(), products.size());
            return missing("Insufficient products for comparison");
        }
        log.info("Comparing {} products", products.size());
        try {
            String comparison = llmService.call(SYSTEM_PROMPT, buildPrompt(products),
                    llmProperties.taskOptions(invocation.deepResearch(), TEMPERATURE, MAX_TOKENS));
            List<String> titles = products.stream()
                    .map(p -> p.title() != null ? p.title() : "Unknown")
                    .toList();
            return TaskResult.builder()
                    .put(ResultKeys.COMPARISON, comparison)
                    .put(ResultKeys.PRODUCTS_COMPARED, titles)
                    .put(ResultKeys.COMPARISON_COUNT, products.size())
                    .build();
        } catch (Exception e) {
            log.warn("Comparison failed: {}", e.getMessage());
            return missing(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private static TaskResult missing(String error) {
        return TaskResult.builder()
                .put(ResultKeys.COMPARISON, null)
                .put(ResultKeys.ERROR, error)
                .build();
    }

    private static String buildPrompt(List<ProductData> products) {
        return """
                Compare these products and provide a comprehensive analysis.

                Products to Compare:
                %s

                Create a detailed comparison that includes:

                1. **Feature Comparison Matrix**
                   - Create a table comparing key features across all products
                   - Highlight unique features of each product

                2. **Price Analysis**
                   - Compare prices
                   - Assess value for money
                   - Identify best budget option and best premium option

                3. **Quality Assessment**
                   - Compare ratings and review counts
                   - Assess build quality and reliability indicators
                   - Identify highest quality option

                4. **Use Case Recommendations**
                   - Best for budget-conscious buyers
                   - Best for premium features
                   - Best overall value
                   - Best for specific use cases

                5. **Pros & Cons**
                   - List pros and cons for each product

                6. **Final Verdict**
                   - Clear recommendation with reasoning
                   - Winner in different categories

                Format as markdown with tables where appropriate. Be objective and data-driven.
                """.formatted(PromptJson.pretty(products));
    }
}
