package com.scoutmind.core.tasks;

import com.scoutmind.core.engine.ResearchProperties;
import com.scoutmind.core.llm.LlmProperties;
import com.scoutmind.core.llm.LlmService;
import com.scoutmind.core.model.ActionType;
import com.scoutmind.core.model.ProductData;
import com.scoutmind.core.model.ResultKeys;
import com.scoutmind.core.model.SearchHit;
import com.scoutmind.core.model.TaskResult;
import com.scoutmind.core.scrape.TextExtractors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Synthesizes every earlier task result into the final markdown report.
 * <p>
 * A comparison run that could not scrape at least two real products gets a
 * deterministic failure report instead of an LLM call.
 */
@Component
public class FinalReportTaskHandler implements TaskHandler {

    private static final Logger log = LoggerFactory.getLogger(FinalReportTaskHandler.class);

    static final int MAX_EVIDENCE_URLS = 10;
    private static final double TEMPERATURE = 0.7;
    private static final int MAX_TOKENS = 18_000;
    private static final String COMPARISON_INTENT = "product_comparison";
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.ENGLISH);

    static final String SYSTEM_PROMPT = """
            You are a senior product research analyst. Write well-structured markdown
            research reports grounded only in the data you are given.
            """;

    private final LlmService llmService;
    private final LlmProperties llmProperties;
    private final ResearchProperties researchProperties;

    public FinalReportTaskHandler(LlmService llmService,
                                  LlmProperties llmProperties,
                                  ResearchProperties researchProperties) {
        this.llmService = llmService;
        this.llmProperties = llmProperties;
        this.researchProperties = researchProperties;
    }

    @Override
    public ActionType action() {
        return ActionType.FINAL_REPORT;
    }

    @Override
    public TaskResult execute(TaskInvocation invocation) {
        Map<Integer, TaskResult> results = new TreeMap<>(invocation.priorResults());
        log.info("Synthesizing {} task result(s) into final report (deep research: {})",
                results.size(), invocation.deepResearch());

        Evidence evidence = collectEvidence(results);
        if (COMPARISON_INTENT.equals(invocation.intent()) && evidence.validProducts() < 2) {
            log.warn("Insufficient data for comparison: {} valid product(s), {} failed scrape(s)",
                    evidence.validProducts(), evidence.failedScrapes().size());
            return TaskResult.builder()
                    .put(ResultKeys.FINAL_REPORT, insufficientDataReport(invocation.query(), evidence))
                    .build();
        }

        try {
            String resultsJson = TextExtractors.truncate(PromptJson.pretty(results),
                    researchProperties.getMaxReportInputChars(), "\n... [truncated]");
            String report = llmService.call(SYSTEM_PROMPT,
                    buildPrompt(invocation, resultsJson, evidence),
                    llmProperties.taskOptions(invocation.deepResearch(), TEMPERATURE, MAX_TOKENS));
            if (report.length() > researchProperties.getMaxReportChars()) {
                log.warn("Report too long ({} chars), truncating to {}", report.length(),
                        researchProperties.getMaxReportChars());
                report = report.substring(0, researchProperties.getMaxReportChars())
                        + "\n\n[Report truncated due to excessive length]";
            }
            log.info("Final report generated ({} chars)", report.length());
            return TaskResult.builder().put(ResultKeys.FINAL_REPORT, report).build();
        } catch (Exception e) {
            log.warn("Report generation failed: {}", e.getMessage());
            return TaskResult.builder()
                    .put(ResultKeys.FINAL_REPORT, null)
                    .put(ResultKeys.ERROR, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }

    record FailedScrape(String url, String title) {}

    record Evidence(List<String> urls, Map<String, String> images, int validProducts, List<FailedScrape> failedScrapes) {}

    static Evidence collectEvidence(Map<Integer, TaskResult> results) {
        Set<String> urls = new LinkedHashSet<>();
        Map<String, String> images = new LinkedHashMap<>();
        int valid = 0;
        List<FailedScrape> failed = new ArrayList<>();

        for (TaskResult result : results.values()) {
            for (SearchHit hit : result.searchResults()) {
                if (hit.url() != null) {
                    urls.add(hit.url());
                }
            }
            result.url().ifPresent(urls::add);
            if (result.productData().isPresent()) {
                ProductData data = result.productData().get();
                if (!data.images().isEmpty()) {
                    images.put(data.title() != null ? data.title() : "Product", data.images().get(0));
                }
                if (data.looksValid()) {
                    valid++;
                } else {
                    failed.add(new FailedScrape(result.url().orElse(data.url()), data.title()));
                }
            }
        }
        List<String> limited = urls.stream().limit(MAX_EVIDENCE_URLS).toList();
        return new Evidence(limited, images, valid, failed);
    }

    static String insufficientDataReport(String query, Evidence evidence) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Research Failed: Insufficient Product Data\n\n");
        sb.append("**Query:** ").append(query).append("\n\n");
        sb.append("**Issue:** This research requires comparing multiple products, but only ")
                .append(evidence.validProducts())
                .append(" product(s) could be successfully scraped.\n\n");
        sb.append("**Failed Scrapes:**\n");
        for (FailedScrape failed : evidence.failedScrapes()) {
            sb.append("\n- **URL:** ").append(failed.url() != null ? failed.url() : "N/A")
                    .append("\n  **Reason:** ").append(failed.title() != null ? failed.title() : "Unknown error")
                    .append('\n');
        }
        sb.append("""

                **Why This Happened:**
                Retail sites use anti-bot protection (captchas, rate limiting, IP blocking) to prevent \
                automated scraping, and the product pages could not be read.

                **Recommendations:**
                1. **Try again later** - The blocking may be temporary
                2. **Use different products** - Try products listed on less restrictive sites
                3. **Manual research** - For critical comparisons, manual research may be more reliable

                **What We Could Scrape:**
                """);
        if (evidence.validProducts() > 0) {
            sb.append("Successfully scraped ").append(evidence.validProducts())
                    .append(" product(s), but comparison requires at least 2.\n");
        } else {
            sb.append("No products could be scraped successfully.\n");
        }
        return sb.toString();
    }

    private static String buildPrompt(TaskInvocation invocation, String resultsJson, Evidence evidence) {
        String targetLength = invocation.deepResearch() ? "1100-2000 words" : "700-1600 words";
        String references = evidence.urls().isEmpty()
                ? "- No URLs available"
                : evidence.urls().stream().map(u -> "- " + u).collect(Collectors.joining("\n"));
        String images = evidence.images().isEmpty() ? "No images available" : PromptJson.pretty(evidence.images());
        return """
                Current Date: %s

                Create a comprehensive research report based on the following analysis.

                **Original Query:** %s

                **Research Plan:**
                %s

                **Analysis Results:**
                %s

                **Product Images Available:**
                %s

                **GUIDELINES:**
                1. Focus ONLY on actual data found in the analysis results above
                2. Do NOT make claims about whether a product exists or doesn't exist
                3. Present features, pricing, and reviews that WERE found in the data
                4. If data is limited, acknowledge it but still present what WAS found
                5. Use objective, factual language; avoid speculation
                6. Cite sources inline with bold retailer links, e.g. "$219.99 at **[Target](URL)**"
                7. When product images are available, show them in the Product Overview with ![Name](url);
                   for comparisons place them side by side in a markdown table

                Structure:

                # Product Research Report

                ## Product Overview
                ## Key Findings
                ## Sentiment Analysis (only if sentiment or review data exists)
                ## Comparison (only if comparison data exists)
                ## Recommendations
                ## Conclusion
                ## References
                %s

                **FORMATTING:**
                - Use markdown with bullet points and tables
                - Total length: %s
                - End with the References section listing all URLs
                """.formatted(
                LocalDate.now().format(DATE_FORMAT),
                invocation.query(),
                invocation.plan() != null ? PromptJson.pretty(invocation.plan()) : "{}",
                resultsJson,
                images,
                references,
                targetLength);
    }
}
