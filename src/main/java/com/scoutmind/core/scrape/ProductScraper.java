package com.scoutmind.core.scrape;

import com.scoutmind.core.llm.LlmProperties;
import com.scoutmind.core.llm.LlmService;
import com.scoutmind.core.model.ProductData;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Fetches a product page and extracts {@link ProductData} from it.
 * <p>
 * The LLM reads the cleaned page text and fills the product schema. Price,
 * rating and review count are the fields most often missed, so any gap left by
 * the LLM is filled from {@link SelectorProductExtractor}. When the LLM is
 * disabled, unconfigured or fails, the selector result is used on its own.
 */
@Service
public class ProductScraper {

    private static final Logger log = LoggerFactory.getLogger(ProductScraper.class);

    private static final double EXTRACTION_TEMPERATURE = 0.3;

    private static final String SYSTEM_PROMPT = """
            You are a data extraction expert. Extract structured product information
            from web page content. Be thorough and accurate. If information is not
            available, use null.
            """;

    private final LlmService llmService;
    private final LlmProperties llmProperties;
    private final ScraperProperties properties;
    private final SelectorProductExtractor selectors;

    public ProductScraper(LlmService llmService,
                          LlmProperties llmProperties,
                          ScraperProperties properties,
                          SelectorProductExtractor selectors) {
        this.llmService = llmService;
        this.llmProperties = llmProperties;
        this.properties = properties;
        this.selectors = selectors;
    }

    /**
     * @throws ScrapeException when the page cannot be fetched
     */
    public ProductData scrape(String url) {
        log.info("Scraping product page {}", url);
        Document doc = fetch(url);
        return extract(doc, url);
    }

    Document fetch(String url) {
        try {
            return Jsoup.connect(url)
                    .userAgent(properties.getUserAgent())
                    .timeout((int) properties.getTimeout().toMillis())
                    .followRedirects(true)
                    .get();
        } catch (IOException | IllegalArgumentException e) {
            throw new ScrapeException("Failed to fetch " + url + ": " + e.getMessage(), e);
        }
    }

    ProductData extract(Document doc, String url) {
        ProductData selectorData = withTextFallbacks(selectors.extract(doc, url), doc);
        if (!properties.isLlmExtraction() || !llmProperties.hasApiKey()) {
            log.debug("LLM extraction disabled, using selectors for {}", url);
            return selectorData;
        }

        String text = pageText(doc, properties.getMaxTextChars());
        log.info("Extracting product data with LLM from {} chars", text.length());
        try {
            ProductData extracted = llmService.structuredCall(
                    SYSTEM_PROMPT,
                    buildPrompt(url, text),
                    ProductData.class,
                    llmProperties.taskOptions(false, EXTRACTION_TEMPERATURE));
            if (extracted == null) {
                return selectorData;
            }
            ProductData merged = extracted.withUrl(url);
            if (merged.price() == null || merged.rating() == null || merged.reviewCount() == null) {
                log.debug("LLM missed price, rating or review count for {}; augmenting from selectors", url);
                merged = merged.augmentFrom(selectorData);
            }
            return merged;
        } catch (Exception e) {
            log.warn("LLM extraction failed for {}, falling back to selectors: {}", url, e.getMessage());
            return selectorData;
        }
    }

    /**
     * Page text without scripts, styles and inline SVG, cut to {@code maxChars}.
     */
    static String pageText(Document doc, int maxChars) {
        Document copy = doc.clone();
        copy.select("script, style, noscript, svg").remove();
        String text = copy.text();
        return TextExtractors.truncate(text, maxChars, "\n... [truncated]");
    }

    private static ProductData withTextFallbacks(ProductData data, Document doc) {
        if (data.price() != null) {
            return data;
        }
        String price = TextExtractors.price(doc.text()).orElse(null);
        if (price == null) {
            return data;
        }
        return data.augmentFrom(new ProductData(null, null, price, null, null,
                null, null, null, null, null, null));
    }

    private static String buildPrompt(String url, String text) {
        return """
                Extract structured product information from this web page content.

                URL: %s

                Page Content:
                %s

                Extract: title, price (string with currency symbol), rating (0-5 scale),
                review_count (integer), features (key product features), description,
                availability (stock status), brand, category and images (image URLs, if visible).
                If any field cannot be determined, use null.
                """.formatted(url, text);
    }
}
