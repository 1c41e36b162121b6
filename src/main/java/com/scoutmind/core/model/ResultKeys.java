package com.scoutmind.core.model;

import java.util.Set;

/**
 * Recognized keys of a {@link TaskResult}.
 * <p>
 * The first group carries meaning for reference resolution and finalization.
 * The per-action keys are written by the bundled handlers and read back by
 * downstream tasks through the typed accessors on {@link TaskResult}. Any other
 * key a handler writes is treated as opaque payload.
 */
public final class ResultKeys {

    private ResultKeys() {}

    public static final String PRODUCT_DATA = "product_data";
    public static final String URL = "url";
    public static final String SUMMARY = "summary";
    public static final String SENTIMENT = "sentiment";
    public static final String COMPARISON = "comparison";
    public static final String FINAL_REPORT = "final_report";
    public static final String ERROR = "error";

    // search
    public static final String SEARCH_RESULTS = "search_results";
    public static final String PRODUCT_URLS = "product_urls";
    public static final String PRIMARY_URL = "primary_url";
    public static final String RESULTS_COUNT = "results_count";

    // sentiment
    public static final String RATING = "rating";
    public static final String REVIEW_COUNT = "review_count";

    // compare
    public static final String PRODUCTS_COMPARED = "products_compared";
    public static final String COMPARISON_COUNT = "comparison_count";

    public static final Set<String> CORE = Set.of(
            PRODUCT_DATA, URL, SUMMARY, SENTIMENT, COMPARISON, FINAL_REPORT, ERROR);

    public static final Set<String> ALL = Set.of(
            PRODUCT_DATA, URL, SUMMARY, SENTIMENT, COMPARISON, FINAL_REPORT, ERROR,
            SEARCH_RESULTS, PRODUCT_URLS, PRIMARY_URL, RESULTS_COUNT,
            RATING, REVIEW_COUNT, PRODUCTS_COMPARED, COMPARISON_COUNT);

    public static boolean isRecognized(String key) {
        return ALL.contains(key);
    }
}
