package com.scoutmind.core.tasks;

import com.scoutmind.core.model.ActionType;
import com.scoutmind.core.model.ResultKeys;
import com.scoutmind.core.model.SearchHit;
import com.scoutmind.core.model.TaskResult;
import com.scoutmind.core.search.ProductUrlMatcher;
import com.scoutmind.core.search.SearchClient;
import com.scoutmind.core.search.SearchProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Searches retailer sites and keeps the hits that look like product pages.
 */
@Component
public class SearchTaskHandler implements TaskHandler {

    private static final Logger log = LoggerFactory.getLogger(SearchTaskHandler.class);

    private final SearchClient searchClient;
    private final SearchProperties properties;

    public SearchTaskHandler(SearchClient searchClient, SearchProperties properties) {
        this.searchClient = searchClient;
        this.properties = properties;
    }

    @Override
    public ActionType action() {
        return ActionType.SEARCH;
    }

    @Override
    public TaskResult execute(TaskInvocation invocation) {
        String query = invocation.effectiveQuery();
        try {
            List<SearchHit> hits = searchClient.search(query, properties.getMaxResults());
            List<String> productUrls = ProductUrlMatcher.productUrls(hits.stream().map(SearchHit::url).toList());
            log.info("Search for '{}' found {} hit(s), {} product page(s)", query, hits.size(), productUrls.size());
            return TaskResult.builder()
                    .put(ResultKeys.SEARCH_RESULTS, hits)
                    .put(ResultKeys.PRODUCT_URLS, productUrls)
                    .put(ResultKeys.PRIMARY_URL, productUrls.isEmpty() ? null : productUrls.get(0))
                    .put(ResultKeys.RESULTS_COUNT, productUrls.size())
                    .build();
        } catch (Exception e) {
            log.warn("Search for '{}' failed: {}", query, e.getMessage());
            return TaskResult.builder()
                    .put(ResultKeys.SEARCH_RESULTS, List.of())
                    .put(ResultKeys.PRODUCT_URLS, List.of())
                    .put(ResultKeys.PRIMARY_URL, null)
                    .put(ResultKeys.RESULTS_COUNT, 0)
                    .put(ResultKeys.ERROR, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }
}
