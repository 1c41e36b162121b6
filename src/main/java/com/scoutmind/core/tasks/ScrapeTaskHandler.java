package com.scoutmind.core.tasks;

import com.scoutmind.core.model.ActionType;
import com.scoutmind.core.model.ProductData;
import com.scoutmind.core.model.ResultKeys;
import com.scoutmind.core.model.TaskResult;
import com.scoutmind.core.resolve.ReferenceResolver;
import com.scoutmind.core.scrape.ProductScraper;
import com.scoutmind.core.scrape.TextExtractors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Scrapes one product page. The URL comes from the task query when it holds
 * one, otherwise from the referenced task's results.
 */
@Component
public class ScrapeTaskHandler implements TaskHandler {

    private static final Logger log = LoggerFactory.getLogger(ScrapeTaskHandler.class);

    private final ProductScraper scraper;

    public ScrapeTaskHandler(ProductScraper scraper) {
        this.scraper = scraper;
    }

    @Override
    public ActionType action() {
        return ActionType.SCRAPE;
    }

    @Override
    public TaskResult execute(TaskInvocation invocation) {
        Optional<String> url = TextExtractors.firstUrl(invocation.task().query())
                .or(() -> ReferenceResolver.resolveUrl(invocation.task(), invocation.priorResults()));
        if (url.isEmpty()) {
            log.warn("Task {} has no URL to scrape", invocation.taskIndex());
            return TaskResult.error("No URL provided");
        }
        try {
            ProductData data = scraper.scrape(url.get());
            return TaskResult.builder()
                    .put(ResultKeys.PRODUCT_DATA, data)
                    .put(ResultKeys.URL, url.get())
                    .build();
        } catch (Exception e) {
            log.warn("Scrape of {} failed: {}", url.get(), e.getMessage());
            return TaskResult.builder()
                    .put(ResultKeys.URL, url.get())
                    .put(ResultKeys.ERROR, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }
}
