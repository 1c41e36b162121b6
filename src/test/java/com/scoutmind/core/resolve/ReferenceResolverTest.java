package com.scoutmind.core.resolve;

import com.scoutmind.core.model.ActionType;
import com.scoutmind.core.model.ProductData;
import com.scoutmind.core.model.ResearchTask;
import com.scoutmind.core.model.ResultKeys;
import com.scoutmind.core.model.TaskResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceResolverTest {

    private static ProductData product(String title) {
        return new ProductData("https://shop/" + title, title, null, null, null,
                null, null, null, null, null, null);
    }

    private static TaskResult searchResult(String... urls) {
        return TaskResult.builder()
                .put(ResultKeys.PRODUCT_URLS, List.of(urls))
                .put(ResultKeys.PRIMARY_URL, urls.length > 0 ? urls[0] : null)
                .build();
    }

    // ===================================================================
    //  Parsing
    // ===================================================================

    @Nested
    @DisplayName("parsing")
    class Parsing {

        @Test
        @DisplayName("splits on the first colon and reads the index")
        void parsesReference() {
            assertEquals(OptionalInt.of(2), ReferenceResolver.parseReference("task:2"));
            assertEquals(OptionalInt.of(7), ReferenceResolver.parseReference(" task: 7 "));
        }

        @Test
        @DisplayName("malformed references parse to empty")
        void malformed() {
            assertTrue(ReferenceResolver.parseReference("task2").isEmpty());
            assertTrue(ReferenceResolver.parseReference("task:two").isEmpty());
            assertTrue(ReferenceResolver.parseReference("task:1:2").isEmpty());
            assertTrue(ReferenceResolver.parseReference(null).isEmpty());
        }

        @Test
        @DisplayName("comma lists keep order and skip blanks")
        void splitsList() {
            assertEquals(List.of("task:1", "task:3"), ReferenceResolver.split("task:1, task:3,"));
            assertEquals(List.of("task:1", "bad", "task:3"), ReferenceResolver.split("task:1,bad,task:3"));
            assertEquals(List.of(), ReferenceResolver.split(null));
        }
    }

    // ===================================================================
    //  Resolution
    // ===================================================================

    @Nested
    @DisplayName("resolution")
    class Resolution {

        @Test
        @DisplayName("missing and malformed references resolve to empty results")
        void missingResolvesEmpty() {
            Map<Integer, TaskResult> results = Map.of(0, TaskResult.error("x"));

            List<TaskResult> resolved = ReferenceResolver.resolve("task:0,task:9,nope", results);

            assertEquals(3, resolved.size());
            assertTrue(resolved.get(0).isError());
            assertTrue(resolved.get(1).isEmpty());
            assertTrue(resolved.get(2).isEmpty());
        }

        @Test
        @DisplayName("url_index selects from the referenced URL list")
        void urlIndexSelects() {
            var results = Map.of(0, searchResult("https://a", "https://b", "https://c"));
            var task = new ResearchTask("scrape", null, "task:0", 2, null);

            assertEquals(Optional.of("https://c"), ReferenceResolver.resolveUrl(task, results));
        }

        @Test
        @DisplayName("out-of-range url_index falls back to the first URL")
        void outOfRangeIndex() {
            var results = Map.of(0, searchResult("https://a", "https://b"));
            var task = new ResearchTask("scrape", null, "task:0", 5, null);

            assertEquals(Optional.of("https://a"), ReferenceResolver.resolveUrl(task, results));
        }

        @Test
        @DisplayName("empty URL list falls back to primary_url then url")
        void fallsBackToPrimaryThenUrl() {
            var withPrimary = TaskResult.builder()
                    .put(ResultKeys.PRODUCT_URLS, List.of())
                    .put(ResultKeys.PRIMARY_URL, "https://primary")
                    .build();
            var withUrl = TaskResult.builder().put(ResultKeys.URL, "https://page").build();
            var task = ResearchTask.following(ActionType.SCRAPE, "task:0");

            assertEquals(Optional.of("https://primary"), ReferenceResolver.resolveUrl(task, Map.of(0, withPrimary)));
            assertEquals(Optional.of("https://page"), ReferenceResolver.resolveUrl(task, Map.of(0, withUrl)));
            assertTrue(ReferenceResolver.resolveUrl(task, Map.of()).isEmpty());
        }

        @Test
        @DisplayName("collects product data from every reference in order")
        void collectsAllProducts() {
            Map<Integer, TaskResult> results = Map.of(
                    1, TaskResult.builder().put(ResultKeys.PRODUCT_DATA, product("A")).build(),
                    2, TaskResult.error("blocked"),
                    3, TaskResult.builder().put(ResultKeys.PRODUCT_DATA, product("B")).build());
            var task = ResearchTask.following(ActionType.COMPARE, "task:3,task:2,task:1");

            List<ProductData> products = ReferenceResolver.resolveAllProductData(task, results);

            assertEquals(List.of("B", "A"), products.stream().map(ProductData::title).toList());
        }

        @Test
        @DisplayName("product data comes from the first reference only")
        void firstReferenceProduct() {
            Map<Integer, TaskResult> results = Map.of(
                    0, TaskResult.builder().put(ResultKeys.PRODUCT_DATA, product("A")).build(),
                    1, TaskResult.builder().put(ResultKeys.PRODUCT_DATA, product("B")).build());
            var task = ResearchTask.following(ActionType.SUMMARIZE, "task:1,task:0");

            assertEquals("B", ReferenceResolver.resolveProductData(task, results).orElseThrow().title());
        }
    }
}
