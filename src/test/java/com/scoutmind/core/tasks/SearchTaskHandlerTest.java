package com.scoutmind.core.tasks;

import com.scoutmind.core.model.ActionType;
import com.scoutmind.core.model.ResearchTask;
import com.scoutmind.core.model.ResultKeys;
import com.scoutmind.core.model.SearchHit;
import com.scoutmind.core.model.TaskResult;
import com.scoutmind.core.search.SearchClient;
import com.scoutmind.core.search.SearchException;
import com.scoutmind.core.search.SearchProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class SearchTaskHandlerTest {

    private SearchClient client;
    private SearchTaskHandler handler;

    @BeforeEach
    void setUp() {
        client = mock(SearchClient.class);
        handler = new SearchTaskHandler(client, new SearchProperties());
    }

    private static TaskInvocation invocation(ResearchTask task) {
        return new TaskInvocation("run-1", 0, task, "run query", false, null, Map.of());
    }

    @Test
    @DisplayName("keeps product-page URLs and exposes the first as primary_url")
    void filtersProductUrls() {
        when(client.search("airpods 4", 5)).thenReturn(List.of(
                new SearchHit("Review", "https://www.theverge.com/airpods-review", "...", 0.9),
                new SearchHit("Amazon", "https://www.amazon.com/Apple-AirPods-4/dp/B0DGHMNQ5Z", "...", 0.8),
                new SearchHit("Best Buy", "https://www.bestbuy.com/site/apple-airpods-4/6447384.p", "...", 0.7)));

        TaskResult result = handler.execute(invocation(ResearchTask.of(ActionType.SEARCH, "airpods 4")));

        assertEquals(List.of(
                "https://www.amazon.com/Apple-AirPods-4/dp/B0DGHMNQ5Z",
                "https://www.bestbuy.com/site/apple-airpods-4/6447384.p"), result.productUrls());
        assertEquals("https://www.amazon.com/Apple-AirPods-4/dp/B0DGHMNQ5Z", result.primaryUrl().orElseThrow());
        assertEquals(2, result.get(ResultKeys.RESULTS_COUNT).orElseThrow());
        assertEquals(3, result.searchResults().size());
        assertFalse(result.isError());
    }

    @Test
    @DisplayName("falls back to the run query when the task has none")
    void usesRunQuery() {
        when(client.search(anyString(), anyInt())).thenReturn(List.of());

        handler.execute(invocation(new ResearchTask("search", null, null, null, null)));

        verify(client).search("run query", 5);
    }

    @Test
    @DisplayName("no product pages leaves primary_url null")
    void noProductPages() {
        when(client.search(anyString(), anyInt())).thenReturn(List.of(
                new SearchHit("Blog", "https://blog.example/post", null, null)));

        TaskResult result = handler.execute(invocation(ResearchTask.of(ActionType.SEARCH, "x")));

        assertTrue(result.containsKey(ResultKeys.PRIMARY_URL));
        assertTrue(result.primaryUrl().isEmpty());
        assertEquals(0, result.get(ResultKeys.RESULTS_COUNT).orElseThrow());
    }

    @Test
    @DisplayName("search failure returns empty lists and the error")
    void searchFailure() {
        when(client.search(anyString(), anyInt())).thenThrow(new SearchException("Search API key is not configured"));

        TaskResult result = handler.execute(invocation(ResearchTask.of(ActionType.SEARCH, "x")));

        assertEquals("Search API key is not configured", result.error().orElseThrow());
        assertEquals(List.of(), result.productUrls());
        assertEquals(0, result.get(ResultKeys.RESULTS_COUNT).orElseThrow());
    }
}
