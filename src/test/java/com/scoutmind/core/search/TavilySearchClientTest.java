package com.scoutmind.core.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scoutmind.core.model.SearchHit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.http.HttpRequest;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Request building and response parsing for {@link TavilySearchClient}. No
 * network calls are made.
 */
class TavilySearchClientTest {

    private SearchProperties properties;
    private TavilySearchClient client;

    @BeforeEach
    void setUp() {
        properties = new SearchProperties();
        properties.setApiKey("tvly-test");
        client = new TavilySearchClient(properties);
    }

    @Test
    @DisplayName("parses results and skips entries without a URL")
    void parsesResults() throws Exception {
        String body = """
                {
                  "query": "airpods",
                  "results": [
                    {"title": "AirPods 4", "url": "https://www.amazon.com/dp/B0DGHMNQ5Z", "content": "Apple earbuds", "score": 0.93},
                    {"title": "No link", "content": "x"},
                    {"title": "Target", "url": "https://www.target.com/p/a/-/A-1", "score": "high"}
                  ]
                }
                """;

        List<SearchHit> hits = client.parseResults(body);

        assertEquals(2, hits.size());
        assertEquals(new SearchHit("AirPods 4", "https://www.amazon.com/dp/B0DGHMNQ5Z", "Apple earbuds", 0.93), hits.get(0));
        assertNull(hits.get(1).score());
        assertNull(hits.get(1).content());
    }

    @Test
    @DisplayName("missing results array yields no hits")
    void noResults() throws Exception {
        assertEquals(List.of(), client.parseResults("{\"answer\": null}"));
    }

    @Test
    @DisplayName("unconfigured client refuses to search")
    void unconfigured() {
        properties.setApiKey("");

        assertFalse(client.isConfigured());
        var e = assertThrows(SearchException.class, () -> client.search("airpods", 5));
        assertEquals("Search API key is not configured", e.getMessage());
    }

    @Test
    @DisplayName("request posts JSON restricted to retailer domains")
    void buildsRequest() throws Exception {
        HttpRequest request = client.buildRequest("airpods 4", 3);

        assertEquals("POST", request.method());
        assertEquals("https://api.tavily.com/search", request.uri().toString());
        assertEquals("application/json", request.headers().firstValue("Content-Type").orElseThrow());

        JsonNode payload = new ObjectMapper().readTree(body(request));
        assertEquals("tvly-test", payload.get("api_key").asText());
        assertEquals("airpods 4", payload.get("query").asText());
        assertEquals(3, payload.get("max_results").asInt());
        assertEquals("advanced", payload.get("search_depth").asText());
        assertFalse(payload.get("include_answer").asBoolean());
        assertEquals(5, payload.get("include_domains").size());
    }

    @Test
    @DisplayName("non-positive max results uses the configured default")
    void defaultMaxResults() throws Exception {
        JsonNode payload = new ObjectMapper().readTree(body(client.buildRequest("x", 0)));
        assertEquals(5, payload.get("max_results").asInt());
    }

    private static String body(HttpRequest request) throws Exception {
        var publisher = request.bodyPublisher().orElseThrow();
        var result = new CompletableFuture<String>();
        var buffer = new StringBuilder();
        publisher.subscribe(new Flow.Subscriber<>() {
            @Override
            public void onSubscribe(Flow.Subscription subscription) {
                subscription.request(Long.MAX_VALUE);
            }

            @Override
            public void onNext(ByteBuffer item) {
                buffer.append(StandardCharsets.UTF_8.decode(item));
            }

            @Override
            public void onError(Throwable throwable) {
                result.completeExceptionally(throwable);
            }

            @Override
            public void onComplete() {
                result.complete(buffer.toString());
            }
        });
        return result.get();
    }
}
