package com.scoutmind.core.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scoutmind.core.model.SearchHit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tavily web search client restricted to the configured retailer domains.
 */
@Component
public class TavilySearchClient implements SearchClient {

    private static final Logger log = LoggerFactory.getLogger(TavilySearchClient.class);

    private final HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(8)).build();
    private final ObjectMapper om = new ObjectMapper();
    private final SearchProperties properties;

    public TavilySearchClient(SearchProperties properties) {
        this.properties = properties;
    }

    @Override
    public boolean isConfigured() {
        return properties.hasApiKey();
    }

    @Override
    public List<SearchHit> search(String query, int maxResults) {
        if (!isConfigured()) {
            throw new SearchException("Search API key is not configured");
        }
        log.info("Searching retailers for: {}", query);
        try {
            HttpResponse<String> resp = client.send(buildRequest(query, maxResults),
                    HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (resp.statusCode() / 100 != 2) {
                throw new SearchException("Search request failed with HTTP " + resp.statusCode());
            }
            List<SearchHit> hits = parseResults(resp.body());
            log.info("Search returned {} result(s)", hits.size());
            return hits;
        } catch (IOException e) {
            throw new SearchException("Search request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SearchException("Search request interrupted", e);
        }
    }

    HttpRequest buildRequest(String query, int maxResults) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("api_key", properties.getApiKey());
        payload.put("query", query);
        payload.put("max_results", maxResults > 0 ? maxResults : properties.getMaxResults());
        payload.put("search_depth", properties.getSearchDepth());
        payload.put("include_answer", false);
        payload.put("include_domains", properties.getIncludeDomains());

        String json = om.writeValueAsString(payload);
        return HttpRequest.newBuilder(URI.create(properties.getBaseUrl()))
                .timeout(properties.getTimeout())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();
    }

    List<SearchHit> parseResults(String body) throws IOException {
        JsonNode root = om.readTree(body);
        JsonNode results = root == null ? null : root.get("results");
        if (results == null || !results.isArray()) {
            return List.of();
        }
        List<SearchHit> out = new ArrayList<>();
        for (JsonNode item : results) {
            String url = text(item, "url");
            if (url == null || url.isBlank()) {
                continue;
            }
            JsonNode score = item.get("score");
            out.add(new SearchHit(
                    text(item, "title"),
                    url,
                    text(item, "content"),
                    score == null || !score.isNumber() ? null : score.asDouble()));
        }
        return out;
    }

    private static String text(JsonNode n, String field) {
        JsonNode v = n.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }
}
