package com.scoutmind.core.search;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "scoutmind.search")
public class SearchProperties {

    private String apiKey = "";
    private String baseUrl = "https://api.tavily.com/search";
    private int maxResults = 5;
    private String searchDepth = "advanced";
    private Duration timeout = Duration.ofSeconds(15);
    private List<String> includeDomains = new ArrayList<>(
            List.of("amazon.com", "bestbuy.com", "walmart.com", "target.com", "ebay.com"));

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public int getMaxResults() {
        return maxResults;
    }

    public void setMaxResults(int maxResults) {
        this.maxResults = maxResults;
    }

    public String getSearchDepth() {
        return searchDepth;
    }

    public void setSearchDepth(String searchDepth) {
        this.searchDepth = searchDepth;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public List<String> getIncludeDomains() {
        return includeDomains;
    }

    public void setIncludeDomains(List<String> includeDomains) {
        this.includeDomains = includeDomains;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
