package com.scoutmind.core.scrape;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "scoutmind.scraper")
public class ScraperProperties {

    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/124.0 Safari/537.36";
    private Duration timeout = Duration.ofSeconds(30);
    private int maxTextChars = 8000;
    private boolean llmExtraction = true;

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public int getMaxTextChars() {
        return maxTextChars;
    }

    public void setMaxTextChars(int maxTextChars) {
        this.maxTextChars = maxTextChars;
    }

    public boolean isLlmExtraction() {
        return llmExtraction;
    }

    public void setLlmExtraction(boolean llmExtraction) {
        this.llmExtraction = llmExtraction;
    }
}
