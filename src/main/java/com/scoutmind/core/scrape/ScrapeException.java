package com.scoutmind.core.scrape;

/**
 * Thrown when a product page cannot be fetched.
 */
public class ScrapeException extends RuntimeException {
    public ScrapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
