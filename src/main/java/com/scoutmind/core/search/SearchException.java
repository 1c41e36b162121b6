package com.scoutmind.core.search;

/**
 * Thrown when a web search cannot be performed.
 */
public class SearchException extends RuntimeException {
    public SearchException(String message) {
        super(message);
    }

    public SearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
