package com.scoutmind.core.persistence;

/**
 * A report could not be read from or written to the database.
 */
public class ReportStoreException extends RuntimeException {
    public ReportStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
