package com.scoutmind.core.persistence;

import java.time.Instant;

/**
 * A persisted final report.
 *
 * @param id        run identifier the report was produced by
 * @param query     the research query
 * @param content   markdown report
 * @param createdAt when the report was saved
 */
public record StoredReport(
    String id,
    String query,
    String content,
    Instant createdAt
) {

    public String preview(int maxChars) {
        if (content == null) {
            return "";
        }
        return content.length() <= maxChars ? content : content.substring(0, maxChars) + "...";
    }
}
