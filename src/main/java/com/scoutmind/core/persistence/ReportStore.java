package com.scoutmind.core.persistence;

import java.util.List;
import java.util.Optional;

/**
 * Storage for finished research reports.
 */
public interface ReportStore {

    /**
     * Saves a report, replacing any earlier report with the same id.
     */
    void save(String reportId, String query, String content);

    /**
     * Most recent reports first.
     */
    List<StoredReport> findRecent(int limit);

    Optional<StoredReport> findById(String reportId);
}
