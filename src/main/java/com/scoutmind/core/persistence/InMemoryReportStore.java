package com.scoutmind.core.persistence;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ReportStore} kept in process memory. Reports are lost on restart.
 */
public class InMemoryReportStore implements ReportStore {

    private final ConcurrentHashMap<String, StoredReport> reports = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryReportStore() {
        this(Clock.systemUTC());
    }

    InMemoryReportStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void save(String reportId, String query, String content) {
        if (reportId == null || reportId.isBlank()) {
            throw new IllegalArgumentException("Report id must not be blank");
        }
        reports.put(reportId, new StoredReport(reportId, query, content, clock.instant()));
    }

    @Override
    public List<StoredReport> findRecent(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return reports.values().stream()
                .sorted(Comparator.comparing(StoredReport::createdAt).reversed()
                        .thenComparing(StoredReport::id))
                .limit(limit)
                .toList();
    }

    @Override
    public Optional<StoredReport> findById(String reportId) {
        return reportId == null ? Optional.empty() : Optional.ofNullable(reports.get(reportId));
    }
}
