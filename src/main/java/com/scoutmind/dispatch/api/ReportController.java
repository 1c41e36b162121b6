package com.scoutmind.dispatch.api;

import com.scoutmind.core.persistence.ReportStore;
import com.scoutmind.core.persistence.StoredReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for saved research reports.
 */
@RestController
@RequestMapping("/api/v1/reports")
public class ReportController {

    private static final Logger log = LoggerFactory.getLogger(ReportController.class);

    static final int PREVIEW_CHARS = 100;
    private static final int MAX_LIMIT = 100;

    private final ReportStore reportStore;

    public ReportController(ReportStore reportStore) {
        this.reportStore = reportStore;
    }

    /**
     * GET /api/v1/reports?limit=20: Most recent reports with a short preview.
     */
    @GetMapping
    public ResponseEntity<List<Map<String, Object>>> listReports(
            @RequestParam(name = "limit", defaultValue = "20") int limit) {
        if (limit < 1) {
            return ResponseEntity.badRequest().build();
        }
        List<Map<String, Object>> reports = reportStore.findRecent(Math.min(limit, MAX_LIMIT)).stream()
                .map(ReportController::toSummary)
                .toList();
        log.debug("Listing {} report(s)", reports.size());
        return ResponseEntity.ok(reports);
    }

    /**
     * GET /api/v1/reports/{id}: Full report.
     */
    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> getReport(@PathVariable String id) {
        return reportStore.findById(id)
                .map(report -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("id", report.id());
                    body.put("query", report.query());
                    body.put("content", report.content());
                    body.put("created_at", createdAt(report));
                    return ResponseEntity.ok(body);
                })
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private static Map<String, Object> toSummary(StoredReport report) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("id", report.id());
        summary.put("query", report.query());
        summary.put("preview", report.preview(PREVIEW_CHARS));
        summary.put("created_at", createdAt(report));
        return summary;
    }

    private static String createdAt(StoredReport report) {
        return report.createdAt() != null ? report.createdAt().toString() : null;
    }
}
