package com.scoutmind.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScoutmindMetricsTest {

    private SimpleMeterRegistry registry;
    private ScoutmindMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ScoutmindMetrics(registry);
    }

    @Test
    @DisplayName("recordPlanningDuration creates a timer")
    void recordPlanningDuration() {
        metrics.recordPlanningDuration(1500);
        var timer = registry.find("scoutmind.planning.duration").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordPlanFallback counts by reason")
    void recordPlanFallback() {
        metrics.recordPlanFallback("no_api_key");
        metrics.recordPlanFallback("no_api_key");
        metrics.recordPlanFallback("error");

        assertEquals(2.0, registry.find("scoutmind.planning.fallbacks").tag("reason", "no_api_key").counter().count());
        assertEquals(1.0, registry.find("scoutmind.planning.fallbacks").tag("reason", "error").counter().count());
    }

    @Test
    @DisplayName("recordPlanSize records a distribution summary")
    void recordPlanSize() {
        metrics.recordPlanSize(4);
        metrics.recordPlanSize(6);
        var summary = registry.find("scoutmind.plan.size").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(10.0, summary.totalAmount());
    }

    @Test
    @DisplayName("recordTaskExecution records by action and outcome tags")
    void recordTaskExecution() {
        metrics.recordTaskExecution("search", "success", 200);
        metrics.recordTaskExecution("scrape", "error", 100);
        metrics.recordTaskExecution("scrape", "error", 100);

        var search = registry.find("scoutmind.task.duration").tags("action", "search", "outcome", "success").timer();
        var scrape = registry.find("scoutmind.task.duration").tags("action", "scrape", "outcome", "error").timer();
        assertNotNull(search);
        assertNotNull(scrape);
        assertEquals(1, search.count());
        assertEquals(2, scrape.count());
    }

    @Test
    @DisplayName("recordRunResult counts by status")
    void recordRunResult() {
        metrics.recordRunResult("COMPLETED");
        metrics.recordRunResult("CANCELLED");
        assertEquals(1.0, registry.find("scoutmind.runs.total").tag("status", "COMPLETED").counter().count());
        assertEquals(1.0, registry.find("scoutmind.runs.total").tag("status", "CANCELLED").counter().count());
    }

    @Test
    @DisplayName("recordRunDuration and recordReportPersistence register meters")
    void runDurationAndPersistence() {
        metrics.recordRunDuration(3000);
        metrics.recordReportPersistence(true);
        metrics.recordReportPersistence(false);

        assertEquals(1, registry.find("scoutmind.run.duration").timer().count());
        assertEquals(1.0, registry.find("scoutmind.reports.saved").tag("success", "true").counter().count());
        assertEquals(1.0, registry.find("scoutmind.reports.saved").tag("success", "false").counter().count());
    }
}
