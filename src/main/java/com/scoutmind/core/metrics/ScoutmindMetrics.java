package com.scoutmind.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for research runs.
 */
@Service
public class ScoutmindMetrics {

    private final MeterRegistry registry;

    public ScoutmindMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPlanningDuration(long ms) {
        Timer.builder("scoutmind.planning.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Counts plans replaced by the deterministic fallback.
     *
     * @param reason "no_api_key", "empty_plan" or "error"
     */
    public void recordPlanFallback(String reason) {
        Counter.builder("scoutmind.planning.fallbacks")
                .description("Plans replaced by the fallback plan")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordPlanSize(int tasks) {
        DistributionSummary.builder("scoutmind.plan.size")
                .description("Number of tasks per plan")
                .register(registry)
                .record(tasks);
    }

    /**
     * @param action  action name as planned (unknown names are recorded as-is)
     * @param outcome "success", "error", "timeout" or "unknown"
     */
    public void recordTaskExecution(String action, String outcome, long ms) {
        Timer.builder("scoutmind.task.duration")
                .tag("action", action)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRunResult(String status) {
        Counter.builder("scoutmind.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordRunDuration(long ms) {
        Timer.builder("scoutmind.run.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordReportPersistence(boolean success) {
        Counter.builder("scoutmind.reports.saved")
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }
}
