package com.scoutmind.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Execution limits for research runs.
 */
@Component
@ConfigurationProperties(prefix = "scoutmind.research")
public class ResearchProperties {

    /** Per-task timeout; zero or negative disables it. */
    private Duration taskTimeout = Duration.ZERO;
    private int recursionLimit = 500;
    private int maxReportInputChars = 50_000;
    private int maxReportChars = 50_000;

    public Duration getTaskTimeout() {
        return taskTimeout;
    }

    public void setTaskTimeout(Duration taskTimeout) {
        this.taskTimeout = taskTimeout;
    }

    public int getRecursionLimit() {
        return recursionLimit;
    }

    public void setRecursionLimit(int recursionLimit) {
        this.recursionLimit = recursionLimit;
    }

    public int getMaxReportInputChars() {
        return maxReportInputChars;
    }

    public void setMaxReportInputChars(int maxReportInputChars) {
        this.maxReportInputChars = maxReportInputChars;
    }

    public int getMaxReportChars() {
        return maxReportChars;
    }

    public void setMaxReportChars(int maxReportChars) {
        this.maxReportChars = maxReportChars;
    }

    public boolean hasTaskTimeout() {
        return taskTimeout != null && !taskTimeout.isZero() && !taskTimeout.isNegative();
    }
}
