package com.scoutmind.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setRun puts runId in MDC")
    void setRun() {
        MdcContext.setRun("run-1");
        assertEquals("run-1", MDC.get("runId"));
    }

    @Test
    @DisplayName("setTask puts runId, taskIndex and action in MDC")
    void setTask() {
        MdcContext.setTask("run-1", 3, "scrape");
        assertEquals("run-1", MDC.get("runId"));
        assertEquals("3", MDC.get("taskIndex"));
        assertEquals("scrape", MDC.get("action"));
    }

    @Test
    @DisplayName("clearTask keeps the run key")
    void clearTask() {
        MdcContext.setTask("run-1", 3, "scrape");
        MdcContext.clearTask();
        assertEquals("run-1", MDC.get("runId"));
        assertNull(MDC.get("taskIndex"));
        assertNull(MDC.get("action"));
    }

    @Test
    @DisplayName("clear removes all scoutmind MDC keys")
    void clear() {
        MdcContext.setTask("run-1", 3, "scrape");
        MdcContext.clear();
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("taskIndex"));
        assertNull(MDC.get("action"));
    }
}
