package com.scoutmind.core.planner;

import com.scoutmind.core.llm.LlmParseException;
import com.scoutmind.core.llm.LlmProperties;
import com.scoutmind.core.llm.LlmService;
import com.scoutmind.core.metrics.ScoutmindMetrics;
import com.scoutmind.core.model.ActionType;
import com.scoutmind.core.model.ResearchPlan;
import com.scoutmind.core.model.ResearchTask;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link PlannerService}.
 * <p>
 * Uses Mockito to mock {@link LlmService} so that no real LLM calls are made.
 */
class PlannerServiceTest {

    private LlmService llm;
    private LlmProperties properties;
    private ScoutmindMetrics metrics;
    private PlannerService planner;

    @BeforeEach
    void setUp() {
        llm = mock(LlmService.class);
        metrics = mock(ScoutmindMetrics.class);
        properties = new LlmProperties();
        properties.setApiKey("sk-test");
        planner = new PlannerService(llm, properties, metrics);
    }

    @Test
    @DisplayName("returns the LLM plan as written")
    void usesLlmPlan() {
        var plan = new ResearchPlan("product_comparison", List.of(
                ResearchTask.of(ActionType.SEARCH, "AirPods 4"),
                ResearchTask.following(ActionType.SCRAPE, "task:0"),
                ResearchTask.of(ActionType.FINAL_REPORT, null)), "r");
        when(llm.structuredCall(anyString(), contains("AirPods 4 vs Galaxy Buds"), eq(ResearchPlan.class), any()))
                .thenReturn(plan);

        ResearchPlan result = planner.plan("AirPods 4 vs Galaxy Buds");

        assertSame(plan, result);
        verify(metrics).recordPlanSize(3);
        verify(metrics, never()).recordPlanFallback(anyString());
    }

    @Test
    @DisplayName("keeps a structurally questionable plan instead of repairing it")
    void keepsQuestionablePlan() {
        var plan = new ResearchPlan("x", List.of(
                ResearchTask.following(ActionType.SUMMARIZE, "task:3"),
                new ResearchTask("teleport", null, null, null, null)), null);
        when(llm.structuredCall(anyString(), anyString(), eq(ResearchPlan.class), any())).thenReturn(plan);

        assertSame(plan, planner.plan("query"));
    }

    @Test
    @DisplayName("falls back without calling the LLM when no API key is configured")
    void noApiKey() {
        properties.setApiKey("");

        ResearchPlan result = planner.plan("https://example.com/product");

        assertEquals(FallbackPlanFactory.REASONING, result.reasoning());
        assertEquals("scrape", result.tasks().get(0).action());
        verifyNoInteractions(llm);
        verify(metrics).recordPlanFallback("no_api_key");
    }

    @Test
    @DisplayName("placeholder API key counts as missing")
    void placeholderKey() {
        properties.setApiKey("not-set");
        planner.plan("headphones");
        verifyNoInteractions(llm);
    }

    @Test
    @DisplayName("falls back when the LLM fails")
    void llmFailure() {
        when(llm.structuredCall(anyString(), anyString(), eq(ResearchPlan.class), any()))
                .thenThrow(new LlmParseException(ResearchPlan.class, "bad json", null));

        ResearchPlan result = planner.plan("headphones");

        assertEquals(FallbackPlanFactory.INTENT_RESEARCH, result.intent());
        assertEquals(5, result.size());
        verify(metrics).recordPlanFallback("error");
    }

    @Test
    @DisplayName("falls back when the LLM returns no tasks")
    void emptyPlan() {
        when(llm.structuredCall(anyString(), anyString(), eq(ResearchPlan.class), any()))
                .thenReturn(new ResearchPlan("product_research", List.of(), null));

        ResearchPlan result = planner.plan("headphones");

        assertFalse(result.isEmpty());
        verify(metrics).recordPlanFallback("empty_plan");
    }

    @Test
    @DisplayName("falls back when the LLM returns null")
    void nullPlan() {
        when(llm.structuredCall(anyString(), anyString(), eq(ResearchPlan.class), any())).thenReturn(null);

        assertEquals(FallbackPlanFactory.REASONING, planner.plan("headphones").reasoning());
    }

    @Test
    @DisplayName("system prompt names every action and the worked examples")
    void systemPrompt() {
        for (ActionType type : ActionType.values()) {
            assertTrue(PlannerService.SYSTEM_PROMPT.contains("\"" + type.wireName() + "\""), type.wireName());
        }
        assertTrue(PlannerService.SYSTEM_PROMPT.contains("task:1,task:3"));
    }
}
