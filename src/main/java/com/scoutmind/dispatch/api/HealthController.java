package com.scoutmind.dispatch.api;

import com.scoutmind.core.llm.LlmProperties;
import com.scoutmind.core.search.SearchClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller reporting service status and which integrations are configured.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private static final List<String> FEATURES = List.of("llm-planner", "dynamic-tasks", "sse-streaming", "report-history");

    private final LlmProperties llmProperties;
    private final SearchClient searchClient;
    private final SseStreamingService sseStreamingService;
    private final String version;

    public HealthController(LlmProperties llmProperties,
                            SearchClient searchClient,
                            SseStreamingService sseStreamingService,
                            @Value("${scoutmind.version:0.1.0}") String version) {
        this.llmProperties = llmProperties;
        this.searchClient = searchClient;
        this.sseStreamingService = sseStreamingService;
        this.version = version;
    }

    /**
     * GET /api/v1/health: Always 200 while the service is up; the flags tell
     * whether research will use the LLM and web search or fall back.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", "UP");
        result.put("service", "scoutmind");
        result.put("version", version);
        result.put("features", FEATURES);
        result.put("llm_configured", llmProperties.hasApiKey());
        result.put("search_configured", searchClient.isConfigured());
        result.put("active_streams", sseStreamingService.activeEmitterCount());
        return ResponseEntity.ok(result);
    }
}
