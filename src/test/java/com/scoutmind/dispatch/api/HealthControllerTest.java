package com.scoutmind.dispatch.api;

import com.scoutmind.core.llm.LlmProperties;
import com.scoutmind.core.search.SearchClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasItem;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
@TestPropertySource(properties = {
        "spring.main.web-application-type=servlet",
        "scoutmind.version=9.9.9"
})
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private LlmProperties llmProperties;

    @MockitoBean
    private SearchClient searchClient;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    @Test
    @DisplayName("GET /health reports UP with integration flags")
    void health() throws Exception {
        when(llmProperties.hasApiKey()).thenReturn(true);
        when(searchClient.isConfigured()).thenReturn(false);
        when(sseStreamingService.activeEmitterCount()).thenReturn(2);

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.service").value("scoutmind"))
                .andExpect(jsonPath("$.version").value("9.9.9"))
                .andExpect(jsonPath("$.features", hasItem("dynamic-tasks")))
                .andExpect(jsonPath("$.llm_configured").value(true))
                .andExpect(jsonPath("$.search_configured").value(false))
                .andExpect(jsonPath("$.active_streams").value(2));
    }
}
