package com.scoutmind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for the research endpoints.
 *
 * @param query        the research query or product URL
 * @param deepResearch nullable; defaults to false
 * @param mode         accepted for compatibility with older clients and otherwise unused
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResearchRequest(
    String query,
    @JsonProperty("deep_research") Boolean deepResearch,
    String mode
) {

    public boolean isDeepResearch() {
        return deepResearch != null && deepResearch;
    }

    public boolean hasQuery() {
        return query != null && !query.isBlank();
    }
}
