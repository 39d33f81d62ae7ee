package com.vcc.llmgateway.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Request body of {@code POST /v1/realtime/initialize}.
 * The backend is checked against the configured allow-list by the session service.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RealtimeInitRequest(
        String backend,
        String systemPrompt,
        JsonNode tools,
        String ttsService,
        @JsonAlias("cache_key")
        String cacheKey
) {
}
