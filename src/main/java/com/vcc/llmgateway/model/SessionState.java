package com.vcc.llmgateway.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Realtime session state stored under {@code session:<tenantId>:<sessionId>:state}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionState(
        String backend,
        String systemPrompt,
        JsonNode tools,
        String ttsService,
        String cacheKey,
        long tokensUsed,
        Instant createdAt
) {

    public SessionState withTokensUsed(long tokensUsed) {
        return new SessionState(backend, systemPrompt, tools, ttsService, cacheKey, tokensUsed, createdAt);
    }
}
