package com.vcc.llmgateway.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.vcc.llmgateway.dto.CompletionRequest;

/**
 * A schema-valid completion request.
 *
 * @param request        typed view used for pipeline decisions
 * @param messages       the caller's messages array, forwarded upstream unchanged
 * @param conversationId caller supplied or generated {@code conv-<uuid>}
 */
public record CompletionCommand(CompletionRequest request, JsonNode messages, String conversationId) {

    public boolean isStream() {
        return request.streamRequested();
    }

    public String cacheKey() {
        return request.cacheKey();
    }
}
