package com.vcc.llmgateway.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request body of {@code POST /{tenantId}/v1/completions}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CompletionRequest(
        @NotNull(message = "messages is required")
        @Size(min = 1, message = "messages must not be empty")
        List<@NotNull(message = "message must be an object") @Valid ChatMessage> messages,

        @Size(max = 128, message = "model must be at most 128 characters")
        String model,

        Boolean stream,

        @JsonAlias("cache_key")
        @Size(min = 1, max = 256, message = "cacheKey must be 1-256 characters")
        String cacheKey,

        @JsonAlias("conversation_id")
        @Size(max = 128, message = "conversationId must be at most 128 characters")
        String conversationId
) {

    public boolean streamRequested() {
        return Boolean.TRUE.equals(stream);
    }
}
