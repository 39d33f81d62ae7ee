package com.vcc.llmgateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;

/**
 * One conversation turn. Content may be a string or a provider-specific structure.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatMessage(
        @NotBlank(message = "role is required")
        String role,

        @NonEmptyContent
        JsonNode content
) {
}
