package com.vcc.llmgateway.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * Credential record stored under {@code credential:<token>}.
 * The token itself is the key and is not repeated in the value.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Credential(
        String tenantId,
        String userId,
        String group,
        long remainingBudget,
        Instant expiresAt
) {

    /**
     * Check if credential is expired at the given instant.
     */
    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
