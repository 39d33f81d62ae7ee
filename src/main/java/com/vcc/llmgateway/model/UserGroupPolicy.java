package com.vcc.llmgateway.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Duration;

/**
 * Budget and rate ceiling for one user group of a tenant.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserGroupPolicy(
        long tokenBudget,
        int rateLimit,               // Requests per window
        int rateLimitWindowSeconds
) {

    public Duration window() {
        return Duration.ofSeconds(Math.max(1, rateLimitWindowSeconds));
    }
}
