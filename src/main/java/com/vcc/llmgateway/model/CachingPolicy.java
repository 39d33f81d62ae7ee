package com.vcc.llmgateway.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CachingPolicy(boolean enabled, long defaultTtlSeconds) {

    public static CachingPolicy disabled() {
        return new CachingPolicy(false, 0);
    }

    /**
     * Entry TTL, using the fallback when the tenant leaves it unset.
     */
    public Duration ttl(long fallbackSeconds) {
        return Duration.ofSeconds(defaultTtlSeconds > 0 ? defaultTtlSeconds : fallbackSeconds);
    }
}
