package com.vcc.llmgateway.model;

import org.springframework.http.MediaType;

import java.nio.charset.StandardCharsets;

/**
 * A complete upstream response, relayed to the caller as-is.
 */
public record BufferedResponse(int status, MediaType contentType, byte[] body, boolean fromCache) {

    /**
     * Cache entries hold JSON payloads only.
     */
    public static BufferedResponse cacheHit(String payload) {
        return new BufferedResponse(200, MediaType.APPLICATION_JSON,
                payload.getBytes(StandardCharsets.UTF_8), true);
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    public boolean isJson() {
        return contentType != null
                && ("json".equals(contentType.getSubtype()) || "json".equals(contentType.getSubtypeSuffix()));
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
