package com.vcc.llmgateway.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Upstream provider coordinates for a tenant.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderEndpoint(
        String endpointUrl,
        String defaultModel,
        String apiKey
) {

    /**
     * A provider is usable only with both a URL and a key.
     */
    @JsonIgnore
    public boolean isConfigured() {
        return endpointUrl != null && !endpointUrl.isBlank()
                && apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String toString() {
        return "ProviderEndpoint{endpointUrl='" + endpointUrl + "', defaultModel='" + defaultModel
                + "', apiKey=" + (apiKey != null ? "****" : "null") + '}';
    }
}
