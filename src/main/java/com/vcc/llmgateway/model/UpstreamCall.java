package com.vcc.llmgateway.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A single upstream attempt: which provider, and the exact JSON to send.
 */
public record UpstreamCall(
        String tenantId,
        String providerName,
        ProviderEndpoint endpoint,
        String model,
        ObjectNode payload,
        boolean stream
) {
}
