package com.vcc.llmgateway.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vcc.llmgateway.error.ErrorKind;
import com.vcc.llmgateway.error.GatewayException;
import com.vcc.llmgateway.model.BufferedResponse;
import com.vcc.llmgateway.model.CompletionCommand;
import com.vcc.llmgateway.model.ProviderEndpoint;
import com.vcc.llmgateway.model.TenantConfig;
import com.vcc.llmgateway.model.UpstreamCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Picks the tenant's provider, shapes the upstream body and hands it to the
 * {@link UpstreamClient}. Exactly one upstream attempt per request.
 */
@Service
public class ProviderDispatcher {
    private static final Logger log = LoggerFactory.getLogger(ProviderDispatcher.class);

    private final UpstreamClient upstreamClient;
    private final ObjectMapper objectMapper;

    public ProviderDispatcher(UpstreamClient upstreamClient, ObjectMapper objectMapper) {
        this.upstreamClient = upstreamClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Resolve the provider and build the upstream call.
     *
     * @throws GatewayException {@link ErrorKind#PROVIDER_UNCONFIGURED} if the tenant has no usable key
     */
    public UpstreamCall prepare(TenantConfig tenant, CompletionCommand command) {
        String providerName = tenant.effectiveProviderName();
        ProviderEndpoint endpoint = providerName != null ? tenant.providers().get(providerName) : null;
        if (endpoint == null || !endpoint.isConfigured()) {
            log.warn("Provider unconfigured tenantId={} provider={}", tenant.tenantId(), providerName);
            throw new GatewayException(ErrorKind.PROVIDER_UNCONFIGURED,
                    "Provider API key missing in tenant configuration");
        }

        String requested = command.request().model();
        String model = requested != null && !requested.isBlank() ? requested : endpoint.defaultModel();

        ObjectNode payload = objectMapper.createObjectNode();
        payload.set("messages", command.messages());
        if (model != null) {
            payload.put("model", model);
        }
        payload.put("stream", command.isStream());

        return new UpstreamCall(tenant.tenantId(), providerName, endpoint, model, payload, command.isStream());
    }

    public Mono<BufferedResponse> dispatchBuffered(UpstreamCall call) {
        return upstreamClient.exchange(call);
    }

    public Flux<DataBuffer> dispatchStreamed(UpstreamCall call) {
        return upstreamClient.stream(call);
    }
}
