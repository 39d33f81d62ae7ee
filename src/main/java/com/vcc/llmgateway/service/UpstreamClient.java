package com.vcc.llmgateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.llmgateway.config.GwProperties;
import com.vcc.llmgateway.error.ErrorKind;
import com.vcc.llmgateway.error.GatewayException;
import com.vcc.llmgateway.model.BufferedResponse;
import com.vcc.llmgateway.model.UpstreamCall;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * HTTP client for upstream providers. No retries: one attempt per call.
 */
@Service
public class UpstreamClient {
    private static final Logger log = LoggerFactory.getLogger(UpstreamClient.class);

    static final String ANTHROPIC = "anthropic";
    static final String UNREACHABLE_MESSAGE = "Error connecting to provider";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String anthropicVersion;
    private final DataBufferFactory bufferFactory = DefaultDataBufferFactory.sharedInstance;

    @Autowired
    public UpstreamClient(WebClient.Builder builder, GwProperties properties, ObjectMapper objectMapper) {
        this(buildWebClient(builder, properties.getUpstream()), properties, objectMapper);
    }

    UpstreamClient(WebClient webClient, GwProperties properties, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.anthropicVersion = properties.getUpstream().getAnthropicVersion();
    }

    private static WebClient buildWebClient(WebClient.Builder builder, GwProperties.UpstreamConfig config) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, config.getConnectTimeoutMillis())
                .responseTimeout(Duration.ofSeconds(config.getResponseTimeoutSeconds()));
        log.info("UpstreamClient initialized connectTimeoutMillis={} responseTimeoutSeconds={}",
                config.getConnectTimeoutMillis(), config.getResponseTimeoutSeconds());
        return builder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();
    }

    /**
     * Issue the call and wait for the whole response. Status and body are kept verbatim.
     * An unreachable provider fails with {@link ErrorKind#UPSTREAM_UNREACHABLE}.
     */
    public Mono<BufferedResponse> exchange(UpstreamCall call) {
        return request(call, MediaType.APPLICATION_JSON)
                .exchangeToMono(clientResponse -> {
                    MediaType contentType = clientResponse.headers().contentType()
                            .orElse(MediaType.APPLICATION_JSON);
                    int status = clientResponse.statusCode().value();
                    return clientResponse.bodyToMono(byte[].class)
                            .defaultIfEmpty(new byte[0])
                            .map(body -> new BufferedResponse(status, contentType, body, false));
                })
                .doOnNext(response -> log.debug("Upstream responded tenantId={} provider={} status={} bytes={}",
                        call.tenantId(), call.providerName(), response.status(), response.body().length))
                .onErrorMap(WebClientRequestException.class, e -> unreachable(call, e));
    }

    /**
     * Issue a streaming call. Chunks are relayed as-is. A non-2xx reply becomes a
     * single SSE data frame holding the provider's error body; an unreachable
     * provider fails with {@link ErrorKind#UPSTREAM_UNREACHABLE}.
     */
    public Flux<DataBuffer> stream(UpstreamCall call) {
        return request(call, MediaType.TEXT_EVENT_STREAM)
                .exchangeToFlux(clientResponse -> {
                    if (clientResponse.statusCode().is2xxSuccessful()) {
                        return clientResponse.bodyToFlux(DataBuffer.class)
                                .doOnNext(buf -> log.trace("Received {} bytes", buf.readableByteCount()))
                                .doOnComplete(() -> log.debug("Upstream body completed"));
                    }
                    int status = clientResponse.statusCode().value();
                    return clientResponse.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> providerErrorFrame(status, body))
                            .flux();
                })
                .onErrorMap(WebClientRequestException.class, e -> unreachable(call, e));
    }

    private WebClient.RequestHeadersSpec<?> request(UpstreamCall call, MediaType accept) {
        return webClient
                .post()
                .uri(URI.create(call.endpoint().endpointUrl()))
                .headers(headers -> applyCredentials(headers, call))
                .contentType(MediaType.APPLICATION_JSON)
                .accept(accept)
                .bodyValue(call.payload());
    }

    private void applyCredentials(HttpHeaders headers, UpstreamCall call) {
        String apiKey = call.endpoint().apiKey();
        if (ANTHROPIC.equals(call.providerName())) {
            headers.set("x-api-key", apiKey);
            headers.set("anthropic-version", anthropicVersion);
        } else {
            headers.setBearerAuth(apiKey);
        }
    }

    private DataBuffer providerErrorFrame(int status, String body) {
        log.debug("Upstream stream rejected status={}", status);
        if (body.isBlank()) {
            return sseFrame(errorJson("Provider returned status " + status));
        }
        try {
            // Compact form: an SSE data line must not contain newlines
            return sseFrame(objectMapper.readTree(body).toString());
        } catch (JsonProcessingException e) {
            return sseFrame(errorJson(body.strip().replace('\n', ' ')));
        }
    }

    /**
     * {@code data: <payload>\n\n}
     */
    DataBuffer sseFrame(String payload) {
        return bufferFactory.wrap(("data: " + payload + "\n\n").getBytes(StandardCharsets.UTF_8));
    }

    String errorJson(String message) {
        try {
            return objectMapper.writeValueAsString(Map.of("error", Map.of("message", message)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render error frame", e);
        }
    }

    private GatewayException unreachable(UpstreamCall call, WebClientRequestException e) {
        log.warn("Upstream unreachable tenantId={} provider={} url={}: {}",
                call.tenantId(), call.providerName(), call.endpoint().endpointUrl(), e.getMessage());
        return new GatewayException(ErrorKind.UPSTREAM_UNREACHABLE, UNREACHABLE_MESSAGE, e);
    }
}
