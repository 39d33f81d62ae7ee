package com.vcc.llmgateway.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vcc.llmgateway.config.GwProperties;
import com.vcc.llmgateway.error.ErrorKind;
import com.vcc.llmgateway.error.GatewayException;
import com.vcc.llmgateway.model.ProviderEndpoint;
import com.vcc.llmgateway.model.UpstreamCall;
import com.vcc.llmgateway.support.GatewayFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class UpstreamClientTest {

    private static final String URL = "http://provider.test/v1/chat/completions";

    private final ObjectMapper objectMapper = GatewayFixture.objectMapper();
    private final AtomicReference<ClientRequest> captured = new AtomicReference<>();

    private GwProperties properties;

    @BeforeEach
    void setUp() {
        properties = new GwProperties();
    }

    @Test
    void bufferedResponseIsRelayedVerbatimWithBearerAuth() {
        UpstreamClient client = client(request -> Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body("{\"id\":\"cmpl-1\"}")
                .build()));

        StepVerifier.create(client.exchange(call("openai", false)))
                .assertNext(response -> {
                    assertEquals(200, response.status());
                    assertEquals("{\"id\":\"cmpl-1\"}", response.bodyAsString());
                    assertFalse(response.fromCache());
                })
                .verifyComplete();

        ClientRequest request = captured.get();
        assertEquals(HttpMethod.POST, request.method());
        assertEquals(URI.create(URL), request.url());
        assertEquals("Bearer sk-test", request.headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void anthropicProviderUsesApiKeyHeaders() {
        UpstreamClient client = client(request -> Mono.just(ClientResponse.create(HttpStatus.OK).body("{}").build()));

        StepVerifier.create(client.exchange(call(UpstreamClient.ANTHROPIC, false)))
                .expectNextCount(1)
                .verifyComplete();

        HttpHeaders headers = captured.get().headers();
        assertEquals("sk-test", headers.getFirst("x-api-key"));
        assertEquals("2023-06-01", headers.getFirst("anthropic-version"));
        assertNull(headers.getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void providerErrorStatusAndBodyPassThrough() {
        UpstreamClient client = client(request -> Mono.just(ClientResponse.create(HttpStatus.UNAUTHORIZED)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body("{\"error\":{\"message\":\"Incorrect API key\"}}")
                .build()));

        StepVerifier.create(client.exchange(call("openai", false)))
                .assertNext(response -> {
                    assertEquals(401, response.status());
                    assertTrue(response.bodyAsString().contains("Incorrect API key"));
                })
                .verifyComplete();
    }

    @Test
    void unreachableProviderIsReportedAsUpstreamFailure() {
        UpstreamClient client = client(request -> Mono.error(new WebClientRequestException(
                new ConnectException("Connection refused"), HttpMethod.POST, URI.create(URL), new HttpHeaders())));

        StepVerifier.create(client.exchange(call("openai", false)))
                .expectErrorSatisfies(e -> {
                    assertTrue(e instanceof GatewayException);
                    assertEquals(ErrorKind.UPSTREAM_UNREACHABLE, ((GatewayException) e).getKind());
                    assertEquals("Error connecting to provider", ((GatewayException) e).getReason());
                })
                .verify();
    }

    @Test
    void streamedProviderErrorBecomesSingleCompactFrame() {
        UpstreamClient client = client(request -> Mono.just(ClientResponse.create(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body("{\n  \"error\": {\"message\": \"slow down\"}\n}")
                .build()));

        StepVerifier.create(client.stream(call("openai", true))
                        .map(buf -> buf.toString(StandardCharsets.UTF_8)))
                .expectNext("data: {\"error\":{\"message\":\"slow down\"}}\n\n")
                .verifyComplete();
    }

    @Test
    void streamedChunksAreRelayedAsIs() {
        UpstreamClient client = client(request -> Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_EVENT_STREAM_VALUE)
                .body("data: {\"delta\":\"Hi\"}\n\ndata: [DONE]\n\n")
                .build()));

        String joined = client.stream(call("openai", true))
                .map(buf -> buf.toString(StandardCharsets.UTF_8))
                .reduce("", String::concat)
                .block();

        assertEquals("data: {\"delta\":\"Hi\"}\n\ndata: [DONE]\n\n", joined);
        assertEquals(MediaType.TEXT_EVENT_STREAM_VALUE, captured.get().headers().getFirst(HttpHeaders.ACCEPT));
    }

    private UpstreamClient client(ExchangeFunction exchange) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    captured.set(request);
                    return exchange.exchange(request);
                })
                .build();
        return new UpstreamClient(webClient, properties, objectMapper);
    }

    private UpstreamCall call(String provider, boolean stream) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.putArray("messages").addObject().put("role", "user").put("content", "Hi");
        payload.put("stream", stream);
        ProviderEndpoint endpoint = new ProviderEndpoint(URL, "gpt-3.5-turbo", "sk-test");
        return new UpstreamCall("abc", provider, endpoint, "gpt-3.5-turbo", payload, stream);
    }
}
