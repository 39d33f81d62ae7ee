package com.vcc.llmgateway.web;

import com.vcc.llmgateway.service.EchoRealtimeBackend;
import com.vcc.llmgateway.service.RealtimeSessionService;
import com.vcc.llmgateway.service.TenantResolver;
import com.vcc.llmgateway.support.GatewayFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

class RealtimeControllerTest {

    private static final String URL = "http://localhost:8080/v1/realtime/initialize";

    private GatewayFixture fixture;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        fixture = new GatewayFixture().seedTenant(GatewayFixture.tenant());
        fixture.store.put(fixture.keys.tenantBudget("abc"), "100");
        TenantResolver resolver = new TenantResolver(fixture.store, fixture.keys, fixture.json);
        RealtimeSessionService service = new RealtimeSessionService(resolver, new EchoRealtimeBackend(),
                fixture.store, fixture.keys, fixture.json, fixture.objectMapper, fixture.clock, fixture.properties);

        client = WebTestClient.bindToController(new RealtimeController(service))
                .controllerAdvice(new GatewayExceptionHandler())
                .build();
    }

    @Test
    void initializeReturnsSessionAndConnectionUrl() {
        client.post().uri(URL)
                .header(RealtimeController.TENANT_HEADER, "abc")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"backend\":\"openai_realtime\",\"systemPrompt\":\"Be brief\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.sessionId").value(id -> assertTrue(((String) id).startsWith("tenant:abc:session:")))
                .jsonPath("$.connectionUrl").value(url ->
                        assertTrue(((String) url).startsWith("ws://localhost:8080/v1/realtime/stream?sid=tenant:abc:")))
                .jsonPath("$.remainingBudget").isEqualTo(100);
    }

    @Test
    void unknownBackendIsBadRequest() {
        client.post().uri(URL)
                .header(RealtimeController.TENANT_HEADER, "abc")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"backend\":\"unknown\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.code").isEqualTo("unsupported_backend")
                .jsonPath("$.error.message").isEqualTo("Invalid backend. Must be one of: openai_realtime, ultravox");
    }

    @Test
    void missingTenantHeaderIsBadRequest() {
        client.post().uri(URL)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"backend\":\"ultravox\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody().jsonPath("$.error.code").isEqualTo("missing_tenant_header");
    }

    @Test
    void unknownTenantIsNotFound() {
        client.post().uri(URL)
                .header(RealtimeController.TENANT_HEADER, "nope")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"backend\":\"ultravox\"}")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void exhaustedTenantBudgetIsTooManyRequests() {
        fixture.store.put(fixture.keys.tenantBudget("abc"), "0");

        client.post().uri(URL)
                .header(RealtimeController.TENANT_HEADER, "abc")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"backend\":\"ultravox\"}")
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.TOO_MANY_REQUESTS)
                .expectBody().jsonPath("$.error.message").isEqualTo("Insufficient token balance");
    }

    @Test
    void socketBaseFollowsRequestScheme() {
        assertEquals("ws://gw.example:8080", RealtimeController.socketBase(URI.create("http://gw.example:8080/x")));
        assertEquals("wss://gw.example", RealtimeController.socketBase(URI.create("https://gw.example/x")));
    }
}
