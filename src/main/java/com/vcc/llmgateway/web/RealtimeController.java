package com.vcc.llmgateway.web;

import com.vcc.llmgateway.dto.RealtimeInitRequest;
import com.vcc.llmgateway.dto.RealtimeInitResponse;
import com.vcc.llmgateway.service.RealtimeSessionService;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * Realtime session initialization. The session itself is served by
 * {@link RealtimeStreamHandler} over a WebSocket.
 */
@RestController
@RequestMapping("/v1/realtime")
public class RealtimeController {

    static final String TENANT_HEADER = "X-Tenant-Id";

    private final RealtimeSessionService sessionService;

    public RealtimeController(RealtimeSessionService sessionService) {
        this.sessionService = sessionService;
    }

    /**
     * Create a session.
     * POST /v1/realtime/initialize
     */
    @PostMapping(path = "/initialize", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<RealtimeInitResponse> initialize(
            @RequestHeader(name = TENANT_HEADER, required = false) String tenantId,
            @RequestBody(required = false) RealtimeInitRequest body,
            ServerHttpRequest request
    ) {
        return sessionService.initialize(tenantId, body, socketBase(request.getURI()));
    }

    /**
     * ws://host[:port] for plain HTTP, wss:// otherwise.
     */
    static String socketBase(URI uri) {
        String scheme = "https".equalsIgnoreCase(uri.getScheme()) ? "wss" : "ws";
        return scheme + "://" + uri.getRawAuthority();
    }
}
