package com.vcc.llmgateway.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.llmgateway.dto.RealtimeReply;
import com.vcc.llmgateway.model.SessionId;
import com.vcc.llmgateway.service.RealtimeSessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * WebSocket endpoint for realtime sessions.
 *
 * The {@code sid} query parameter must name an existing session, otherwise the
 * connection is closed with 1008 before any frame is read. Frames of one
 * connection are handled strictly in order; frames still pending when the
 * connection closes are dropped.
 */
@Component
public class RealtimeStreamHandler implements WebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(RealtimeStreamHandler.class);

    static final String SESSION_PARAM = "sid";

    private final RealtimeSessionService sessionService;
    private final ObjectMapper objectMapper;

    public RealtimeStreamHandler(RealtimeSessionService sessionService, ObjectMapper objectMapper) {
        this.sessionService = sessionService;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String rawSid = sessionParam(session.getHandshakeInfo().getUri());
        if (rawSid == null) {
            return reject(session, "Missing session ID");
        }
        Optional<SessionId> parsed = SessionId.parse(rawSid);
        if (parsed.isEmpty()) {
            return reject(session, "Invalid session ID format");
        }
        SessionId sessionId = parsed.get();

        return sessionService.findSession(sessionId)
                .hasElement()
                .onErrorResume(e -> {
                    log.error("Session lookup failed sessionId={}", sessionId, e);
                    return Mono.just(false);
                })
                .flatMap(exists -> exists
                        ? messageLoop(session, sessionId)
                        : reject(session, "Invalid or expired session"));
    }

    private Mono<Void> messageLoop(WebSocketSession session, SessionId sessionId) {
        log.info("Realtime connection accepted sessionId={} connection={}", sessionId, session.getId());

        Flux<WebSocketMessage> replies = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .concatMap(frame -> sessionService.exchange(sessionId, frame))
                // Stop, discarding queued frames, as soon as the socket closes
                .takeUntilOther(session.closeStatus())
                .map(reply -> session.textMessage(toJson(reply)));

        return session.send(replies)
                .doFinally(signal -> log.info("event=session_closed sessionId={} connection={} signal={}",
                        sessionId, session.getId(), signal));
    }

    private Mono<Void> reject(WebSocketSession session, String reason) {
        log.info("Realtime connection rejected connection={} reason={}", session.getId(), reason);
        return session.close(CloseStatus.POLICY_VIOLATION.withReason(reason));
    }

    private String toJson(RealtimeReply reply) {
        try {
            return objectMapper.writeValueAsString(reply);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize realtime reply", e);
        }
    }

    static String sessionParam(URI uri) {
        if (uri == null) {
            return null;
        }
        String value = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst(SESSION_PARAM);
        return value != null ? UriUtils.decode(value, StandardCharsets.UTF_8) : null;
    }
}
