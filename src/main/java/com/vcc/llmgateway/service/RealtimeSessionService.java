package com.vcc.llmgateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.llmgateway.config.GwProperties;
import com.vcc.llmgateway.dto.RealtimeFrame;
import com.vcc.llmgateway.dto.RealtimeInitRequest;
import com.vcc.llmgateway.dto.RealtimeInitResponse;
import com.vcc.llmgateway.dto.RealtimeReply;
import com.vcc.llmgateway.error.ErrorKind;
import com.vcc.llmgateway.error.GatewayException;
import com.vcc.llmgateway.model.HistoryEntry;
import com.vcc.llmgateway.model.SessionId;
import com.vcc.llmgateway.model.SessionState;
import com.vcc.llmgateway.store.StateStore;
import com.vcc.llmgateway.store.StoreJson;
import com.vcc.llmgateway.store.StoreKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.function.Function;

/**
 * Realtime session lifecycle: creation, lookup on connection, and one
 * request/reply exchange per inbound frame.
 *
 * Sessions are never deleted here; records expire by external retention.
 */
@Service
public class RealtimeSessionService {
    private static final Logger log = LoggerFactory.getLogger(RealtimeSessionService.class);

    static final String AUDIO_INPUT_PLACEHOLDER = "[audio input]";
    static final String AUDIO_OUTPUT_PLACEHOLDER = "[audio output]";

    private final TenantResolver tenantResolver;
    private final RealtimeBackend backend;
    private final StateStore store;
    private final StoreKeys keys;
    private final StoreJson json;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final List<String> allowedBackends;
    private final String streamPath;
    private final long exchangeCost;

    public RealtimeSessionService(TenantResolver tenantResolver,
                                  RealtimeBackend backend,
                                  StateStore store,
                                  StoreKeys keys,
                                  StoreJson json,
                                  ObjectMapper objectMapper,
                                  Clock clock,
                                  GwProperties properties) {
        this.tenantResolver = tenantResolver;
        this.backend = backend;
        this.store = store;
        this.keys = keys;
        this.json = json;
        this.objectMapper = objectMapper;
        this.clock = clock;
        GwProperties.RealtimeConfig config = properties.getRealtime();
        this.allowedBackends = List.copyOf(config.getAllowedBackends());
        this.streamPath = config.getStreamPath();
        this.exchangeCost = config.getExchangeCost();
        log.info("RealtimeSessionService initialized allowedBackends={} streamPath={}", allowedBackends, streamPath);
    }

    /**
     * Create a session for a tenant.
     *
     * @param tenantId    value of the {@code X-Tenant-Id} header
     * @param request     initialize body
     * @param socketBase  scheme and authority for the connection URL, e.g. {@code ws://host:8080}
     */
    public Mono<RealtimeInitResponse> initialize(String tenantId, RealtimeInitRequest request, String socketBase) {
        if (tenantId == null || tenantId.isBlank()) {
            return Mono.error(new GatewayException(ErrorKind.MISSING_TENANT_HEADER, "X-Tenant-Id header is required"));
        }
        String requestedBackend = request != null ? request.backend() : null;
        if (requestedBackend == null || !allowedBackends.contains(requestedBackend)) {
            return Mono.error(new GatewayException(ErrorKind.UNSUPPORTED_BACKEND,
                    "Invalid backend. Must be one of: " + String.join(", ", allowedBackends)));
        }

        return tenantResolver.resolve(tenantId)
                .onErrorMap(GatewayException.class, e -> e.getKind() == ErrorKind.UNKNOWN_TENANT
                        ? e.withStatus(HttpStatus.NOT_FOUND)
                        : e)
                .then(tenantBudget(tenantId))
                .flatMap(budget -> {
                    if (budget < 1) {
                        return Mono.error(new GatewayException(
                                ErrorKind.INSUFFICIENT_BUDGET, "Insufficient token balance"));
                    }
                    return createSession(tenantId, request, socketBase, budget);
                });
    }

    private Mono<RealtimeInitResponse> createSession(String tenantId, RealtimeInitRequest request,
                                                     String socketBase, long budget) {
        SessionId sessionId = SessionId.mint(tenantId);
        SessionState state = new SessionState(
                request.backend(),
                request.systemPrompt(),
                request.tools(),
                request.ttsService(),
                request.cacheKey(),
                0,
                clock.instant());
        String stateKey = keys.sessionState(tenantId, sessionId.value());
        String historyKey = keys.sessionHistory(tenantId, sessionId.value());

        return json.write(state)
                .flatMap(value -> store.set(stateKey, value))
                .then(store.delete(historyKey))
                .then(Mono.fromSupplier(() -> {
                    log.info("event=session_created sessionId={} backend={}", sessionId, request.backend());
                    String connectionUrl = socketBase + streamPath + "?sid=" + sessionId.value();
                    return new RealtimeInitResponse(sessionId.value(), connectionUrl, budget);
                }));
    }

    /**
     * @return the session state, or empty if no record exists
     */
    public Mono<SessionState> findSession(SessionId sessionId) {
        String key = keys.sessionState(sessionId.tenantId(), sessionId.value());
        return store.get(key).flatMap(raw -> json.read(key, raw, SessionState.class));
    }

    /**
     * Process one raw inbound frame. Never fails: problems become error replies.
     * For a valid frame: user entry, backend reply, assistant entry, usage update.
     */
    public Mono<RealtimeReply> exchange(SessionId sessionId, String rawFrame) {
        RealtimeFrame frame;
        try {
            frame = objectMapper.readValue(rawFrame, RealtimeFrame.class);
        } catch (JsonProcessingException e) {
            log.debug("Unparsable frame sessionId={}: {}", sessionId, e.getOriginalMessage());
            return Mono.just(RealtimeReply.error("Failed to process message"));
        }
        if (frame == null || !(frame.isText() || frame.isAudio())) {
            String type = frame != null ? frame.inputType() : null;
            return Mono.just(RealtimeReply.error("Unsupported input type: " + type));
        }
        if (frame.data() == null) {
            return Mono.just(RealtimeReply.error("data must be a string"));
        }

        return findSession(sessionId)
                .flatMap(state -> respond(sessionId, state, frame))
                .switchIfEmpty(Mono.fromSupplier(() -> RealtimeReply.error("Session expired")))
                .onErrorResume(e -> {
                    log.error("Realtime exchange failed sessionId={}", sessionId, e);
                    return Mono.just(RealtimeReply.error("Failed to process message"));
                });
    }

    private Mono<RealtimeReply> respond(SessionId sessionId, SessionState state, RealtimeFrame frame) {
        String userContent = frame.isAudio() ? AUDIO_INPUT_PLACEHOLDER : frame.data();
        return appendHistory(sessionId, new HistoryEntry("user", frame.inputType(), userContent, clock.millis()))
                .then(backend.reply(state, frame))
                .flatMap(reply -> {
                    String assistantContent = frame.isAudio() ? AUDIO_OUTPUT_PLACEHOLDER : reply.data();
                    return appendHistory(sessionId,
                                    new HistoryEntry("assistant", reply.outputType(), assistantContent, clock.millis()))
                            .then(updateState(sessionId, s -> s.withTokensUsed(s.tokensUsed() + exchangeCost)))
                            .thenReturn(reply);
                });
    }

    private Mono<Long> appendHistory(SessionId sessionId, HistoryEntry entry) {
        return json.write(entry)
                .flatMap(value -> store.appendToList(keys.sessionHistory(sessionId.tenantId(), sessionId.value()), value));
    }

    // Read-modify-write: frames of one connection are processed one at a time
    private Mono<Boolean> updateState(SessionId sessionId, Function<SessionState, SessionState> change) {
        String key = keys.sessionState(sessionId.tenantId(), sessionId.value());
        return findSession(sessionId)
                .map(change)
                .flatMap(json::write)
                .flatMap(value -> store.set(key, value));
    }

    /**
     * Tenant-level budget for realtime sessions; absent means none.
     */
    private Mono<Long> tenantBudget(String tenantId) {
        return store.get(keys.tenantBudget(tenantId))
                .map(raw -> {
                    try {
                        return Long.parseLong(raw.trim());
                    } catch (NumberFormatException e) {
                        log.warn("Non-numeric tenant budget tenantId={} value={}", tenantId, raw);
                        return 0L;
                    }
                })
                .defaultIfEmpty(0L);
    }
}
