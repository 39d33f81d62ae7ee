package com.vcc.llmgateway.service;

import com.vcc.llmgateway.error.GatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;

/**
 * Relays an upstream event stream to the caller and guarantees it ends with
 * exactly one {@code data: [DONE]} frame.
 *
 * Chunks are forwarded untouched. Nothing after the upstream's own sentinel is
 * forwarded; a missing sentinel is appended. A failure before the first chunk
 * becomes one error frame.
 */
@Component
public class StreamRelay {
    private static final Logger log = LoggerFactory.getLogger(StreamRelay.class);

    private static final Pattern SENTINEL = Pattern.compile("data: ?\\[DONE\\]");
    // Longest sentinel text, minus one: enough overlap to catch a split across chunks
    private static final int TAIL_LENGTH = "data: [DONE]".length() - 1;

    private final UpstreamClient upstreamClient;

    public StreamRelay(UpstreamClient upstreamClient) {
        this.upstreamClient = upstreamClient;
    }

    /**
     * @param upstream       raw upstream chunks
     * @param onEarlyFailure runs when the upstream fails before producing any chunk
     * @param requestId      for log correlation
     */
    public Flux<DataBuffer> relay(Flux<DataBuffer> upstream, Mono<Void> onEarlyFailure, String requestId) {
        return Flux.defer(() -> {
            SentinelScanner scanner = new SentinelScanner();
            AtomicBoolean started = new AtomicBoolean(false);

            Flux<DataBuffer> body = upstream
                    .doOnNext(chunk -> started.set(true))
                    .takeUntil(scanner::consume)
                    .onErrorResume(e -> {
                        if (!started.get()) {
                            String message = e instanceof GatewayException
                                    ? ((GatewayException) e).getReason()
                                    : UpstreamClient.UNREACHABLE_MESSAGE;
                            log.warn("requestId={} upstream stream failed before first chunk: {}",
                                    requestId, e.getMessage());
                            return onEarlyFailure.thenMany(
                                    Mono.fromSupplier(() -> upstreamClient.sseFrame(upstreamClient.errorJson(message))));
                        }
                        log.warn("requestId={} upstream stream interrupted: {}", requestId, e.getMessage());
                        return Mono.fromSupplier(() ->
                                upstreamClient.sseFrame(upstreamClient.errorJson("Upstream stream interrupted")));
                    });

            return body
                    .concatWith(Mono.fromSupplier(() -> scanner.isSeen() ? null : sentinel()))
                    .doOnCancel(() -> log.info("event=upstream_cancelled requestId={}", requestId));
        });
    }

    private DataBuffer sentinel() {
        return upstreamClient.sseFrame("[DONE]");
    }

    /**
     * Tracks whether the sentinel has passed, including across chunk boundaries.
     * Scans bytes as ISO-8859-1 so every byte maps to one char.
     */
    static final class SentinelScanner {
        private String tail = "";
        private boolean seen;

        boolean consume(DataBuffer chunk) {
            String text = chunk.toString(chunk.readPosition(), chunk.readableByteCount(), StandardCharsets.ISO_8859_1);
            String window = tail + text;
            if (!seen && SENTINEL.matcher(window).find()) {
                seen = true;
            }
            tail = window.substring(Math.max(0, window.length() - TAIL_LENGTH));
            return seen;
        }

        boolean isSeen() {
            return seen;
        }
    }
}
