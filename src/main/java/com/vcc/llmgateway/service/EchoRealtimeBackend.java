package com.vcc.llmgateway.service;

import com.vcc.llmgateway.dto.RealtimeFrame;
import com.vcc.llmgateway.dto.RealtimeReply;
import com.vcc.llmgateway.model.SessionState;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Stand-in backend: answers text with a greeting that quotes the input and
 * echoes audio payloads back unchanged.
 */
@Component
public class EchoRealtimeBackend implements RealtimeBackend {

    @Override
    public Mono<RealtimeReply> reply(SessionState state, RealtimeFrame frame) {
        if (frame.isAudio()) {
            return Mono.just(RealtimeReply.audio(frame.data()));
        }
        return Mono.just(RealtimeReply.text("Hello back! You sent: " + frame.data()));
    }
}
