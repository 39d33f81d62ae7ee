package com.vcc.llmgateway.service;

import com.vcc.llmgateway.dto.RealtimeFrame;
import com.vcc.llmgateway.dto.RealtimeReply;
import com.vcc.llmgateway.model.SessionState;
import reactor.core.publisher.Mono;

/**
 * Produces the reply for one validated realtime frame.
 */
public interface RealtimeBackend {

    Mono<RealtimeReply> reply(SessionState state, RealtimeFrame frame);
}
