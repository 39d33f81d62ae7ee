package com.vcc.llmgateway.service;

import com.vcc.llmgateway.error.GatewayException;
import com.vcc.llmgateway.model.BufferedResponse;
import com.vcc.llmgateway.model.CompletionCommand;
import com.vcc.llmgateway.model.UpstreamCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Completion admission pipeline:
 * tenant -> credential -> budget -> rate -> cache (buffered only) -> provider -> settlement.
 *
 * The body has already passed schema validation when it arrives here. Budget
 * is kept once a response has been produced (provider errors and cache hits
 * included) and refunded when the request ends without one, including when
 * the caller goes away before anything reached it.
 */
@Service
public class AdmissionPipeline {
    private static final Logger log = LoggerFactory.getLogger(AdmissionPipeline.class);

    private final TenantResolver tenantResolver;
    private final CredentialValidator credentialValidator;
    private final QuotaGuard quotaGuard;
    private final ResponseCache responseCache;
    private final ProviderDispatcher dispatcher;
    private final StreamRelay streamRelay;

    public AdmissionPipeline(TenantResolver tenantResolver,
                             CredentialValidator credentialValidator,
                             QuotaGuard quotaGuard,
                             ResponseCache responseCache,
                             ProviderDispatcher dispatcher,
                             StreamRelay streamRelay) {
        this.tenantResolver = tenantResolver;
        this.credentialValidator = credentialValidator;
        this.quotaGuard = quotaGuard;
        this.responseCache = responseCache;
        this.dispatcher = dispatcher;
        this.streamRelay = streamRelay;
    }

    /**
     * Identity and quota stages. On success one budget reservation is held.
     */
    public Mono<Admission> admit(String tenantId, String authorizationHeader, CompletionCommand command) {
        return tenantResolver.resolve(tenantId)
                .flatMap(tenant -> credentialValidator.validate(authorizationHeader, tenantId)
                        .flatMap(identity -> quotaGuard.admit(identity, tenant)
                                .map(reservation -> new Admission(tenant, identity, command, reservation))));
    }

    /**
     * Buffered completion, served from the cache when it applies.
     */
    public Mono<BufferedResponse> completeBuffered(Admission admission) {
        CompletionCommand command = admission.command();
        Mono<BufferedResponse> dispatch = Mono.defer(() ->
                dispatcher.dispatchBuffered(dispatcher.prepare(admission.tenant(), command)));

        Mono<BufferedResponse> response = responseCache.applies(admission.tenant(), false, command.cacheKey())
                ? responseCache.getOrFetch(admission.tenant(), command.cacheKey(), () -> dispatch)
                : dispatch;

        return response
                .doOnNext(r -> quotaGuard.settle(admission.reservation()))
                .onErrorResume(e -> releaseAndFail(admission, e))
                .doOnCancel(() -> releaseAfterCancel(admission));
    }

    /**
     * Streamed completion. Provider resolution happens before the stream is
     * returned, so an unconfigured provider still fails as a plain error response.
     */
    public Mono<Flux<DataBuffer>> completeStreamed(Admission admission, String requestId) {
        UpstreamCall call;
        try {
            call = dispatcher.prepare(admission.tenant(), admission.command());
        } catch (GatewayException e) {
            return releaseAndFail(admission, e);
        }

        Mono<Void> release = quotaGuard.release(admission.reservation());
        AtomicBoolean delivered = new AtomicBoolean(false);
        Flux<DataBuffer> body = streamRelay
                .relay(dispatcher.dispatchStreamed(call), release, requestId)
                .doOnNext(chunk -> delivered.set(true))
                .doFinally(signal -> {
                    if (signal == SignalType.CANCEL && !delivered.get()) {
                        releaseAfterCancel(admission);
                    } else {
                        quotaGuard.settle(admission.reservation());
                    }
                });
        return Mono.just(body);
    }

    // Runs detached from the cancelled chain
    private void releaseAfterCancel(Admission admission) {
        String userId = admission.identity().getUserId();
        quotaGuard.release(admission.reservation())
                .subscribe(
                        ignored -> { },
                        e -> log.warn("Budget refund after cancel failed userId={}: {}", userId, e.getMessage()),
                        () -> log.debug("Caller cancelled before a response userId={}", userId));
    }

    private <T> Mono<T> releaseAndFail(Admission admission, Throwable e) {
        log.debug("Releasing budget userId={} after {}", admission.identity().getUserId(), e.toString());
        return quotaGuard.release(admission.reservation()).then(Mono.error(e));
    }
}
