package com.vcc.llmgateway.service;

import com.vcc.llmgateway.error.ErrorKind;
import com.vcc.llmgateway.error.GatewayException;
import com.vcc.llmgateway.model.Identity;
import com.vcc.llmgateway.model.TenantConfig;
import com.vcc.llmgateway.model.UserGroupPolicy;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Budget check, then rate check. Both failures are terminal.
 * A rate rejection refunds the budget reservation but keeps its window increment.
 */
@Service
public class QuotaGuard {

    private final TokenMeter tokenMeter;
    private final RateLimiter rateLimiter;

    public QuotaGuard(TokenMeter tokenMeter, RateLimiter rateLimiter) {
        this.tokenMeter = tokenMeter;
        this.rateLimiter = rateLimiter;
    }

    public Mono<BudgetReservation> admit(Identity identity, TenantConfig tenant) {
        UserGroupPolicy policy = tenant.groupPolicy(identity.getGroup());
        if (policy == null) {
            return Mono.error(new GatewayException(ErrorKind.UNKNOWN_GROUP, "User group not configured"));
        }
        return tokenMeter.reserve(identity)
                .flatMap(reservation -> rateLimiter.tryConsume(identity, policy)
                        .thenReturn(reservation)
                        .onErrorResume(e -> tokenMeter.release(reservation).then(Mono.error(e))));
    }

    public void settle(BudgetReservation reservation) {
        tokenMeter.settle(reservation);
    }

    public Mono<Void> release(BudgetReservation reservation) {
        return tokenMeter.release(reservation);
    }
}
