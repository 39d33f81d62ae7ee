package com.vcc.llmgateway.service;

import com.vcc.llmgateway.config.GwProperties;
import com.vcc.llmgateway.error.ErrorKind;
import com.vcc.llmgateway.error.GatewayException;
import com.vcc.llmgateway.model.Identity;
import com.vcc.llmgateway.store.FieldAdjustment;
import com.vcc.llmgateway.store.StateStore;
import com.vcc.llmgateway.store.StoreKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Remaining-budget meter for credentials.
 *
 * The check and the decrement are one conditional store operation, so concurrent
 * requests on one credential can never jointly take more than its budget.
 * Units taken by {@link #reserve} are given back by {@link #release} when the
 * request ends without a response.
 */
@Service
public class TokenMeter {
    private static final Logger log = LoggerFactory.getLogger(TokenMeter.class);

    static final String BUDGET_FIELD = "remainingBudget";

    private final StateStore store;
    private final StoreKeys keys;
    private final long requestCost;

    public TokenMeter(StateStore store, StoreKeys keys, GwProperties properties) {
        this.store = store;
        this.keys = keys;
        this.requestCost = Math.max(1, properties.getQuota().getRequestCost());
        log.info("TokenMeter initialized with requestCost={}", requestCost);
    }

    public Mono<BudgetReservation> reserve(Identity identity) {
        return store.adjustField(keys.credential(identity.getToken()), BUDGET_FIELD, -requestCost, 0)
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("Store returned no adjustment result")))
                .flatMap(result -> {
                    if (result.isApplied()) {
                        return Mono.just(new BudgetReservation(identity, requestCost, result.value()));
                    }
                    if (result.outcome() == FieldAdjustment.Outcome.MISSING) {
                        // Credential removed between validation and reservation
                        return Mono.error(new GatewayException(
                                ErrorKind.INVALID_CREDENTIAL, "Invalid authorization token"));
                    }
                    log.debug("Insufficient budget tenantId={} userId={} remaining={}",
                            identity.getTenantId(), identity.getUserId(), result.value());
                    return Mono.error(new GatewayException(ErrorKind.INSUFFICIENT_BUDGET, "Insufficient tokens"));
                });
    }

    /**
     * Keep the reserved units: a response was produced.
     */
    public void settle(BudgetReservation reservation) {
        if (reservation.close()) {
            log.debug("Settled {} unit(s) userId={} remaining={}",
                    reservation.getUnits(), reservation.getIdentity().getUserId(), reservation.getRemainingAfter());
        }
    }

    /**
     * Refund the reserved units on subscription. No-op if the reservation already ended.
     */
    public Mono<Void> release(BudgetReservation reservation) {
        return Mono.defer(() -> {
            if (!reservation.close()) {
                return Mono.empty();
            }
            Identity identity = reservation.getIdentity();
            return store.adjustField(keys.credential(identity.getToken()), BUDGET_FIELD,
                            reservation.getUnits(), Long.MIN_VALUE)
                    .doOnNext(result -> log.debug("Released {} unit(s) userId={} outcome={}",
                            reservation.getUnits(), identity.getUserId(), result.outcome()))
                    .onErrorResume(e -> {
                        log.error("Failed to release budget userId={}: {}", identity.getUserId(), e.getMessage());
                        return Mono.empty();
                    })
                    .then();
        });
    }
}
