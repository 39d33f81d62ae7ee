package com.vcc.llmgateway.service;

import com.vcc.llmgateway.error.ErrorKind;
import com.vcc.llmgateway.error.GatewayException;
import com.vcc.llmgateway.model.Identity;
import com.vcc.llmgateway.model.UserGroupPolicy;
import com.vcc.llmgateway.store.StateStore;
import com.vcc.llmgateway.store.StoreKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Fixed-window request counter per (tenant, user).
 * The window opens on the first request and closes when the counter key expires;
 * there is no explicit reset. Rejected requests still count against the window.
 */
@Service
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final StateStore store;
    private final StoreKeys keys;

    public RateLimiter(StateStore store, StoreKeys keys) {
        this.store = store;
        this.keys = keys;
    }

    /**
     * Count one request and fail if the window's limit is now exceeded.
     *
     * @return the post-increment count
     */
    public Mono<Long> tryConsume(Identity identity, UserGroupPolicy policy) {
        String key = keys.rateWindow(identity.getTenantId(), identity.getUserId());
        return store.incrementWindow(key, policy.window())
                .flatMap(count -> {
                    if (count > policy.rateLimit()) {
                        log.debug("Rate limit exceeded tenantId={} userId={} count={} limit={} window={}s",
                                identity.getTenantId(), identity.getUserId(), count,
                                policy.rateLimit(), policy.window().toSeconds());
                        return Mono.error(new GatewayException(ErrorKind.RATE_LIMIT_EXCEEDED, "Rate limit exceeded"));
                    }
                    return Mono.just(count);
                });
    }
}
