package com.vcc.llmgateway.service;

import com.vcc.llmgateway.config.GwProperties;
import com.vcc.llmgateway.model.BufferedResponse;
import com.vcc.llmgateway.model.TenantConfig;
import com.vcc.llmgateway.store.StateStore;
import com.vcc.llmgateway.store.StoreKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Cache of non-streaming responses keyed by (tenant, caller cache key).
 *
 * Concurrent misses for one key share a single upstream fetch: the first caller
 * registers the fetch, later callers await its result. Only successful JSON
 * responses are stored, with the tenant's TTL, so a hit is always served as
 * {@code application/json}.
 */
@Service
public class ResponseCache {
    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    private final StateStore store;
    private final StoreKeys keys;
    private final long fallbackTtlSeconds;

    // Store key -> shared fetch in progress
    private final Map<String, Mono<BufferedResponse>> inFlight = new ConcurrentHashMap<>();

    public ResponseCache(StateStore store, StoreKeys keys, GwProperties properties) {
        this.store = store;
        this.keys = keys;
        this.fallbackTtlSeconds = properties.getCache().getDefaultTtlSeconds();
    }

    /**
     * Streaming requests, requests without a key and tenants with caching
     * disabled never touch the cache.
     */
    public boolean applies(TenantConfig tenant, boolean stream, String cacheKey) {
        return !stream
                && cacheKey != null && !cacheKey.isEmpty()
                && tenant.caching().enabled();
    }

    /**
     * Return the cached payload, or run {@code fetch} (at most once per key at a time)
     * and store its result if successful.
     */
    public Mono<BufferedResponse> getOrFetch(TenantConfig tenant, String cacheKey,
                                             Supplier<Mono<BufferedResponse>> fetch) {
        String storeKey = keys.cacheEntry(tenant.tenantId(), cacheKey);
        Duration ttl = tenant.caching().ttl(fallbackTtlSeconds);
        return cached(tenant.tenantId(), storeKey, cacheKey)
                .switchIfEmpty(Mono.defer(() -> sharedFetch(tenant.tenantId(), storeKey, cacheKey, ttl, fetch)));
    }

    /**
     * Number of fetches currently registered.
     */
    int inFlightCount() {
        return inFlight.size();
    }

    private Mono<BufferedResponse> cached(String tenantId, String storeKey, String cacheKey) {
        return store.get(storeKey)
                .map(payload -> {
                    log.info("event=cache_hit tenantId={} cacheKey={}", tenantId, cacheKey);
                    return BufferedResponse.cacheHit(payload);
                });
    }

    private Mono<BufferedResponse> sharedFetch(String tenantId, String storeKey, String cacheKey, Duration ttl,
                                               Supplier<Mono<BufferedResponse>> fetch) {
        return inFlight.computeIfAbsent(storeKey, k -> {
            log.debug("Cache miss, fetching cacheKey={}", cacheKey);
            // A fetch that finished after our first read has already stored its result
            return cached(tenantId, k, cacheKey)
                    .switchIfEmpty(Mono.defer(fetch)
                            .flatMap(response -> storeIfSuccessful(k, cacheKey, response, ttl)))
                    .doFinally(signal -> inFlight.remove(k))
                    .cache();
        });
    }

    private Mono<BufferedResponse> storeIfSuccessful(String storeKey, String cacheKey,
                                                     BufferedResponse response, Duration ttl) {
        if (!response.isSuccessful() || !response.isJson()) {
            return Mono.just(response);
        }
        return store.set(storeKey, response.bodyAsString(), ttl)
                .doOnSuccess(ok -> log.info("event=cache_miss_stored cacheKey={} ttlSeconds={}",
                        cacheKey, ttl.toSeconds()))
                .onErrorResume(e -> {
                    log.warn("Failed to cache response cacheKey={}: {}", cacheKey, e.getMessage());
                    return Mono.just(false);
                })
                .thenReturn(response);
    }
}
