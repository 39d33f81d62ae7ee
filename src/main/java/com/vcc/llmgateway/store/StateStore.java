package com.vcc.llmgateway.store;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Shared key-value store with per-key TTL, atomic counters and append-only lists.
 * Every mutation that several requests may race on is a single atomic call here;
 * callers never serialize at the application level.
 */
public interface StateStore {

    /**
     * @return the value, or empty if the key is absent or expired
     */
    Mono<String> get(String key);

    Mono<Boolean> set(String key, String value);

    Mono<Boolean> set(String key, String value, Duration ttl);

    /**
     * @return true if the value was written, false if the key already existed
     */
    Mono<Boolean> setIfAbsent(String key, String value);

    Mono<Boolean> delete(String key);

    /**
     * Atomically increment a window counter, setting its TTL to {@code window}
     * when the increment created it.
     *
     * @return the post-increment count
     */
    Mono<Long> incrementWindow(String key, Duration window);

    /**
     * Append to the tail of a list.
     *
     * @return the list length after the append
     */
    Mono<Long> appendToList(String key, String value);

    /**
     * All list elements, head first.
     */
    Flux<String> listRange(String key);

    /**
     * Atomically add {@code delta} to a numeric field of the JSON object stored
     * at {@code key}, unless the result would fall below {@code floor}.
     * The key's remaining TTL is preserved.
     */
    Mono<FieldAdjustment> adjustField(String key, String field, long delta, long floor);
}
