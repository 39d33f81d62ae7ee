package com.vcc.llmgateway.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vcc.llmgateway.store.FieldAdjustment;
import com.vcc.llmgateway.store.StateStore;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Single-process {@link StateStore} for tests. Every operation holds the store
 * lock, which gives the same atomicity the Redis scripts give. Expiry follows
 * the supplied clock.
 */
public class InMemoryStateStore implements StateStore {

    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, String> values = new HashMap<>();
    private final Map<String, List<String>> lists = new HashMap<>();
    private final Map<String, Instant> expiries = new HashMap<>();
    private final Map<String, Integer> reads = new HashMap<>();

    public InMemoryStateStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<String> get(String key) {
        return Mono.fromSupplier(() -> {
            synchronized (this) {
                reads.merge(key, 1, Integer::sum);
                evictIfExpired(key);
                return values.get(key);
            }
        });
    }

    @Override
    public Mono<Boolean> set(String key, String value) {
        return Mono.fromSupplier(() -> {
            synchronized (this) {
                values.put(key, value);
                expiries.remove(key);
                return true;
            }
        });
    }

    @Override
    public Mono<Boolean> set(String key, String value, Duration ttl) {
        return Mono.fromSupplier(() -> {
            synchronized (this) {
                values.put(key, value);
                expiries.put(key, clock.instant().plus(ttl));
                return true;
            }
        });
    }

    @Override
    public Mono<Boolean> setIfAbsent(String key, String value) {
        return Mono.fromSupplier(() -> {
            synchronized (this) {
                evictIfExpired(key);
                if (values.containsKey(key)) {
                    return false;
                }
                values.put(key, value);
                return true;
            }
        });
    }

    @Override
    public Mono<Boolean> delete(String key) {
        return Mono.fromSupplier(() -> {
            synchronized (this) {
                expiries.remove(key);
                boolean removed = values.remove(key) != null;
                return lists.remove(key) != null || removed;
            }
        });
    }

    @Override
    public Mono<Long> incrementWindow(String key, Duration window) {
        return Mono.fromSupplier(() -> {
            synchronized (this) {
                evictIfExpired(key);
                long count = values.containsKey(key) ? Long.parseLong(values.get(key)) + 1 : 1;
                values.put(key, Long.toString(count));
                if (count == 1 || !expiries.containsKey(key)) {
                    expiries.put(key, clock.instant().plus(window));
                }
                return count;
            }
        });
    }

    @Override
    public Mono<Long> appendToList(String key, String value) {
        return Mono.fromSupplier(() -> {
            synchronized (this) {
                List<String> list = lists.computeIfAbsent(key, k -> new ArrayList<>());
                list.add(value);
                return (long) list.size();
            }
        });
    }

    @Override
    public Flux<String> listRange(String key) {
        return Flux.defer(() -> {
            synchronized (this) {
                return Flux.fromIterable(new ArrayList<>(lists.getOrDefault(key, List.of())));
            }
        });
    }

    @Override
    public Mono<FieldAdjustment> adjustField(String key, String field, long delta, long floor) {
        return Mono.fromSupplier(() -> {
            synchronized (this) {
                evictIfExpired(key);
                String raw = values.get(key);
                if (raw == null) {
                    return FieldAdjustment.missing();
                }
                ObjectNode record = (ObjectNode) readTree(raw);
                JsonNode currentNode = record.get(field);
                long current = currentNode != null ? currentNode.asLong() : 0;
                long updated = current + delta;
                if (updated < floor) {
                    return FieldAdjustment.rejected(current);
                }
                record.put(field, updated);
                values.put(key, record.toString());
                return FieldAdjustment.applied(updated);
            }
        });
    }

    /**
     * Direct read for assertions, ignoring expiry.
     */
    public synchronized String peek(String key) {
        return values.get(key);
    }

    /**
     * Number of {@link #get} calls made for the key.
     */
    public synchronized int readCount(String key) {
        return reads.getOrDefault(key, 0);
    }

    public synchronized List<String> peekList(String key) {
        return new ArrayList<>(lists.getOrDefault(key, List.of()));
    }

    public synchronized void put(String key, String value) {
        values.put(key, value);
    }

    private void evictIfExpired(String key) {
        Instant expiry = expiries.get(key);
        if (expiry != null && !expiry.isAfter(clock.instant())) {
            expiries.remove(key);
            values.remove(key);
        }
    }

    private JsonNode readTree(String raw) {
        try {
            return objectMapper.readTree(raw);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
