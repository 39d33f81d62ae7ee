package com.vcc.llmgateway.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Redis implementation of {@link StateStore}.
 * Compound operations run as Lua scripts so they are atomic on the server.
 */
@Component
public class RedisStateStore implements StateStore {
    private static final Logger log = LoggerFactory.getLogger(RedisStateStore.class);

    // INCR, then set the expiry on creation (or if a previous expiry was lost)
    private static final RedisScript<Long> INCREMENT_WINDOW = new DefaultRedisScript<>(
            "local count = redis.call('INCR', KEYS[1]) " +
            "if count == 1 or redis.call('PTTL', KEYS[1]) < 0 then " +
            "  redis.call('PEXPIRE', KEYS[1], ARGV[1]) " +
            "end " +
            "return count",
            Long.class);

    // ARGV: field, delta, floor. Reply: OUTCOME:value
    private static final RedisScript<String> ADJUST_FIELD = new DefaultRedisScript<>(
            "local raw = redis.call('GET', KEYS[1]) " +
            "if not raw then return 'MISSING:0' end " +
            "local record = cjson.decode(raw) " +
            "local current = tonumber(record[ARGV[1]]) or 0 " +
            "local updated = current + tonumber(ARGV[2]) " +
            "if updated < tonumber(ARGV[3]) then return 'REJECTED:' .. current end " +
            "record[ARGV[1]] = updated " +
            "local encoded = cjson.encode(record) " +
            "local ttl = redis.call('PTTL', KEYS[1]) " +
            "if ttl > 0 then redis.call('SET', KEYS[1], encoded, 'PX', ttl) " +
            "else redis.call('SET', KEYS[1], encoded) end " +
            "return 'APPLIED:' .. updated",
            String.class);

    private final ReactiveStringRedisTemplate redisTemplate;

    public RedisStateStore(ReactiveStringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Mono<String> get(String key) {
        return redisTemplate.opsForValue().get(key);
    }

    @Override
    public Mono<Boolean> set(String key, String value) {
        return redisTemplate.opsForValue().set(key, value);
    }

    @Override
    public Mono<Boolean> set(String key, String value, Duration ttl) {
        return redisTemplate.opsForValue().set(key, value, ttl);
    }

    @Override
    public Mono<Boolean> setIfAbsent(String key, String value) {
        return redisTemplate.opsForValue().setIfAbsent(key, value);
    }

    @Override
    public Mono<Boolean> delete(String key) {
        return redisTemplate.delete(key).map(count -> count > 0);
    }

    @Override
    public Mono<Long> incrementWindow(String key, Duration window) {
        return redisTemplate
                .execute(INCREMENT_WINDOW, List.of(key), List.of(String.valueOf(window.toMillis())))
                .next();
    }

    @Override
    public Mono<Long> appendToList(String key, String value) {
        return redisTemplate.opsForList().rightPush(key, value);
    }

    @Override
    public Flux<String> listRange(String key) {
        return redisTemplate.opsForList().range(key, 0, -1);
    }

    @Override
    public Mono<FieldAdjustment> adjustField(String key, String field, long delta, long floor) {
        return redisTemplate
                .execute(ADJUST_FIELD, List.of(key),
                        List.of(field, String.valueOf(delta), String.valueOf(floor)))
                .next()
                .map(FieldAdjustment::parse)
                .doOnNext(result -> log.trace("adjustField key={} field={} delta={} result={}",
                        key, field, delta, result));
    }
}
