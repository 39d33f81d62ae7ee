package com.vcc.llmgateway.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.llmgateway.model.Credential;
import com.vcc.llmgateway.support.GatewayFixture;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the store scripts against a real Redis. Skipped where Docker is unavailable.
 */
@Testcontainers(disabledWithoutDocker = true)
class RedisStateStoreIntegrationTest {

    private static final String KEY = "credential:vs_user_123456789abcdef";
    private static final String FIELD = "remainingBudget";

    @Container
    static final GenericContainer<?> REDIS = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    private static LettuceConnectionFactory connectionFactory;

    private final ObjectMapper objectMapper = GatewayFixture.objectMapper();

    private ReactiveStringRedisTemplate redisTemplate;
    private RedisStateStore store;

    @BeforeAll
    static void connect() {
        connectionFactory = new LettuceConnectionFactory(REDIS.getHost(), REDIS.getMappedPort(6379));
        connectionFactory.afterPropertiesSet();
    }

    @AfterAll
    static void disconnect() {
        connectionFactory.destroy();
    }

    @BeforeEach
    void setUp() {
        redisTemplate = new ReactiveStringRedisTemplate(connectionFactory);
        store = new RedisStateStore(redisTemplate);
        redisTemplate.execute(connection -> connection.serverCommands().flushAll()).blockLast();
    }

    @Test
    void reserveDownToZeroThenRejectWithoutChange() throws Exception {
        // Given
        seedCredential(2, null);

        // When / Then
        StepVerifier.create(store.adjustField(KEY, FIELD, -1, 0))
                .expectNext(FieldAdjustment.applied(1))
                .verifyComplete();
        StepVerifier.create(store.adjustField(KEY, FIELD, -1, 0))
                .expectNext(FieldAdjustment.applied(0))
                .verifyComplete();
        StepVerifier.create(store.adjustField(KEY, FIELD, -1, 0))
                .expectNext(FieldAdjustment.rejected(0))
                .verifyComplete();

        // The re-encoded record still reads as a credential
        Credential credential = readCredential();
        assertEquals(0, credential.remainingBudget());
        assertEquals("abc", credential.tenantId());
        assertEquals(GatewayFixture.USER, credential.userId());
        assertEquals(Instant.parse("2024-01-02T00:00:00Z"), credential.expiresAt());
    }

    @Test
    void refundWithUnboundedFloorRestoresBudget() throws Exception {
        seedCredential(0, null);

        StepVerifier.create(store.adjustField(KEY, FIELD, 1, Long.MIN_VALUE))
                .expectNext(FieldAdjustment.applied(1))
                .verifyComplete();

        assertEquals(1, readCredential().remainingBudget());
    }

    @Test
    void adjustingMissingRecordReportsMissing() {
        StepVerifier.create(store.adjustField(KEY, FIELD, -1, 0))
                .expectNext(FieldAdjustment.missing())
                .verifyComplete();

        StepVerifier.create(redisTemplate.hasKey(KEY))
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    void adjustmentKeepsRemainingTtl() throws Exception {
        seedCredential(5, Duration.ofSeconds(60));

        StepVerifier.create(store.adjustField(KEY, FIELD, -1, 0))
                .expectNext(FieldAdjustment.applied(4))
                .verifyComplete();

        StepVerifier.create(redisTemplate.getExpire(KEY))
                .assertNext(ttl -> {
                    assertTrue(ttl.toSeconds() > 0, "ttl should survive the update");
                    assertTrue(ttl.toSeconds() <= 60);
                })
                .verifyComplete();
    }

    @Test
    void concurrentReservationsNeverOverdraw() throws Exception {
        seedCredential(20, null);

        List<FieldAdjustment> results = Flux.range(0, 50)
                .flatMap(i -> store.adjustField(KEY, FIELD, -1, 0), 16)
                .collectList()
                .block(Duration.ofSeconds(10));

        assertNotNull(results);
        assertEquals(20, results.stream().filter(FieldAdjustment::isApplied).count());
        assertEquals(0, readCredential().remainingBudget());
    }

    @Test
    void firstIncrementSetsWindowExpiry() {
        String key = "rate:abc:user-1";

        StepVerifier.create(store.incrementWindow(key, Duration.ofSeconds(60)))
                .expectNext(1L)
                .verifyComplete();
        StepVerifier.create(store.incrementWindow(key, Duration.ofSeconds(60)))
                .expectNext(2L)
                .verifyComplete();

        StepVerifier.create(redisTemplate.getExpire(key))
                .assertNext(ttl -> {
                    assertTrue(ttl.toSeconds() > 0);
                    assertTrue(ttl.toSeconds() <= 60);
                })
                .verifyComplete();
    }

    @Test
    void incrementRestoresLostExpiry() {
        String key = "rate:abc:user-2";
        redisTemplate.opsForValue().set(key, "5").block();

        StepVerifier.create(store.incrementWindow(key, Duration.ofSeconds(30)))
                .expectNext(6L)
                .verifyComplete();

        StepVerifier.create(redisTemplate.getExpire(key))
                .assertNext(ttl -> assertTrue(ttl.toSeconds() > 0 && ttl.toSeconds() <= 30))
                .verifyComplete();
    }

    @Test
    void windowCounterExpires() throws Exception {
        String key = "rate:abc:user-3";

        StepVerifier.create(store.incrementWindow(key, Duration.ofMillis(200)))
                .expectNext(1L)
                .verifyComplete();
        Thread.sleep(400);

        StepVerifier.create(store.incrementWindow(key, Duration.ofMillis(200)))
                .expectNext(1L)
                .verifyComplete();
    }

    private void seedCredential(long budget, Duration ttl) throws Exception {
        Credential credential = new Credential("abc", GatewayFixture.USER, GatewayFixture.GROUP, budget,
                Instant.parse("2024-01-02T00:00:00Z"));
        String json = objectMapper.writeValueAsString(credential);
        if (ttl == null) {
            store.set(KEY, json).block();
        } else {
            store.set(KEY, json, ttl).block();
        }
    }

    private Credential readCredential() throws Exception {
        return objectMapper.readValue(store.get(KEY).block(), Credential.class);
    }
}
