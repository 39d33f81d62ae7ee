package com.vcc.llmgateway.config;

import com.vcc.llmgateway.model.CachingPolicy;
import com.vcc.llmgateway.model.Credential;
import com.vcc.llmgateway.model.ProviderEndpoint;
import com.vcc.llmgateway.model.TenantConfig;
import com.vcc.llmgateway.model.UserGroupPolicy;
import com.vcc.llmgateway.store.StateStore;
import com.vcc.llmgateway.store.StoreJson;
import com.vcc.llmgateway.store.StoreKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes the configured tenants, tenant budgets and credentials into the store.
 * Existing keys are left untouched, so restarts never reset consumed budgets.
 */
@Component
public class StoreBootstrap {
    private static final Logger log = LoggerFactory.getLogger(StoreBootstrap.class);

    private final GwProperties properties;
    private final StateStore store;
    private final StoreKeys keys;
    private final StoreJson json;
    private final Clock clock;

    public StoreBootstrap(GwProperties properties, StateStore store, StoreKeys keys, StoreJson json, Clock clock) {
        this.properties = properties;
        this.store = store;
        this.keys = keys;
        this.json = json;
        this.clock = clock;
    }

    public Mono<Void> seed() {
        return Flux.fromIterable(properties.getBootstrap().getTenants())
                .concatMap(this::seedTenant)
                .then();
    }

    private Mono<Void> seedTenant(GwProperties.TenantSeed seed) {
        TenantConfig config = toTenantConfig(seed);
        String tenantId = seed.getTenantId();

        Mono<Boolean> configWrite = json.write(config)
                .flatMap(value -> store.setIfAbsent(keys.tenantConfig(tenantId), value));
        Mono<Boolean> budgetWrite = store.setIfAbsent(keys.tenantBudget(tenantId),
                Long.toString(seed.getRealtimeBudget()));
        Mono<Long> credentialWrites = Flux.fromIterable(seed.getCredentials())
                .concatMap(credential -> seedCredential(config, credential))
                .filter(Boolean::booleanValue)
                .count();

        return configWrite.zipWith(budgetWrite)
                .zipWith(credentialWrites)
                .doOnNext(result -> log.info(
                        "Seeded tenant tenantId={} configWritten={} budgetWritten={} credentialsWritten={}/{}",
                        tenantId, result.getT1().getT1(), result.getT1().getT2(), result.getT2(),
                        seed.getCredentials().size()))
                .then();
    }

    private Mono<Boolean> seedCredential(TenantConfig config, GwProperties.CredentialSeed seed) {
        long budget;
        if (seed.getRemainingBudget() != null) {
            budget = seed.getRemainingBudget();
        } else {
            UserGroupPolicy policy = config.groupPolicy(seed.getGroup());
            budget = policy != null ? policy.tokenBudget() : 0;
        }
        Instant expiresAt = clock.instant().plus(Duration.ofHours(seed.getValidForHours()));
        Credential credential = new Credential(config.tenantId(), seed.getUserId(), seed.getGroup(), budget, expiresAt);
        return json.write(credential)
                .flatMap(value -> store.setIfAbsent(keys.credential(seed.getToken()), value));
    }

    static TenantConfig toTenantConfig(GwProperties.TenantSeed seed) {
        Map<String, UserGroupPolicy> groups = new LinkedHashMap<>();
        seed.getUserGroups().forEach((name, group) -> groups.put(name,
                new UserGroupPolicy(group.getTokenBudget(), group.getRateLimit(), group.getRateLimitWindowSeconds())));

        Map<String, ProviderEndpoint> providers = new LinkedHashMap<>();
        seed.getProviders().forEach((name, provider) -> providers.put(name,
                new ProviderEndpoint(provider.getEndpointUrl(), provider.getDefaultModel(), provider.getApiKey())));

        return new TenantConfig(seed.getTenantId(), groups, seed.getDefaultProvider(), providers,
                new CachingPolicy(seed.isCachingEnabled(), seed.getCacheTtlSeconds()));
    }
}
