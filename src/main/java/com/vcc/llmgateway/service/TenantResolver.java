package com.vcc.llmgateway.service;

import com.vcc.llmgateway.error.ErrorKind;
import com.vcc.llmgateway.error.GatewayException;
import com.vcc.llmgateway.model.TenantConfig;
import com.vcc.llmgateway.store.StateStore;
import com.vcc.llmgateway.store.StoreJson;
import com.vcc.llmgateway.store.StoreKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.regex.Pattern;

/**
 * Loads a tenant's configuration record. Pure lookup: tenants are never created here.
 */
@Service
public class TenantResolver {
    private static final Logger log = LoggerFactory.getLogger(TenantResolver.class);

    // Colons would let a tenant id reach into another key namespace
    private static final Pattern TENANT_ID = Pattern.compile("^[A-Za-z0-9_.-]{1,64}$");

    private final StateStore store;
    private final StoreKeys keys;
    private final StoreJson json;

    public TenantResolver(StateStore store, StoreKeys keys, StoreJson json) {
        this.store = store;
        this.keys = keys;
        this.json = json;
    }

    /**
     * Resolve a tenant by id.
     *
     * @param tenantId path or header supplied tenant id
     * @return the tenant configuration, or {@link ErrorKind#UNKNOWN_TENANT}
     */
    public Mono<TenantConfig> resolve(String tenantId) {
        if (tenantId == null || !TENANT_ID.matcher(tenantId).matches()) {
            return Mono.error(unknown());
        }
        String key = keys.tenantConfig(tenantId);
        return store.get(key)
                .switchIfEmpty(Mono.error(TenantResolver::unknown))
                .flatMap(raw -> json.read(key, raw, TenantConfig.class))
                .doOnNext(config -> log.info("event=tenant_config_loaded tenantId={} groups={} providers={} caching={}",
                        tenantId, config.userGroups().keySet(), config.providers().keySet(),
                        config.caching().enabled()));
    }

    private static GatewayException unknown() {
        return new GatewayException(ErrorKind.UNKNOWN_TENANT, "Invalid tenant id");
    }
}
