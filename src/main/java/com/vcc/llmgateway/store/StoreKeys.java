package com.vcc.llmgateway.store;

import com.vcc.llmgateway.config.GwProperties;
import org.springframework.stereotype.Component;

/**
 * Key layout of the shared store. All keys share the configured prefix.
 */
@Component
public class StoreKeys {

    private final String prefix;

    public StoreKeys(GwProperties properties) {
        GwProperties.StoreConfig storeConfig = properties.getStore();
        this.prefix = storeConfig != null && storeConfig.getKeyPrefix() != null
                ? storeConfig.getKeyPrefix()
                : "";
    }

    public String tenantConfig(String tenantId) {
        return prefix + "tenant:" + tenantId + ":config";
    }

    public String tenantBudget(String tenantId) {
        return prefix + "tenant:" + tenantId + ":tokens";
    }

    public String credential(String token) {
        return prefix + "credential:" + token;
    }

    public String rateWindow(String tenantId, String userId) {
        return prefix + "ratewindow:" + tenantId + ":" + userId;
    }

    public String cacheEntry(String tenantId, String cacheKey) {
        return prefix + "cache:" + tenantId + ":" + cacheKey;
    }

    public String sessionState(String tenantId, String sessionId) {
        return prefix + "session:" + tenantId + ":" + sessionId + ":state";
    }

    public String sessionHistory(String tenantId, String sessionId) {
        return prefix + "session:" + tenantId + ":" + sessionId + ":history";
    }
}
