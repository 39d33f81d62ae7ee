package com.vcc.llmgateway.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Immutable tenant configuration as stored under {@code tenant:<tenantId>:config}.
 * Owned by tenant administration; the gateway only reads it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TenantConfig(
        String tenantId,
        Map<String, UserGroupPolicy> userGroups,
        String defaultProvider,
        Map<String, ProviderEndpoint> providers,
        CachingPolicy caching
) {

    public TenantConfig {
        userGroups = userGroups != null ? Map.copyOf(userGroups) : Map.of();
        providers = providers != null ? Map.copyOf(providers) : Map.of();
        caching = caching != null ? caching : CachingPolicy.disabled();
    }

    /**
     * Policy for a user group, or null when the tenant does not define it.
     */
    public UserGroupPolicy groupPolicy(String group) {
        return group != null ? userGroups.get(group) : null;
    }

    /**
     * Name of the provider used for completions. Falls back to the only
     * configured provider when no default is named.
     */
    public String effectiveProviderName() {
        if (defaultProvider != null && !defaultProvider.isBlank()) {
            return defaultProvider;
        }
        if (providers.size() == 1) {
            return providers.keySet().iterator().next();
        }
        return null;
    }
}
