package com.vcc.llmgateway.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "gw")
@Validated
public class GwProperties {

    @Valid
    private StoreConfig store = new StoreConfig();
    @Valid
    private QuotaConfig quota = new QuotaConfig();
    @Valid
    private CacheConfig cache = new CacheConfig();
    @Valid
    private UpstreamConfig upstream = new UpstreamConfig();
    @Valid
    private RealtimeConfig realtime = new RealtimeConfig();
    @Valid
    private BootstrapConfig bootstrap = new BootstrapConfig();

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store;
    }

    public QuotaConfig getQuota() {
        return quota;
    }

    public void setQuota(QuotaConfig quota) {
        this.quota = quota;
    }

    public CacheConfig getCache() {
        return cache;
    }

    public void setCache(CacheConfig cache) {
        this.cache = cache;
    }

    public UpstreamConfig getUpstream() {
        return upstream;
    }

    public void setUpstream(UpstreamConfig upstream) {
        this.upstream = upstream;
    }

    public RealtimeConfig getRealtime() {
        return realtime;
    }

    public void setRealtime(RealtimeConfig realtime) {
        this.realtime = realtime;
    }

    public BootstrapConfig getBootstrap() {
        return bootstrap;
    }

    public void setBootstrap(BootstrapConfig bootstrap) {
        this.bootstrap = bootstrap;
    }

    // ==================== Nested Config Classes ====================

    /**
     * Shared state store settings.
     */
    public static class StoreConfig {
        // Prepended to every key, e.g. "gw:" to share a Redis instance
        private String keyPrefix = "";

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }
    }

    /**
     * Budget metering settings.
     */
    public static class QuotaConfig {
        // Budget units charged per admitted request
        @Min(1)
        private long requestCost = 1;

        public long getRequestCost() {
            return requestCost;
        }

        public void setRequestCost(long requestCost) {
            this.requestCost = requestCost;
        }
    }

    /**
     * Response cache settings.
     */
    public static class CacheConfig {
        // Used when a tenant enables caching without a TTL
        @Min(1)
        private long defaultTtlSeconds = 86400;

        public long getDefaultTtlSeconds() {
            return defaultTtlSeconds;
        }

        public void setDefaultTtlSeconds(long defaultTtlSeconds) {
            this.defaultTtlSeconds = defaultTtlSeconds;
        }
    }

    /**
     * Upstream provider client settings.
     */
    public static class UpstreamConfig {
        private int connectTimeoutMillis = 10_000;

        private int responseTimeoutSeconds = 300;

        @NotBlank
        private String anthropicVersion = "2023-06-01";

        public int getConnectTimeoutMillis() {
            return connectTimeoutMillis;
        }

        public void setConnectTimeoutMillis(int connectTimeoutMillis) {
            this.connectTimeoutMillis = connectTimeoutMillis;
        }

        public int getResponseTimeoutSeconds() {
            return responseTimeoutSeconds;
        }

        public void setResponseTimeoutSeconds(int responseTimeoutSeconds) {
            this.responseTimeoutSeconds = responseTimeoutSeconds;
        }

        public String getAnthropicVersion() {
            return anthropicVersion;
        }

        public void setAnthropicVersion(String anthropicVersion) {
            this.anthropicVersion = anthropicVersion;
        }
    }

    /**
     * Realtime session settings.
     */
    public static class RealtimeConfig {
        @NotEmpty
        private List<String> allowedBackends = new ArrayList<>(List.of("openai_realtime", "ultravox"));

        @NotBlank
        private String streamPath = "/v1/realtime/stream";

        // Added to a session's tokensUsed per exchanged frame
        @Min(0)
        private long exchangeCost = 1;

        public List<String> getAllowedBackends() {
            return allowedBackends;
        }

        public void setAllowedBackends(List<String> allowedBackends) {
            this.allowedBackends = allowedBackends;
        }

        public String getStreamPath() {
            return streamPath;
        }

        public void setStreamPath(String streamPath) {
            this.streamPath = streamPath;
        }

        public long getExchangeCost() {
            return exchangeCost;
        }

        public void setExchangeCost(long exchangeCost) {
            this.exchangeCost = exchangeCost;
        }
    }

    /**
     * Records seeded into the store at startup when absent.
     */
    public static class BootstrapConfig {
        @Valid
        private List<TenantSeed> tenants = new ArrayList<>();

        public List<TenantSeed> getTenants() {
            return tenants;
        }

        public void setTenants(List<TenantSeed> tenants) {
            this.tenants = tenants;
        }
    }

    public static class TenantSeed {
        @NotBlank
        private String tenantId;

        // Tenant-level budget consumed by realtime session initialization
        private long realtimeBudget = 0;

        private String defaultProvider;

        private boolean cachingEnabled = false;

        private long cacheTtlSeconds = 86400;

        private Map<String, GroupSeed> userGroups = new LinkedHashMap<>();

        private Map<String, ProviderSeed> providers = new LinkedHashMap<>();

        @Valid
        private List<CredentialSeed> credentials = new ArrayList<>();

        public String getTenantId() {
            return tenantId;
        }

        public void setTenantId(String tenantId) {
            this.tenantId = tenantId;
        }

        public long getRealtimeBudget() {
            return realtimeBudget;
        }

        public void setRealtimeBudget(long realtimeBudget) {
            this.realtimeBudget = realtimeBudget;
        }

        public String getDefaultProvider() {
            return defaultProvider;
        }

        public void setDefaultProvider(String defaultProvider) {
            this.defaultProvider = defaultProvider;
        }

        public boolean isCachingEnabled() {
            return cachingEnabled;
        }

        public void setCachingEnabled(boolean cachingEnabled) {
            this.cachingEnabled = cachingEnabled;
        }

        public long getCacheTtlSeconds() {
            return cacheTtlSeconds;
        }

        public void setCacheTtlSeconds(long cacheTtlSeconds) {
            this.cacheTtlSeconds = cacheTtlSeconds;
        }

        public Map<String, GroupSeed> getUserGroups() {
            return userGroups;
        }

        public void setUserGroups(Map<String, GroupSeed> userGroups) {
            this.userGroups = userGroups;
        }

        public Map<String, ProviderSeed> getProviders() {
            return providers;
        }

        public void setProviders(Map<String, ProviderSeed> providers) {
            this.providers = providers;
        }

        public List<CredentialSeed> getCredentials() {
            return credentials;
        }

        public void setCredentials(List<CredentialSeed> credentials) {
            this.credentials = credentials;
        }
    }

    public static class GroupSeed {
        private long tokenBudget = 100;
        private int rateLimit = 10;
        private int rateLimitWindowSeconds = 60;

        public long getTokenBudget() {
            return tokenBudget;
        }

        public void setTokenBudget(long tokenBudget) {
            this.tokenBudget = tokenBudget;
        }

        public int getRateLimit() {
            return rateLimit;
        }

        public void setRateLimit(int rateLimit) {
            this.rateLimit = rateLimit;
        }

        public int getRateLimitWindowSeconds() {
            return rateLimitWindowSeconds;
        }

        public void setRateLimitWindowSeconds(int rateLimitWindowSeconds) {
            this.rateLimitWindowSeconds = rateLimitWindowSeconds;
        }
    }

    public static class ProviderSeed {
        private String endpointUrl;
        private String defaultModel;
        private String apiKey;

        public String getEndpointUrl() {
            return endpointUrl;
        }

        public void setEndpointUrl(String endpointUrl) {
            this.endpointUrl = endpointUrl;
        }

        public String getDefaultModel() {
            return defaultModel;
        }

        public void setDefaultModel(String defaultModel) {
            this.defaultModel = defaultModel;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }
    }

    public static class CredentialSeed {
        @NotBlank
        private String token;

        @NotBlank
        private String userId;

        @NotBlank
        private String group;

        // Falls back to the group's tokenBudget when unset
        private Long remainingBudget;

        private long validForHours = 24;

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public String getUserId() {
            return userId;
        }

        public void setUserId(String userId) {
            this.userId = userId;
        }

        public String getGroup() {
            return group;
        }

        public void setGroup(String group) {
            this.group = group;
        }

        public Long getRemainingBudget() {
            return remainingBudget;
        }

        public void setRemainingBudget(Long remainingBudget) {
            this.remainingBudget = remainingBudget;
        }

        public long getValidForHours() {
            return validForHours;
        }

        public void setValidForHours(long validForHours) {
            this.validForHours = validForHours;
        }
    }
}
