package com.vcc.llmgateway.store;

import com.vcc.llmgateway.config.GwProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StoreKeysTest {

    @Test
    void defaultLayoutHasNoPrefix() {
        StoreKeys keys = new StoreKeys(new GwProperties());

        assertEquals("tenant:abc:config", keys.tenantConfig("abc"));
        assertEquals("tenant:abc:tokens", keys.tenantBudget("abc"));
        assertEquals("credential:tok", keys.credential("tok"));
        assertEquals("ratewindow:abc:u1", keys.rateWindow("abc", "u1"));
        assertEquals("cache:abc:k", keys.cacheEntry("abc", "k"));
        assertEquals("session:abc:tenant:abc:session:x:state", keys.sessionState("abc", "tenant:abc:session:x"));
        assertEquals("session:abc:tenant:abc:session:x:history", keys.sessionHistory("abc", "tenant:abc:session:x"));
    }

    @Test
    void configuredPrefixIsPrependedToEveryKey() {
        GwProperties properties = new GwProperties();
        properties.getStore().setKeyPrefix("gw:");
        StoreKeys keys = new StoreKeys(properties);

        assertEquals("gw:tenant:abc:config", keys.tenantConfig("abc"));
        assertEquals("gw:credential:tok", keys.credential("tok"));
    }
}
