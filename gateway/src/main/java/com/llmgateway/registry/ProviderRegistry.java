package com.llmgateway.registry;

import com.llmgateway.provider.LlmProvider;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Case-insensitive lookup of provider keys. Several keys may alias one adapter; an unknown key
 * degrades to the default adapter instead of failing the call.
 */
@Slf4j
public class ProviderRegistry {

    private final Map<String, LlmProvider> adapters;
    private final String defaultKey;

    private ProviderRegistry(Map<String, LlmProvider> adapters, String defaultKey) {
        this.adapters = Collections.unmodifiableMap(adapters);
        this.defaultKey = defaultKey;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the adapter registered for {@code key}, or the default adapter when none is.
     */
    public LlmProvider resolve(String key) {
        LlmProvider adapter = adapters.get(normalize(key));
        if (adapter != null) {
            return adapter;
        }
        log.warn("Unknown provider '{}', falling back to '{}'", key, defaultKey);
        return adapters.get(defaultKey);
    }

    public boolean isRegistered(String key) {
        return adapters.containsKey(normalize(key));
    }

    public Set<String> keys() {
        return adapters.keySet();
    }

    public String getDefaultKey() {
        return defaultKey;
    }

    public static String normalize(String key) {
        return key == null ? "" : key.strip().toLowerCase(Locale.ROOT);
    }

    public static class Builder {

        private final Map<String, LlmProvider> adapters = new LinkedHashMap<>();
        private String defaultKey;

        public Builder register(LlmProvider adapter, String... keys) {
            for (String key : keys) {
                adapters.put(normalize(key), adapter);
            }
            return this;
        }

        public Builder defaultKey(String key) {
            this.defaultKey = normalize(key);
            return this;
        }

        public ProviderRegistry build() {
            if (defaultKey == null || !adapters.containsKey(defaultKey)) {
                throw new IllegalStateException("Default provider '" + defaultKey + "' is not registered");
            }
            return new ProviderRegistry(new LinkedHashMap<>(adapters), defaultKey);
        }
    }
}
