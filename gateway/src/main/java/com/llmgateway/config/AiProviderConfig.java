package com.llmgateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "ai")
public class AiProviderConfig {

    private Map<String, ProviderSettings> providers = new HashMap<>();
    private SecuritySettings security = new SecuritySettings();
    private ConfigStoreSettings configStore = new ConfigStoreSettings();
    private HealthSettings health = new HealthSettings();
    private RetrySettings retry = new RetrySettings();
    private DefaultsSettings defaults = new DefaultsSettings();
    private RateLimitSettings rateLimit = new RateLimitSettings();
    private UsageSettings usage = new UsageSettings();

    /**
     * Settings for one provider key, used when that provider is reached as a fallback
     * (the active configuration only carries credentials for the primary provider).
     */
    @Data
    public static class ProviderSettings {
        private boolean enabled = true;
        private String apiKey;
        private String baseUrl;
        private String defaultModel;
    }

    @Data
    public static class SecuritySettings {
        private String encryptionKey = "default-secure-key-32-bytesxyzxyzxy";
    }

    @Data
    public static class ConfigStoreSettings {
        private Duration cacheTtl = Duration.ofMinutes(5);
        private Duration loadTimeout = Duration.ofSeconds(10);
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
    }

    @Data
    public static class HealthSettings {
        private long intervalMs = 600_000;
        private long degradedThresholdMs = 2000;
        private Duration probeTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class RetrySettings {
        private PolicySettings hosted = new PolicySettings(3, Duration.ofSeconds(1), Duration.ofSeconds(30));
        private PolicySettings local = new PolicySettings(2, Duration.ofSeconds(2), Duration.ofSeconds(60));
    }

    @Data
    public static class PolicySettings {
        private int maxRetries;
        private Duration initialDelay;
        private Duration timeout;

        public PolicySettings() {
        }

        public PolicySettings(int maxRetries, Duration initialDelay, Duration timeout) {
            this.maxRetries = maxRetries;
            this.initialDelay = initialDelay;
            this.timeout = timeout;
        }
    }

    /**
     * Values used to synthesize the configuration the first time none is stored.
     */
    @Data
    public static class DefaultsSettings {
        private String provider = "OpenAI";
        private String model = "gpt-3.5-turbo";
        private String apiKey;
        private String baseUrl = "https://api.openai.com/v1";
    }

    @Data
    public static class RateLimitSettings {
        private boolean enabled = true;
    }

    @Data
    public static class UsageSettings {
        private boolean enabled = true;
        private Duration counterRetention = Duration.ofDays(2);
    }
}
