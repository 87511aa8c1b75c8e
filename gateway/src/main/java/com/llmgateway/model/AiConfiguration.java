package com.llmgateway.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * The single live AI configuration. Immutable: an update produces a new instance which
 * replaces the cached one in a single reference swap.
 *
 * <p>{@code apiKey} holds either {@code ivHex:cipherHex} or a legacy plaintext key.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AiConfiguration {

    String provider;
    String model;
    String apiKey;
    String baseUrl;
    double temperature;
    int maxTokensGenerate;
    int maxTokensAnalyze;
    int maxTokensChat;
    UsageLimit usageLimit;
    RateLimit rateLimit;
    boolean monitoringEnabled;
    List<String> fallbackProviders;
    ContentFiltering contentFiltering;
    Instant updatedAt;

    @Value
    @Builder
    @Jacksonized
    public static class UsageLimit {
        long dailyTokenLimit;
        long userTokenLimit;
    }

    @Value
    @Builder
    @Jacksonized
    public static class RateLimit {
        int requestsPerMinute;
        long tokensPerHour;
    }

    @Value
    @Builder
    @Jacksonized
    public static class ContentFiltering {
        boolean enabled;
        List<String> blockedTopics;
        String maxSensitivityLevel;
    }
}
