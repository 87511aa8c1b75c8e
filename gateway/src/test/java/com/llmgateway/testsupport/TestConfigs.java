package com.llmgateway.testsupport;

import com.llmgateway.model.AiConfiguration;

import java.time.Instant;
import java.util.List;

public final class TestConfigs {

    private TestConfigs() {
    }

    public static AiConfiguration.AiConfigurationBuilder config() {
        return AiConfiguration.builder()
                .provider("OpenAI")
                .model("gpt-3.5-turbo")
                .apiKey("sk-test-key")
                .baseUrl("https://api.openai.com/v1")
                .temperature(0.3)
                .maxTokensGenerate(2000)
                .maxTokensAnalyze(1000)
                .maxTokensChat(1000)
                .usageLimit(AiConfiguration.UsageLimit.builder()
                        .dailyTokenLimit(100_000)
                        .userTokenLimit(10_000)
                        .build())
                .rateLimit(AiConfiguration.RateLimit.builder()
                        .requestsPerMinute(20)
                        .tokensPerHour(50_000)
                        .build())
                .monitoringEnabled(true)
                .fallbackProviders(List.of("LocalLLM"))
                .contentFiltering(AiConfiguration.ContentFiltering.builder()
                        .enabled(true)
                        .blockedTopics(List.of("敏感内容", "不良信息"))
                        .maxSensitivityLevel("medium")
                        .build())
                .updatedAt(Instant.parse("2024-05-01T10:00:00Z"));
    }
}
