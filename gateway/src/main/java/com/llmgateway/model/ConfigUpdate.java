package com.llmgateway.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Partial update of {@link AiConfiguration}. Only non-null fields are applied; {@code apiKey}
 * is plaintext here and gets encrypted before it is stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfigUpdate {
    private String provider;
    private String model;
    private String apiKey;
    private String baseUrl;
    private Double temperature;
    private Integer maxTokensGenerate;
    private Integer maxTokensAnalyze;
    private Integer maxTokensChat;
    private AiConfiguration.UsageLimit usageLimit;
    private AiConfiguration.RateLimit rateLimit;
    private Boolean monitoringEnabled;
    private List<String> fallbackProviders;
    private AiConfiguration.ContentFiltering contentFiltering;
}
