package com.llmgateway.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
public class UsageRecord {
    String userId;
    String feature;
    String provider;
    String model;
    int promptTokens;
    int completionTokens;
    int totalTokens;
    String projectId;
    String fileId;
    String language;
    long latencyMs;
    boolean success;
    Instant createdAt;
}
