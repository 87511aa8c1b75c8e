package com.llmgateway.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Options and normalized results of the gateway capability operations.
 *
 * <p>Options carry optional caller context ({@code userId}, {@code projectId}, {@code fileId}) used
 * for rate limiting and usage accounting; providers never see it.
 */
public class TaskModels {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GenerateCodeOptions {
        private String framework;
        private String context;
        private Integer maxTokens;
        private Double temperature;
        private String customPrompt;
        private String userId;
        private String projectId;
        private String fileId;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AnalyzeCodeOptions {
        @Builder.Default
        private AnalysisLevel analysisLevel = AnalysisLevel.DETAILED;
        private String context;
        private Integer maxTokens;
        private String customPrompt;
        private String userId;
        private String projectId;
        private String fileId;
    }

    public enum AnalysisLevel {
        BASIC, DETAILED, COMPREHENSIVE
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OptimizeCodeOptions {
        private List<String> optimizationGoals;
        private String context;
        @Builder.Default
        private boolean explanation = true;
        private Integer maxTokens;
        private String customPrompt;
        private String userId;
        private String projectId;
        private String fileId;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChatOptions {
        private String conversationId;
        private List<ChatModels.Message> history;
        private String codeContext;
        private Integer maxTokens;
        private String customPrompt;
        private String userId;
        private String projectId;
        private String fileId;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ExplainCodeOptions {
        @Builder.Default
        private String detailLevel = "detailed";
        @Builder.Default
        private String audience = "intermediate";
        private String userId;
        private String projectId;
        private String fileId;
    }

    /**
     * Target of a connection test. Anything left null falls back to the active configuration.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConnectionOptions {
        private String provider;
        private String model;
        private String baseUrl;
    }

    public record GenerateCodeResult(String generatedCode, String explanation, List<String> alternatives,
                                     TokenUsage usage) {

        public GenerateCodeResult withUsage(TokenUsage usage) {
            return new GenerateCodeResult(generatedCode, explanation, alternatives, usage);
        }
    }

    public record AnalyzeCodeResult(int score, List<String> issues, List<String> strengths, String summary,
                                    TokenUsage usage) {

        public AnalyzeCodeResult withUsage(TokenUsage usage) {
            return new AnalyzeCodeResult(score, issues, strengths, summary, usage);
        }
    }

    public record OptimizeCodeResult(String optimizedCode, List<String> changes, String improvementSummary,
                                     TokenUsage usage) {

        public OptimizeCodeResult withUsage(TokenUsage usage) {
            return new OptimizeCodeResult(optimizedCode, changes, improvementSummary, usage);
        }
    }

    public record ChatResult(String response, String conversationId, TokenUsage usage) {
    }

    public record ExplainCodeResult(String explanation, TokenUsage usage) {
    }

    public record ConnectionTestResult(List<String> models, long latencyMs, Quota quota) {

        public ConnectionTestResult withLatency(long latencyMs) {
            return new ConnectionTestResult(models, latencyMs, quota);
        }
    }

    /**
     * Providers rarely report quota; the adapters fill in a nominal allowance.
     */
    public record Quota(long total, long used, long remaining) {

        public static final Quota NOMINAL = new Quota(1_000_000, 0, 1_000_000);
    }
}
