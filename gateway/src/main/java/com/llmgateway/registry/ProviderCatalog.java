package com.llmgateway.registry;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Static description of the providers and models the gateway knows about, used for display
 * and model recommendation.
 */
@Component
public class ProviderCatalog {

    public enum Feature {
        CODE_GENERATION, CODE_ANALYSIS, CHAT
    }

    public enum Task {
        CODE_GENERATION(Feature.CODE_GENERATION),
        CODE_ANALYSIS(Feature.CODE_ANALYSIS),
        CHAT(Feature.CHAT),
        OPTIMIZATION(Feature.CODE_ANALYSIS);

        private final Feature requiredFeature;

        Task(Feature requiredFeature) {
            this.requiredFeature = requiredFeature;
        }

        public Feature requiredFeature() {
            return requiredFeature;
        }
    }

    public record ModelInfo(String id, String name, String description, int contextTokens, Set<Feature> features,
                            int averageLatencyMs, double costPer1kTokens) {

        /**
         * Lower is better: two seconds of latency weigh as much as one cent per thousand tokens.
         */
        public double balancedScore() {
            return averageLatencyMs / 2000.0 + costPer1kTokens * 100;
        }
    }

    public record ProviderInfo(String id, String name, String description, List<ModelInfo> models,
                               boolean requiresApiKey, boolean requiresBaseUrl) {
    }

    private static final Set<Feature> ALL = Set.of(Feature.CODE_GENERATION, Feature.CODE_ANALYSIS, Feature.CHAT);

    private static final List<ProviderInfo> PROVIDERS = List.of(
            new ProviderInfo("OpenAI", "OpenAI", "支持GPT-3.5和GPT-4系列模型", List.of(
                    new ModelInfo("gpt-3.5-turbo", "GPT-3.5 Turbo", "平衡性能和成本的通用模型", 16385, ALL, 1200, 0.002),
                    new ModelInfo("gpt-4", "GPT-4", "高级理解和推理能力", 8192, ALL, 2500, 0.06),
                    new ModelInfo("gpt-4-turbo", "GPT-4 Turbo", "升级版GPT-4，更快更智能", 128000, ALL, 3000, 0.03)),
                    true, true),
            new ProviderInfo("Claude", "Anthropic Claude", "擅长编码和文本分析的助手模型", List.of(
                    new ModelInfo("claude-3-haiku-20240307", "Claude 3 Haiku", "轻量快速的编码助手", 200000, ALL, 1000, 0.00025),
                    new ModelInfo("claude-3-sonnet-20240229", "Claude 3 Sonnet", "平衡性能和深度理解能力", 200000, ALL, 1500, 0.003),
                    new ModelInfo("claude-3-opus-20240229", "Claude 3 Opus", "最强大的Claude模型", 200000, ALL, 2000, 0.015)),
                    true, true),
            new ProviderInfo("DeepSeek", "DeepSeek", "国内领先的大模型平台", List.of(
                    new ModelInfo("deepseek-chat", "DeepSeek Chat (V3)", "通用对话大模型", 64000, ALL, 1000, 0.002),
                    new ModelInfo("deepseek-reasoner", "DeepSeek Reasoner (R1)", "专业推理模型", 64000, ALL, 1200, 0.003)),
                    true, true),
            new ProviderInfo("Baidu", "文心一言", "百度开发的大语言模型", List.of(
                    new ModelInfo("ernie-4.0", "ERNIE 4.0", "文心大模型4.0", 16000, ALL, 1500, 0.002)),
                    true, true),
            new ProviderInfo("Zhipu", "智谱GLM", "智谱AI开发的大语言模型", List.of(
                    new ModelInfo("glm-4", "GLM-4", "通用大语言模型", 32000, ALL, 1300, 0.002)),
                    true, true),
            new ProviderInfo("MiniMax", "MiniMax", "MiniMax开发的大语言模型", List.of(
                    new ModelInfo("abab6-chat", "ABAB 6", "高性能对话与代码生成模型", 32000, ALL, 1200, 0.002)),
                    true, true),
            new ProviderInfo("LocalLLM", "本地模型", "本地部署的大语言模型", List.of(
                    new ModelInfo("codellama", "CodeLlama", "专为代码生成优化的模型", 16000,
                            Set.of(Feature.CODE_GENERATION, Feature.CODE_ANALYSIS), 800, 0),
                    new ModelInfo("mistral", "Mistral", "开源高性能语言模型", 8000,
                            Set.of(Feature.CODE_GENERATION, Feature.CHAT), 600, 0)),
                    false, true));

    public List<ProviderInfo> providers() {
        return PROVIDERS;
    }

    public Optional<ProviderInfo> find(String providerId) {
        String key = ProviderRegistry.normalize(providerId);
        return PROVIDERS.stream()
                .filter(p -> ProviderRegistry.normalize(p.id()).equals(key))
                .findFirst();
    }

    /**
     * Best catalog model of {@code providerId} for {@code task}; empty when the provider is
     * unknown or none of its models supports the task.
     */
    public Optional<String> recommend(String providerId, Task task, boolean prioritizeSpeed, boolean prioritizeCost) {
        Comparator<ModelInfo> order;
        if (prioritizeSpeed) {
            order = Comparator.comparingInt(ModelInfo::averageLatencyMs);
        } else if (prioritizeCost) {
            order = Comparator.comparingDouble(ModelInfo::costPer1kTokens);
        } else {
            order = Comparator.comparingDouble(ModelInfo::balancedScore);
        }
        return find(providerId)
                .flatMap(provider -> provider.models().stream()
                        .filter(model -> model.features().contains(task.requiredFeature()))
                        .min(order))
                .map(ModelInfo::id);
    }
}
