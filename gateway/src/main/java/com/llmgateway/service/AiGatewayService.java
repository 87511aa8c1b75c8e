package com.llmgateway.service;

import com.llmgateway.config.AiProviderConfig;
import com.llmgateway.exception.GatewayTimeoutException;
import com.llmgateway.exception.UpstreamException;
import com.llmgateway.execution.ResilientExecutor;
import com.llmgateway.execution.RetryPolicy;
import com.llmgateway.health.ProviderHealthMonitor;
import com.llmgateway.model.AiConfiguration;
import com.llmgateway.model.ChatModels.Message;
import com.llmgateway.model.HealthRecord;
import com.llmgateway.model.TaskModels.AnalyzeCodeOptions;
import com.llmgateway.model.TaskModels.AnalyzeCodeResult;
import com.llmgateway.model.TaskModels.ChatOptions;
import com.llmgateway.model.TaskModels.ChatResult;
import com.llmgateway.model.TaskModels.ConnectionOptions;
import com.llmgateway.model.TaskModels.ConnectionTestResult;
import com.llmgateway.model.TaskModels.ExplainCodeOptions;
import com.llmgateway.model.TaskModels.ExplainCodeResult;
import com.llmgateway.model.TaskModels.GenerateCodeOptions;
import com.llmgateway.model.TaskModels.GenerateCodeResult;
import com.llmgateway.model.TaskModels.OptimizeCodeOptions;
import com.llmgateway.model.TaskModels.OptimizeCodeResult;
import com.llmgateway.model.TokenUsage;
import com.llmgateway.model.UsageRecord;
import com.llmgateway.prompt.PromptBuilder;
import com.llmgateway.provider.CallSettings;
import com.llmgateway.provider.ChatReply;
import com.llmgateway.provider.LlmProvider;
import com.llmgateway.registry.ProviderCatalog;
import com.llmgateway.registry.ProviderRegistry;
import com.llmgateway.routing.FailoverSelector;
import com.llmgateway.routing.ResolvedProvider;
import com.llmgateway.security.CredentialVault;
import com.llmgateway.usage.UsageLimitGuard;
import com.llmgateway.usage.UsageRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Entry point for the AI assistant features. Every task call runs the same pipeline:
 * content filter, rate and usage limits, provider selection, credential decryption,
 * resilient execution, health observation and usage accounting.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AiGatewayService {

    static final String FEATURE_GENERATE = "code_generation";
    static final String FEATURE_ANALYZE = "code_analysis";
    static final String FEATURE_OPTIMIZE = "code_optimization";
    static final String FEATURE_CHAT = "chat";
    static final String FEATURE_EXPLAIN = "code_explanation";

    private final AiConfigStore configStore;
    private final FailoverSelector failoverSelector;
    private final ProviderRegistry registry;
    private final ProviderCatalog catalog;
    private final ProviderHealthMonitor healthMonitor;
    private final ResilientExecutor executor;
    private final CredentialVault vault;
    private final PromptBuilder promptBuilder;
    private final ContentFilter contentFilter;
    private final RateLimitService rateLimitService;
    private final UsageLimitGuard usageLimitGuard;
    private final UsageRecorder usageRecorder;
    private final AiProviderConfig properties;
    private final Clock clock;

    public Mono<GenerateCodeResult> generateCode(String prompt, String language, GenerateCodeOptions options) {
        GenerateCodeOptions opts = options != null ? options : new GenerateCodeOptions();
        CallContext context = new CallContext(FEATURE_GENERATE, opts.getUserId(), opts.getProjectId(),
                opts.getFileId(), language, opts.getTemperature(), opts.getMaxTokens(),
                AiConfiguration::getMaxTokensGenerate);
        return invoke(context, new String[]{prompt, opts.getContext()},
                (adapter, call) -> adapter.generateCode(prompt, language, opts, call),
                GenerateCodeResult::usage);
    }

    public Mono<AnalyzeCodeResult> analyzeCode(String code, String language, AnalyzeCodeOptions options) {
        AnalyzeCodeOptions opts = options != null ? options : new AnalyzeCodeOptions();
        CallContext context = new CallContext(FEATURE_ANALYZE, opts.getUserId(), opts.getProjectId(),
                opts.getFileId(), language, null, opts.getMaxTokens(), AiConfiguration::getMaxTokensAnalyze);
        return invoke(context, new String[]{code, opts.getContext()},
                (adapter, call) -> adapter.analyzeCode(code, language, opts, call),
                AnalyzeCodeResult::usage);
    }

    public Mono<OptimizeCodeResult> optimizeCode(String code, String language, OptimizeCodeOptions options) {
        OptimizeCodeOptions opts = options != null ? options : new OptimizeCodeOptions();
        CallContext context = new CallContext(FEATURE_OPTIMIZE, opts.getUserId(), opts.getProjectId(),
                opts.getFileId(), language, null, opts.getMaxTokens(), AiConfiguration::getMaxTokensGenerate);
        return invoke(context, new String[]{code, opts.getContext()},
                (adapter, call) -> adapter.optimizeCode(code, language, opts, call),
                OptimizeCodeResult::usage);
    }

    public Mono<ChatResult> chat(String message, ChatOptions options) {
        return chat(List.of(Message.user(message)), options);
    }

    /**
     * Continues a conversation. The conversation id is echoed back, or created when absent.
     */
    public Mono<ChatResult> chat(List<Message> messages, ChatOptions options) {
        ChatOptions opts = options != null ? options : new ChatOptions();
        String conversationId = opts.getConversationId() != null ? opts.getConversationId() : newConversationId();
        List<Message> conversation = promptBuilder.chat(messages, opts);
        List<Message> history = opts.getHistory() != null ? opts.getHistory() : List.of();
        String[] texts = Stream.concat(Stream.concat(history.stream(), messages.stream()).map(Message::getContent),
                        Stream.of(opts.getCodeContext()))
                .toArray(String[]::new);
        CallContext context = new CallContext(FEATURE_CHAT, opts.getUserId(), opts.getProjectId(),
                opts.getFileId(), null, null, opts.getMaxTokens(), AiConfiguration::getMaxTokensChat);
        return invoke(context, texts,
                (adapter, call) -> adapter.chat(conversation, call),
                ChatReply::usage)
                .map(reply -> new ChatResult(reply.content(), conversationId, reply.usage()));
    }

    public Mono<ExplainCodeResult> explainCode(String code, String language, ExplainCodeOptions options) {
        ExplainCodeOptions opts = options != null ? options : new ExplainCodeOptions();
        List<Message> conversation = promptBuilder.explain(code, language, opts);
        CallContext context = new CallContext(FEATURE_EXPLAIN, opts.getUserId(), opts.getProjectId(),
                opts.getFileId(), language, null, null, AiConfiguration::getMaxTokensAnalyze);
        return invoke(context, new String[]{code},
                (adapter, call) -> adapter.chat(conversation, call),
                ChatReply::usage)
                .map(reply -> new ExplainCodeResult(reply.content(), reply.usage()));
    }

    /**
     * Single-attempt connectivity check. A null credential or option falls back to the active
     * configuration; the outcome also updates the provider's health record.
     */
    public Mono<ConnectionTestResult> testConnection(String credential, ConnectionOptions options) {
        ConnectionOptions opts = options != null ? options : new ConnectionOptions();
        return configStore.getConfig().flatMap(config -> {
            String providerKey = ProviderRegistry.normalize(opts.getProvider() != null ? opts.getProvider() : config.getProvider());
            LlmProvider adapter = registry.resolve(providerKey);
            CallSettings stored = providerKey.equals(ProviderRegistry.normalize(config.getProvider()))
                    ? CallSettings.of(config.getModel(), vault.decrypt(config.getApiKey()), config.getBaseUrl())
                    : providerSettings(providerKey, adapter);
            CallSettings call = CallSettings.of(
                    opts.getModel() != null ? opts.getModel() : stored.model(),
                    credential != null ? credential : stored.apiKey(),
                    opts.getBaseUrl() != null ? opts.getBaseUrl() : stored.baseUrl());

            Instant start = clock.instant();
            return executor.execute(providerKey, policyFor(adapter).withoutRetries(), () -> adapter.testConnection(call))
                    .map(result -> {
                        long latency = elapsedMs(start);
                        healthMonitor.recordObservation(providerKey, true, latency);
                        return result.withLatency(latency);
                    })
                    .doOnError(e -> {
                        if (isProviderFailure(e)) {
                            healthMonitor.recordObservation(providerKey, false, elapsedMs(start));
                        }
                    });
        });
    }

    public Mono<SupportedProviders> getSupportedProviders() {
        List<ProviderEntry> entries = catalog.providers().stream()
                .map(info -> new ProviderEntry(info, healthMonitor.get(info.id())))
                .toList();
        AiProviderConfig.DefaultsSettings defaults = properties.getDefaults();
        return Mono.just(new SupportedProviders(entries, defaults.getProvider(), defaults.getModel()));
    }

    /**
     * Catalog model of the configured provider best suited to {@code task}; the configured model
     * when the catalog has nothing better.
     */
    public Mono<String> recommendModel(ProviderCatalog.Task task, boolean prioritizeSpeed, boolean prioritizeCost) {
        return configStore.getConfig()
                .map(config -> catalog.recommend(config.getProvider(), task, prioritizeSpeed, prioritizeCost)
                        .orElse(config.getModel()));
    }

    public Map<String, HealthRecord> getProvidersHealth() {
        return healthMonitor.snapshot();
    }

    private <T> Mono<T> invoke(CallContext context, String[] texts,
                               BiFunction<LlmProvider, CallSettings, Mono<T>> operation,
                               Function<T, TokenUsage> usageOf) {
        return configStore.getConfig().flatMap(config -> {
            contentFilter.check(config, texts);
            if (context.userId() != null) {
                rateLimitService.checkRequest(context.userId(), config.getRateLimit());
            }
            Mono<Void> limits = context.userId() != null
                    ? usageLimitGuard.check(context.userId(), config)
                    : Mono.empty();

            return limits.then(Mono.defer(() -> {
                ResolvedProvider resolved = failoverSelector.resolveAdapter(config);
                LlmProvider adapter = resolved.adapter();
                CallSettings call = callSettings(resolved, config, context);
                String model = call.model() != null ? call.model() : adapter.getDefaultModel();

                log.debug("{} via {} (model={}, fallback={})", context.feature(), resolved.providerKey(),
                        model, resolved.fallback());

                Instant start = clock.instant();
                return executor.execute(resolved.providerKey(), policyFor(adapter), () -> operation.apply(adapter, call))
                        .doOnNext(result -> {
                            long latency = elapsedMs(start);
                            TokenUsage usage = usageOf.apply(result);
                            healthMonitor.recordObservation(resolved.providerKey(), true, latency);
                            rateLimitService.recordTokens(context.userId(), usage.totalTokens());
                            usageRecorder.record(usageRecord(context, resolved.providerKey(), model, usage, latency, true));
                        })
                        .doOnError(e -> {
                            long latency = elapsedMs(start);
                            if (isProviderFailure(e)) {
                                healthMonitor.recordObservation(resolved.providerKey(), false, latency);
                            }
                            usageRecorder.record(usageRecord(context, resolved.providerKey(), model,
                                    TokenUsage.EMPTY, latency, false));
                        });
            }));
        });
    }

    /**
     * The configuration's credentials belong to its own provider; a fallback provider is
     * reached with the {@code ai.providers.<key>} settings of the key it was named by, or of the
     * adapter's canonical name when that key is an alias.
     */
    private CallSettings callSettings(ResolvedProvider resolved, AiConfiguration config, CallContext context) {
        Double temperature = context.temperature() != null ? context.temperature() : config.getTemperature();
        Integer maxTokens = context.maxTokens() != null ? context.maxTokens() : context.configMaxTokens().apply(config);
        if (!resolved.fallback()) {
            return new CallSettings(config.getModel(), vault.decrypt(config.getApiKey()), config.getBaseUrl(),
                    temperature, maxTokens);
        }
        CallSettings fallback = providerSettings(resolved.providerKey(), resolved.adapter());
        return new CallSettings(fallback.model(), fallback.apiKey(), fallback.baseUrl(), temperature, maxTokens);
    }

    private CallSettings providerSettings(String providerKey, LlmProvider adapter) {
        Map<String, AiProviderConfig.ProviderSettings> providers = properties.getProviders();
        AiProviderConfig.ProviderSettings settings = providers.get(providerKey);
        if (settings == null && adapter.getName() != null) {
            settings = providers.get(ProviderRegistry.normalize(adapter.getName()));
        }
        if (settings == null || !settings.isEnabled()) {
            log.warn("No enabled settings for fallback provider {}, using {} defaults", providerKey, adapter.getName());
            return CallSettings.of(adapter.getDefaultModel(), null, null);
        }
        String model = settings.getDefaultModel() != null && !settings.getDefaultModel().isBlank()
                ? settings.getDefaultModel()
                : adapter.getDefaultModel();
        return CallSettings.of(model, vault.decrypt(settings.getApiKey()), settings.getBaseUrl());
    }

    private RetryPolicy policyFor(LlmProvider adapter) {
        return adapter.isLocal()
                ? RetryPolicy.local(properties.getRetry().getLocal())
                : RetryPolicy.hosted(properties.getRetry().getHosted());
    }

    private UsageRecord usageRecord(CallContext context, String provider, String model, TokenUsage usage,
                                    long latencyMs, boolean success) {
        return UsageRecord.builder()
                .userId(context.userId())
                .feature(context.feature())
                .provider(provider)
                .model(model)
                .promptTokens(usage.promptTokens())
                .completionTokens(usage.completionTokens())
                .totalTokens(usage.totalTokens())
                .projectId(context.projectId())
                .fileId(context.fileId())
                .language(context.language())
                .latencyMs(latencyMs)
                .success(success)
                .createdAt(clock.instant())
                .build();
    }

    private long elapsedMs(Instant start) {
        return Duration.between(start, clock.instant()).toMillis();
    }

    private static boolean isProviderFailure(Throwable e) {
        return e instanceof UpstreamException || e instanceof GatewayTimeoutException;
    }

    static String newConversationId() {
        return "conv_" + System.currentTimeMillis() + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    private record CallContext(String feature, String userId, String projectId, String fileId, String language,
                               Double temperature, Integer maxTokens,
                               Function<AiConfiguration, Integer> configMaxTokens) {
    }

    public record ProviderEntry(ProviderCatalog.ProviderInfo info, HealthRecord health) {
    }

    public record SupportedProviders(List<ProviderEntry> providers, String defaultProvider, String defaultModel) {
    }
}
