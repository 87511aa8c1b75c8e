package com.llmgateway.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.llmgateway.config.AiProviderConfig;
import com.llmgateway.exception.CredentialException;
import com.llmgateway.exception.UpstreamException;
import com.llmgateway.model.ChatModels;
import com.llmgateway.model.ChatModels.Message;
import com.llmgateway.model.TaskModels.AnalyzeCodeOptions;
import com.llmgateway.model.TaskModels.AnalyzeCodeResult;
import com.llmgateway.model.TaskModels.ConnectionTestResult;
import com.llmgateway.model.TaskModels.GenerateCodeOptions;
import com.llmgateway.model.TaskModels.GenerateCodeResult;
import com.llmgateway.model.TaskModels.OptimizeCodeOptions;
import com.llmgateway.model.TaskModels.OptimizeCodeResult;
import com.llmgateway.model.TokenUsage;
import com.llmgateway.prompt.PromptBuilder;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Task plumbing shared by all adapters: prompt building, normalization, usage resolution,
 * metrics and the per-provider circuit breaker. Subclasses only speak their wire format.
 */
@Slf4j
public abstract class AbstractLlmProvider implements LlmProvider {

    public static final String CIRCUIT_OPEN = "circuit_open";

    protected final ProviderSupport support;
    private final String name;

    protected AbstractLlmProvider(ProviderSupport support, String name) {
        this.support = support;
        this.name = name;
    }

    /**
     * One round trip carrying {@code messages}; errors are mapped with {@link #mapErrors}.
     */
    protected abstract Mono<RawCompletion> complete(List<Message> messages, CallSettings call);

    protected abstract String builtInDefaultModel();

    protected abstract String defaultBaseUrl();

    protected boolean requiresApiKey() {
        return !isLocal();
    }

    /**
     * Hook for providers that accept aliases of their model ids.
     */
    protected String resolveModel(String model) {
        return model;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDefaultModel() {
        AiProviderConfig.ProviderSettings settings = settings();
        if (settings != null && hasText(settings.getDefaultModel())) {
            return settings.getDefaultModel();
        }
        return builtInDefaultModel();
    }

    @Override
    public boolean isLocal() {
        return false;
    }

    @Override
    public Mono<GenerateCodeResult> generateCode(String prompt, String language, GenerateCodeOptions options,
                                                 CallSettings call) {
        List<Message> messages = support.promptBuilder().generate(prompt, language, options);
        return guarded("generate", complete(messages, call))
                .map(raw -> support.normalizer().normalizeGenerate(raw.content())
                        .withUsage(usage(raw, messages)));
    }

    @Override
    public Mono<AnalyzeCodeResult> analyzeCode(String code, String language, AnalyzeCodeOptions options,
                                               CallSettings call) {
        List<Message> messages = support.promptBuilder().analyze(code, language, options);
        return guarded("analyze", complete(messages, call))
                .map(raw -> support.normalizer().normalizeAnalyze(raw.content())
                        .withUsage(usage(raw, messages)));
    }

    @Override
    public Mono<OptimizeCodeResult> optimizeCode(String code, String language, OptimizeCodeOptions options,
                                                 CallSettings call) {
        List<Message> messages = support.promptBuilder().optimize(code, language, options);
        return guarded("optimize", complete(messages, call))
                .map(raw -> support.normalizer().normalizeOptimize(raw.content())
                        .withUsage(usage(raw, messages)));
    }

    @Override
    public Mono<ChatReply> chat(List<Message> messages, CallSettings call) {
        return guarded("chat", complete(messages, call))
                .map(raw -> new ChatReply(raw.content() != null ? raw.content() : "", usage(raw, messages)));
    }

    @Override
    public int countTokens(String text) {
        return support.tokenEstimator().countTokens(text);
    }

    /**
     * Wraps a lazy provider call with the circuit breaker, latency timer and request counters.
     * An open breaker surfaces as a retryable {@link UpstreamException} with code
     * {@value #CIRCUIT_OPEN}.
     */
    protected <T> Mono<T> guarded(String operation, Mono<T> call) {
        return Mono.defer(() -> {
            Timer.Sample sample = Timer.start(support.meterRegistry());
            return call
                    .transformDeferred(CircuitBreakerOperator.of(
                            support.circuitBreakerRegistry().circuitBreaker(name)))
                    .onErrorMap(CallNotPermittedException.class, e -> new UpstreamException(name, 0,
                            CIRCUIT_OPEN, name + " circuit breaker is open: " + e.getMessage(), true, e))
                    .doOnSuccess(result -> {
                        sample.stop(support.meterRegistry().timer("ai.provider.latency",
                                "provider", name, "operation", operation));
                        support.meterRegistry().counter("ai.provider.requests",
                                "provider", name, "status", "success").increment();
                    })
                    .doOnError(e -> {
                        log.error("{} {} error: {}", name, operation, e.getMessage());
                        support.meterRegistry().counter("ai.provider.requests",
                                "provider", name, "status", "error").increment();
                    });
        });
    }

    /**
     * Translates WebClient failures into {@link UpstreamException}s carrying the provider's own
     * error type and message when the body has them.
     */
    protected <T> Mono<T> mapErrors(Mono<T> call) {
        return call
                .onErrorMap(WebClientResponseException.class, this::toUpstream)
                .onErrorMap(WebClientRequestException.class, e -> new UpstreamException(name, 0,
                        "network_error", name + " unreachable: " + e.getMessage(), false, e));
    }

    /**
     * Hosted providers refuse to go out without a credential.
     */
    protected Mono<Void> checkCredentials(CallSettings call) {
        if (requiresApiKey() && !hasText(call.apiKey())) {
            return Mono.error(new CredentialException("No API key configured for provider " + name));
        }
        return Mono.empty();
    }

    protected String model(CallSettings call) {
        return resolveModel(hasText(call.model()) ? call.model() : getDefaultModel());
    }

    protected String baseUrl(CallSettings call) {
        String url = call.baseUrl();
        if (!hasText(url)) {
            AiProviderConfig.ProviderSettings settings = settings();
            url = settings != null && hasText(settings.getBaseUrl()) ? settings.getBaseUrl() : defaultBaseUrl();
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    protected AiProviderConfig.ProviderSettings settings() {
        return support.config().getProviders().get(name);
    }

    private TokenUsage usage(RawCompletion raw, List<Message> messages) {
        return support.tokenEstimator().resolve(raw.usage(), PromptBuilder.serialize(messages));
    }

    private UpstreamException toUpstream(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        String code = "http_" + status;
        String message = e.getStatusText();
        String body = e.getResponseBodyAsString();
        if (hasText(body)) {
            try {
                ChatModels.ErrorResponse error = support.objectMapper().readValue(body, ChatModels.ErrorResponse.class);
                if (error.getError() != null) {
                    if (hasText(error.getError().getType())) {
                        code = error.getError().getType();
                    } else if (hasText(error.getError().getCode())) {
                        code = error.getError().getCode();
                    }
                    if (hasText(error.getError().getMessage())) {
                        message = error.getError().getMessage();
                    }
                }
            } catch (JsonProcessingException notJson) {
                log.debug("{} error body is not JSON: {}", name, body);
            }
        }
        return new UpstreamException(name, status, code, message,
                UpstreamException.isRetryableStatus(status), e);
    }

    protected static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
