package com.llmgateway.service;

import com.llmgateway.config.AiProviderConfig;
import com.llmgateway.event.GatewayEvent;
import com.llmgateway.event.GatewayEventPublisher;
import com.llmgateway.exception.ConfigurationException;
import com.llmgateway.exception.GatewayException;
import com.llmgateway.exception.GatewayTimeoutException;
import com.llmgateway.execution.DeadlineRace;
import com.llmgateway.model.AiConfiguration;
import com.llmgateway.model.ConfigUpdate;
import com.llmgateway.registry.ProviderRegistry;
import com.llmgateway.repository.AiConfigRepository;
import com.llmgateway.security.CredentialVault;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the single live {@link AiConfiguration}: a TTL cache in front of the repository,
 * validation and encryption on update, and the {@code config.updated} notification.
 *
 * <p>The cached value is replaced in one reference swap, so concurrent readers see either the
 * old or the new configuration, never a mix.
 */
@Slf4j
@Service
public class AiConfigStore {

    static final int MIN_GENERATE_TOKENS = 10;
    static final int RECOMMENDED_KEY_LENGTH = 32;

    private final AiConfigRepository repository;
    private final CredentialVault vault;
    private final ProviderRegistry registry;
    private final GatewayEventPublisher events;
    private final AiProviderConfig properties;
    private final Clock clock;
    private final Scheduler scheduler;

    private final AtomicReference<CachedConfig> cache = new AtomicReference<>();
    private final AtomicBoolean seen = new AtomicBoolean();
    private final AtomicReference<Mono<AiConfiguration>> defaultCreation = new AtomicReference<>();

    @Autowired
    public AiConfigStore(AiConfigRepository repository, CredentialVault vault, ProviderRegistry registry,
                         GatewayEventPublisher events, AiProviderConfig properties, Clock clock) {
        this(repository, vault, registry, events, properties, clock, Schedulers.parallel());
    }

    public AiConfigStore(AiConfigRepository repository, CredentialVault vault, ProviderRegistry registry,
                         GatewayEventPublisher events, AiProviderConfig properties, Clock clock,
                         Scheduler scheduler) {
        this.repository = repository;
        this.vault = vault;
        this.registry = registry;
        this.events = events;
        this.properties = properties;
        this.clock = clock;
        this.scheduler = scheduler;
    }

    record CachedConfig(AiConfiguration value, Instant fetchedAt) {
    }

    /**
     * Cached configuration while younger than the TTL, otherwise a fresh load.
     */
    public Mono<AiConfiguration> getConfig() {
        CachedConfig cached = cache.get();
        if (cached != null && isFresh(cached)) {
            return Mono.just(cached.value());
        }
        return loadConfig();
    }

    /**
     * Loads from the repository with retry and a deadline. The first load ever synthesizes and
     * stores the default configuration when the repository is empty.
     */
    public Mono<AiConfiguration> loadConfig() {
        AiProviderConfig.ConfigStoreSettings settings = properties.getConfigStore();
        Duration deadline = settings.getLoadTimeout();

        Mono<AiConfiguration> load = Mono.defer(repository::findActive)
                .switchIfEmpty(Mono.defer(this::createDefault))
                .retryWhen(Retry.backoff(Math.max(settings.getMaxAttempts() - 1, 0), settings.getBaseDelay())
                        .jitter(0)
                        .scheduler(scheduler)
                        .filter(e -> !(e instanceof ConfigurationException))
                        .doBeforeRetry(signal -> log.warn("Loading AI configuration failed (attempt {}): {}",
                                signal.totalRetries() + 1, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()));

        return DeadlineRace.race(load, deadline, scheduler)
                .<AiConfiguration>flatMap(outcome -> {
                    if (outcome instanceof DeadlineRace.Completed<AiConfiguration> completed) {
                        return Mono.just(completed.value());
                    }
                    return Mono.error(new GatewayTimeoutException(
                            "Loading AI configuration exceeded " + deadline, deadline));
                })
                .onErrorMap(e -> !(e instanceof GatewayException),
                        e -> new ConfigurationException("Failed to load AI configuration: " + e.getMessage(), e))
                .doOnNext(this::remember);
    }

    /**
     * Validates and applies the non-null fields of {@code update}, persists the result and
     * swaps the cache.
     */
    public Mono<AiConfiguration> updateConfig(ConfigUpdate update) {
        return repository.findActive()
                .switchIfEmpty(Mono.error(new ConfigurationException("No AI configuration to update")))
                .map(current -> apply(current, update))
                .flatMap(repository::save)
                .doOnNext(saved -> {
                    remember(saved);
                    log.info("AI configuration updated: provider={}, model={}, apiKey={}",
                            saved.getProvider(), saved.getModel(), CredentialVault.mask(update.getApiKey()));
                    events.publish(new GatewayEvent.ConfigUpdated(saved.getProvider(), saved.getModel(),
                            clock.instant()));
                });
    }

    /**
     * Drops the cached value; the next read goes to the repository.
     */
    public void invalidate() {
        cache.set(null);
    }

    AiConfiguration apply(AiConfiguration current, ConfigUpdate update) {
        if (update.getProvider() != null && !registry.isRegistered(update.getProvider())) {
            throw new ConfigurationException("Unsupported provider: " + update.getProvider());
        }
        if (update.getTemperature() != null && !isUnitInterval(update.getTemperature())) {
            throw new ConfigurationException("Temperature must be between 0 and 1, got " + update.getTemperature());
        }
        if (update.getMaxTokensGenerate() != null && update.getMaxTokensGenerate() < MIN_GENERATE_TOKENS) {
            throw new ConfigurationException("maxTokensGenerate must be at least " + MIN_GENERATE_TOKENS);
        }
        if (update.getFallbackProviders() != null) {
            update.getFallbackProviders().stream()
                    .filter(key -> !registry.isRegistered(key))
                    .forEach(key -> log.warn("Fallback provider '{}' is not registered", key));
        }

        AiConfiguration.AiConfigurationBuilder builder = current.toBuilder();
        if (update.getProvider() != null) {
            builder.provider(update.getProvider());
        }
        if (update.getModel() != null) {
            builder.model(update.getModel());
        }
        if (update.getApiKey() != null) {
            warnOnShortKey(update.getApiKey());
            builder.apiKey(vault.encrypt(update.getApiKey()));
        }
        if (update.getBaseUrl() != null) {
            warnOnInvalidUrl(update.getBaseUrl());
            builder.baseUrl(update.getBaseUrl());
        }
        if (update.getTemperature() != null) {
            builder.temperature(update.getTemperature());
        }
        if (update.getMaxTokensGenerate() != null) {
            builder.maxTokensGenerate(update.getMaxTokensGenerate());
        }
        if (update.getMaxTokensAnalyze() != null) {
            builder.maxTokensAnalyze(update.getMaxTokensAnalyze());
        }
        if (update.getMaxTokensChat() != null) {
            builder.maxTokensChat(update.getMaxTokensChat());
        }
        if (update.getUsageLimit() != null) {
            builder.usageLimit(update.getUsageLimit());
        }
        if (update.getRateLimit() != null) {
            builder.rateLimit(update.getRateLimit());
        }
        if (update.getMonitoringEnabled() != null) {
            builder.monitoringEnabled(update.getMonitoringEnabled());
        }
        if (update.getFallbackProviders() != null) {
            builder.fallbackProviders(List.copyOf(update.getFallbackProviders()));
        }
        if (update.getContentFiltering() != null) {
            builder.contentFiltering(update.getContentFiltering());
        }
        return builder.updatedAt(clock.instant()).build();
    }

    AiConfiguration defaultConfiguration() {
        AiProviderConfig.DefaultsSettings defaults = properties.getDefaults();
        String apiKey = defaults.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("No default API key configured; hosted providers will refuse calls until one is set");
            apiKey = null;
        } else {
            warnOnShortKey(apiKey);
            apiKey = vault.encrypt(apiKey);
        }
        warnOnInvalidUrl(defaults.getBaseUrl());

        return AiConfiguration.builder()
                .provider(defaults.getProvider())
                .model(defaults.getModel())
                .apiKey(apiKey)
                .baseUrl(defaults.getBaseUrl())
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
                .updatedAt(clock.instant())
                .build();
    }

    /**
     * Concurrent first loads share one save. A failed save is forgotten so the next attempt
     * creates the default again.
     */
    private Mono<AiConfiguration> createDefault() {
        if (seen.get()) {
            return Mono.error(new ConfigurationException("Active AI configuration is missing from the store"));
        }
        Mono<AiConfiguration> creation = Mono.defer(() -> {
                    log.info("No AI configuration stored, creating the default one");
                    return repository.save(defaultConfiguration());
                })
                .doOnError(e -> defaultCreation.set(null))
                .cache();
        if (defaultCreation.compareAndSet(null, creation)) {
            return creation;
        }
        Mono<AiConfiguration> inFlight = defaultCreation.get();
        return inFlight != null ? inFlight : createDefault();
    }

    private void remember(AiConfiguration configuration) {
        cache.set(new CachedConfig(configuration, clock.instant()));
        seen.set(true);
    }

    private boolean isFresh(CachedConfig cached) {
        Duration age = Duration.between(cached.fetchedAt(), clock.instant());
        return age.compareTo(properties.getConfigStore().getCacheTtl()) < 0;
    }

    private static boolean isUnitInterval(double value) {
        return value >= 0 && value <= 1;
    }

    private static void warnOnShortKey(String apiKey) {
        if (apiKey.length() < RECOMMENDED_KEY_LENGTH) {
            log.warn("API key {} is shorter than {} characters", CredentialVault.mask(apiKey), RECOMMENDED_KEY_LENGTH);
        }
    }

    private static void warnOnInvalidUrl(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            return;
        }
        try {
            URI uri = new URI(baseUrl);
            if (uri.getScheme() == null || uri.getHost() == null) {
                log.warn("Base URL '{}' is not an absolute URL", baseUrl);
            }
        } catch (URISyntaxException e) {
            log.warn("Base URL '{}' is not a valid URL: {}", baseUrl, e.getMessage());
        }
    }
}
