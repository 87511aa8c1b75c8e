package com.llmgateway.health;

import com.llmgateway.config.AiProviderConfig;
import com.llmgateway.event.GatewayEvent;
import com.llmgateway.event.GatewayEventPublisher;
import com.llmgateway.execution.DeadlineRace;
import com.llmgateway.model.AiConfiguration;
import com.llmgateway.model.HealthRecord;
import com.llmgateway.model.HealthStatus;
import com.llmgateway.provider.CallSettings;
import com.llmgateway.provider.LlmProvider;
import com.llmgateway.registry.ProviderRegistry;
import com.llmgateway.security.CredentialVault;
import com.llmgateway.service.AiConfigStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Probes the configured provider in the background and keeps the last known health of every
 * provider key. A probe never fails its caller; any failure is recorded as {@code DOWN}.
 */
@Slf4j
@Component
public class ProviderHealthMonitor {

    private final AiConfigStore configStore;
    private final ProviderRegistry registry;
    private final CredentialVault vault;
    private final GatewayEventPublisher events;
    private final AiProviderConfig.HealthSettings settings;
    private final Clock clock;
    private final Scheduler scheduler;

    private final Map<String, HealthRecord> records = new ConcurrentHashMap<>();
    private final AtomicBoolean probing = new AtomicBoolean();
    private final AtomicBoolean recheckRequested = new AtomicBoolean();

    @Autowired
    public ProviderHealthMonitor(AiConfigStore configStore, ProviderRegistry registry, CredentialVault vault,
                                 GatewayEventPublisher events, AiProviderConfig properties, Clock clock) {
        this(configStore, registry, vault, events, properties, clock, Schedulers.parallel());
    }

    public ProviderHealthMonitor(AiConfigStore configStore, ProviderRegistry registry, CredentialVault vault,
                                 GatewayEventPublisher events, AiProviderConfig properties, Clock clock,
                                 Scheduler scheduler) {
        this.configStore = configStore;
        this.registry = registry;
        this.vault = vault;
        this.events = events;
        this.settings = properties.getHealth();
        this.clock = clock;
        this.scheduler = scheduler;
    }

    /**
     * Fires once at startup and then every interval.
     */
    @Scheduled(fixedRateString = "${ai.health.interval-ms:600000}")
    public void scheduledCheck() {
        checkHealth().subscribe();
    }

    @EventListener
    public void onConfigUpdated(GatewayEvent.ConfigUpdated event) {
        log.debug("Configuration changed to {}, re-checking health", event.provider());
        recheckRequested.set(true);
        checkHealth().subscribe();
    }

    /**
     * Probes the configured provider unless monitoring is off or a probe is already running.
     * Completes empty when skipped. A configuration change that arrives while a probe runs is
     * checked again as soon as that probe ends.
     */
    public Mono<HealthRecord> checkHealth() {
        if (!probing.compareAndSet(false, true)) {
            log.debug("Health probe already in progress, skipping");
            return Mono.empty();
        }
        recheckRequested.set(false);
        return configStore.getConfig()
                .flatMap(config -> config.isMonitoringEnabled() ? probe(config) : Mono.<HealthRecord>empty())
                .onErrorResume(e -> {
                    log.warn("Health check could not run: {}", e.getMessage());
                    return Mono.empty();
                })
                .doFinally(signal -> {
                    probing.set(false);
                    if (recheckRequested.get()) {
                        log.debug("Configuration changed during the health probe, probing again");
                        checkHealth().subscribe();
                    }
                });
    }

    /**
     * Feeds the outcome of a real call into the provider's health record.
     */
    public void recordObservation(String providerKey, boolean success, long latencyMs) {
        update(ProviderRegistry.normalize(providerKey), classify(success, latencyMs));
    }

    public HealthRecord get(String providerKey) {
        return records.getOrDefault(ProviderRegistry.normalize(providerKey), HealthRecord.UNKNOWN);
    }

    public Map<String, HealthRecord> snapshot() {
        return Map.copyOf(records);
    }

    HealthRecord classify(boolean success, long latencyMs) {
        Instant now = clock.instant();
        if (!success) {
            return new HealthRecord(HealthStatus.DOWN, now, null);
        }
        HealthStatus status = latencyMs <= settings.getDegradedThresholdMs() ? HealthStatus.UP : HealthStatus.DEGRADED;
        return new HealthRecord(status, now, latencyMs);
    }

    private Mono<HealthRecord> probe(AiConfiguration config) {
        String key = ProviderRegistry.normalize(config.getProvider());
        LlmProvider adapter = registry.resolve(config.getProvider());
        CallSettings call = CallSettings.of(config.getModel(), vault.decrypt(config.getApiKey()), config.getBaseUrl());
        Duration timeout = settings.getProbeTimeout();

        return Mono.defer(() -> {
                    Instant start = clock.instant();
                    return DeadlineRace.race(Mono.defer(() -> adapter.testConnection(call)), timeout, scheduler)
                            .map(outcome -> {
                                if (outcome instanceof DeadlineRace.TimedOut) {
                                    log.warn("Health probe of {} timed out after {}", key, timeout);
                                    return classify(false, timeout.toMillis());
                                }
                                return classify(true, Duration.between(start, clock.instant()).toMillis());
                            });
                })
                .onErrorResume(e -> {
                    log.warn("Health probe of {} failed: {}", key, e.getMessage());
                    return Mono.just(classify(false, 0));
                })
                .doOnNext(record -> update(key, record));
    }

    private void update(String key, HealthRecord record) {
        HealthRecord previous = records.put(key, record);
        HealthStatus previousStatus = previous != null ? previous.status() : HealthStatus.UNKNOWN;
        if (previousStatus != record.status()) {
            events.publish(new GatewayEvent.HealthUpdated(key, previousStatus, record.status(),
                    record.latencyMs(), record.lastCheck()));
        }
    }
}
