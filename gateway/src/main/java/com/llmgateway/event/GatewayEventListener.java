package com.llmgateway.event;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs gateway events and counts them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GatewayEventListener {

    private final MeterRegistry meterRegistry;

    @EventListener
    public void onConfigUpdated(GatewayEvent.ConfigUpdated event) {
        log.info("AI configuration updated: provider={}, model={}", event.provider(), event.model());
    }

    @EventListener
    public void onHealthUpdated(GatewayEvent.HealthUpdated event) {
        log.info("Provider {} health changed {} -> {} (latency={}ms)",
                event.provider(), event.previousStatus(), event.status(), event.latencyMs());
        meterRegistry.counter("ai.health.status",
                "provider", event.provider(), "status", event.status().name().toLowerCase()).increment();
    }

    @EventListener
    public void onProviderFallback(GatewayEvent.ProviderFallback event) {
        log.warn("Falling back from {} to {} ({})", event.primary(), event.fallback(), event.reason());
        meterRegistry.counter("ai.routing.fallback",
                "from", event.primary(), "to", event.fallback()).increment();
    }
}
