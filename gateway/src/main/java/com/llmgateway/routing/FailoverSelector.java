package com.llmgateway.routing;

import com.llmgateway.event.GatewayEvent;
import com.llmgateway.event.GatewayEventPublisher;
import com.llmgateway.health.ProviderHealthMonitor;
import com.llmgateway.model.AiConfiguration;
import com.llmgateway.registry.ProviderRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Picks the adapter for a call from the recorded health. The primary is kept unless it is
 * known to be down and a declared fallback is not; a provider never checked counts as usable.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FailoverSelector {

    private final ProviderRegistry registry;
    private final ProviderHealthMonitor healthMonitor;
    private final GatewayEventPublisher events;
    private final Clock clock;

    public ResolvedProvider resolveAdapter(AiConfiguration config) {
        String primary = ProviderRegistry.normalize(config.getProvider());
        ResolvedProvider primaryResolution = new ResolvedProvider(primary, registry.resolve(primary), false);

        List<String> fallbacks = config.getFallbackProviders();
        if (!healthMonitor.get(primary).isDown() || fallbacks == null || fallbacks.isEmpty()) {
            return primaryResolution;
        }

        for (String candidate : fallbacks) {
            String key = ProviderRegistry.normalize(candidate);
            if (key.equals(primary) || healthMonitor.get(key).isDown()) {
                continue;
            }
            events.publish(new GatewayEvent.ProviderFallback(primary, key,
                    GatewayEvent.ProviderFallback.HEALTH_CHECK_FAILED, clock.instant()));
            return new ResolvedProvider(key, registry.resolve(key), true);
        }

        log.warn("Provider {} is down and no fallback is healthy, using it anyway", primary);
        return primaryResolution;
    }
}
