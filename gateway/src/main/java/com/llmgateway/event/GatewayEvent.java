package com.llmgateway.event;

import com.llmgateway.model.HealthStatus;

import java.time.Instant;

/**
 * Notifications emitted by the gateway for the surrounding application.
 */
public sealed interface GatewayEvent permits GatewayEvent.ConfigUpdated, GatewayEvent.HealthUpdated,
        GatewayEvent.ProviderFallback {

    String type();

    Instant timestamp();

    record ConfigUpdated(String provider, String model, Instant timestamp) implements GatewayEvent {
        @Override
        public String type() {
            return "config.updated";
        }
    }

    /**
     * @param latencyMs {@code null} when the provider failed
     */
    record HealthUpdated(String provider, HealthStatus previousStatus, HealthStatus status, Long latencyMs,
                         Instant timestamp) implements GatewayEvent {
        @Override
        public String type() {
            return "health.updated";
        }
    }

    record ProviderFallback(String primary, String fallback, String reason, Instant timestamp)
            implements GatewayEvent {

        public static final String HEALTH_CHECK_FAILED = "health_check_failed";

        @Override
        public String type() {
            return "provider.fallback";
        }
    }
}
