package com.llmgateway.model;

import java.time.Instant;

/**
 * Last known health of one provider. Replaced wholesale on every observation.
 *
 * @param latencyMs probe or call latency, {@code null} when the provider failed
 */
public record HealthRecord(HealthStatus status, Instant lastCheck, Long latencyMs) {

    public static final HealthRecord UNKNOWN = new HealthRecord(HealthStatus.UNKNOWN, null, null);

    public boolean isDown() {
        return status == HealthStatus.DOWN;
    }
}
