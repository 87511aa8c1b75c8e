package com.llmgateway.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum HealthStatus {
    UP,
    DEGRADED,
    DOWN,
    UNKNOWN;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
