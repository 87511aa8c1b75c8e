package com.llmgateway.provider;

/**
 * Per-call provider parameters resolved by the gateway. {@code apiKey} is already decrypted;
 * null fields fall back to the adapter's own defaults.
 */
public record CallSettings(String model, String apiKey, String baseUrl, Double temperature, Integer maxTokens) {

    public static CallSettings of(String model, String apiKey, String baseUrl) {
        return new CallSettings(model, apiKey, baseUrl, null, null);
    }

    public CallSettings withMaxTokens(Integer maxTokens) {
        return new CallSettings(model, apiKey, baseUrl, temperature, maxTokens);
    }

    @Override
    public String toString() {
        return "CallSettings[model=" + model + ", baseUrl=" + baseUrl + ", temperature=" + temperature
                + ", maxTokens=" + maxTokens + "]";
    }
}
