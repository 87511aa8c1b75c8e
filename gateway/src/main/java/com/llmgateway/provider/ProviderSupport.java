package com.llmgateway.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmgateway.config.AiProviderConfig;
import com.llmgateway.parse.ResponseNormalizer;
import com.llmgateway.parse.TokenEstimator;
import com.llmgateway.prompt.PromptBuilder;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Collaborators every adapter needs, bundled so adapters stay cheap to construct.
 */
public record ProviderSupport(WebClient webClient,
                              AiProviderConfig config,
                              MeterRegistry meterRegistry,
                              CircuitBreakerRegistry circuitBreakerRegistry,
                              ObjectMapper objectMapper,
                              PromptBuilder promptBuilder,
                              ResponseNormalizer normalizer,
                              TokenEstimator tokenEstimator) {
}
