package com.llmgateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmgateway.parse.ResponseNormalizer;
import com.llmgateway.parse.TokenEstimator;
import com.llmgateway.prompt.PromptBuilder;
import com.llmgateway.provider.ClaudeProvider;
import com.llmgateway.provider.DeepSeekProvider;
import com.llmgateway.provider.LocalLlmProvider;
import com.llmgateway.provider.OpenAiCompatibleProvider;
import com.llmgateway.provider.ProviderSupport;
import com.llmgateway.registry.ProviderRegistry;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

@Configuration
public class ProviderConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProviderSupport providerSupport(WebClient.Builder webClientBuilder,
                                           AiProviderConfig config,
                                           MeterRegistry meterRegistry,
                                           CircuitBreakerRegistry circuitBreakerRegistry,
                                           ObjectMapper objectMapper,
                                           PromptBuilder promptBuilder,
                                           ResponseNormalizer normalizer,
                                           TokenEstimator tokenEstimator) {
        // no base URL: every call carries the absolute endpoint of its provider
        WebClient webClient = webClientBuilder
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
        return new ProviderSupport(webClient, config, meterRegistry, circuitBreakerRegistry, objectMapper,
                promptBuilder, normalizer, tokenEstimator);
    }

    @Bean
    public OpenAiCompatibleProvider openAiProvider(ProviderSupport support) {
        return new OpenAiCompatibleProvider(support);
    }

    @Bean
    public ClaudeProvider claudeProvider(ProviderSupport support) {
        return new ClaudeProvider(support);
    }

    @Bean
    public DeepSeekProvider deepSeekProvider(ProviderSupport support) {
        return new DeepSeekProvider(support);
    }

    @Bean
    public LocalLlmProvider localLlmProvider(ProviderSupport support) {
        return new LocalLlmProvider(support);
    }

    @Bean
    public ProviderRegistry providerRegistry(@Qualifier("openAiProvider") OpenAiCompatibleProvider openAi,
                                             ClaudeProvider claude,
                                             DeepSeekProvider deepSeek,
                                             LocalLlmProvider local) {
        return ProviderRegistry.builder()
                .register(openAi, "openai", "zhipu", "baidu", "minimax")
                .register(claude, "claude", "anthropic")
                .register(deepSeek, "deepseek")
                .register(local, "localllm", "local", "ollama")
                .defaultKey(OpenAiCompatibleProvider.PROVIDER_NAME)
                .build();
    }
}
