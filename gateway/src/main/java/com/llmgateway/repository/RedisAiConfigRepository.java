package com.llmgateway.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmgateway.exception.ConfigurationException;
import com.llmgateway.model.AiConfiguration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

/**
 * Stores the configuration as one JSON document, so a save is a single atomic SET.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class RedisAiConfigRepository implements AiConfigRepository {

    static final String CONFIG_KEY = "ai:config:active";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<AiConfiguration> findActive() {
        return redisTemplate.opsForValue().get(CONFIG_KEY)
                .flatMap(json -> {
                    try {
                        return Mono.just(objectMapper.readValue(json, AiConfiguration.class));
                    } catch (JsonProcessingException e) {
                        log.error("Stored AI configuration is unreadable", e);
                        return Mono.error(new ConfigurationException("Stored AI configuration is unreadable", e));
                    }
                });
    }

    @Override
    public Mono<AiConfiguration> save(AiConfiguration configuration) {
        String json;
        try {
            json = objectMapper.writeValueAsString(configuration);
        } catch (JsonProcessingException e) {
            return Mono.error(new ConfigurationException("AI configuration cannot be serialized", e));
        }
        return redisTemplate.opsForValue().set(CONFIG_KEY, json)
                .<AiConfiguration>flatMap(stored -> stored
                        ? Mono.just(configuration)
                        : Mono.error(new ConfigurationException("Redis refused to store the AI configuration")))
                .doOnSuccess(saved -> log.debug("Stored AI configuration for provider {}", configuration.getProvider()));
    }
}
