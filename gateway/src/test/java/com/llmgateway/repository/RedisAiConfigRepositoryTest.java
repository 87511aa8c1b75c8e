package com.llmgateway.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.llmgateway.exception.ConfigurationException;
import com.llmgateway.model.AiConfiguration;
import com.llmgateway.testsupport.TestConfigs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RedisAiConfigRepositoryTest {

    private ReactiveValueOperations<String, String> valueOps;
    private RedisAiConfigRepository repository;
    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        ReactiveRedisTemplate<String, String> redisTemplate = mock(ReactiveRedisTemplate.class);
        valueOps = mock(ReactiveValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        repository = new RedisAiConfigRepository(redisTemplate, objectMapper);
    }

    @Test
    void savedConfigurationReadsBackEqual() {
        AiConfiguration config = TestConfigs.config().build();
        when(valueOps.set(eq(RedisAiConfigRepository.CONFIG_KEY), anyString())).thenReturn(Mono.just(true));

        assertSame(config, repository.save(config).block());

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOps).set(eq(RedisAiConfigRepository.CONFIG_KEY), json.capture());
        when(valueOps.get(RedisAiConfigRepository.CONFIG_KEY)).thenReturn(Mono.just(json.getValue()));

        assertEquals(config, repository.findActive().block());
    }

    @Test
    void missingKeyCompletesEmpty() {
        when(valueOps.get(RedisAiConfigRepository.CONFIG_KEY)).thenReturn(Mono.empty());

        StepVerifier.create(repository.findActive()).verifyComplete();
    }

    @Test
    void unreadableDocumentIsConfigurationError() {
        when(valueOps.get(RedisAiConfigRepository.CONFIG_KEY)).thenReturn(Mono.just("{not json"));

        StepVerifier.create(repository.findActive())
                .expectError(ConfigurationException.class)
                .verify();
    }

    @Test
    void refusedWriteIsConfigurationError() {
        when(valueOps.set(eq(RedisAiConfigRepository.CONFIG_KEY), anyString())).thenReturn(Mono.just(false));

        StepVerifier.create(repository.save(TestConfigs.config().build()))
                .expectError(ConfigurationException.class)
                .verify();
    }
}
