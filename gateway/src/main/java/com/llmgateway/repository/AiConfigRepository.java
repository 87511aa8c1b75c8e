package com.llmgateway.repository;

import com.llmgateway.model.AiConfiguration;
import reactor.core.publisher.Mono;

/**
 * Persistence port for the single active configuration.
 */
public interface AiConfigRepository {

    /**
     * Completes empty when no configuration has been stored yet
     */
    Mono<AiConfiguration> findActive();

    /**
     * Replaces the stored configuration as a whole
     */
    Mono<AiConfiguration> save(AiConfiguration configuration);
}
