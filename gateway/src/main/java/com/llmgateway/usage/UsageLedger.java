package com.llmgateway.usage;

import reactor.core.publisher.Mono;

/**
 * Token totals of the current UTC day.
 */
public interface UsageLedger {

    Mono<Long> userTokensToday(String userId);

    Mono<Long> tokensToday();
}
