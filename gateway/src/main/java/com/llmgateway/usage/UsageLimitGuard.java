package com.llmgateway.usage;

import com.llmgateway.exception.UsageLimitExceededException;
import com.llmgateway.model.AiConfiguration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Rejects calls once today's token usage reached the configured limits. A limit of zero or less
 * is unlimited; an unreachable ledger lets the call through.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UsageLimitGuard {

    private final UsageLedger ledger;

    public Mono<Void> check(String userId, AiConfiguration config) {
        AiConfiguration.UsageLimit limit = config.getUsageLimit();
        if (limit == null) {
            return Mono.empty();
        }

        Mono<Void> global = limit.getDailyTokenLimit() <= 0 ? Mono.empty() : ledger.tokensToday()
                .<Void>flatMap(used -> used >= limit.getDailyTokenLimit()
                        ? Mono.error(new UsageLimitExceededException("daily_limit_exceeded",
                        "Daily token limit of " + limit.getDailyTokenLimit() + " reached"))
                        : Mono.empty());

        Mono<Void> user = userId == null || limit.getUserTokenLimit() <= 0 ? Mono.empty() : ledger.userTokensToday(userId)
                .<Void>flatMap(used -> used >= limit.getUserTokenLimit()
                        ? Mono.error(new UsageLimitExceededException("user_limit_exceeded",
                        "User " + userId + " reached the daily token limit of " + limit.getUserTokenLimit()))
                        : Mono.empty());

        return global.then(user)
                .onErrorResume(e -> !(e instanceof UsageLimitExceededException), e -> {
                    log.warn("Usage ledger unavailable, skipping limit check: {}", e.getMessage());
                    return Mono.empty();
                });
    }
}
