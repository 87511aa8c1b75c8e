package com.llmgateway.service;

import com.llmgateway.config.AiProviderConfig;
import com.llmgateway.exception.UsageLimitExceededException;
import com.llmgateway.model.AiConfiguration;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class RateLimitService {

    private final AiProviderConfig config;
    private final MeterRegistry meterRegistry;

    private final Map<String, UserBuckets> buckets = new ConcurrentHashMap<>();

    /**
     * Takes one request permit for the user and verifies the hourly token allowance is not
     * used up. Buckets are rebuilt when the configured limits change.
     */
    public void checkRequest(String userId, AiConfiguration.RateLimit limits) {
        if (!config.getRateLimit().isEnabled() || userId == null || limits == null) {
            return;
        }

        UserBuckets userBuckets = buckets.compute(userId, (id, existing) ->
                existing != null && existing.limits().equals(limits) ? existing : createBuckets(limits));

        if (userBuckets.requests() != null && !userBuckets.requests().tryConsume(1)) {
            meterRegistry.counter("ai.ratelimit", "status", "exceeded", "limit", "requests").increment();
            log.warn("Rate limit exceeded for: {}", userId);
            throw new UsageLimitExceededException("rate_limit_exceeded",
                    "Too many requests: limit is " + limits.getRequestsPerMinute() + " per minute");
        }
        if (userBuckets.tokens() != null && userBuckets.tokens().getAvailableTokens() <= 0) {
            meterRegistry.counter("ai.ratelimit", "status", "exceeded", "limit", "tokens").increment();
            log.warn("Token rate exceeded for: {}", userId);
            throw new UsageLimitExceededException("token_rate_exceeded",
                    "Token allowance of " + limits.getTokensPerHour() + " per hour used up");
        }
        meterRegistry.counter("ai.ratelimit", "status", "allowed", "limit", "requests").increment();
    }

    /**
     * Charges the tokens a completed call used. May drive the allowance negative; the next
     * request is then refused until it refills.
     */
    public void recordTokens(String userId, long tokens) {
        if (userId == null || tokens <= 0) {
            return;
        }
        UserBuckets userBuckets = buckets.get(userId);
        if (userBuckets != null && userBuckets.tokens() != null) {
            userBuckets.tokens().consumeIgnoringRateLimits(tokens);
        }
    }

    /**
     * Reset rate limit for a specific user (admin function)
     */
    public void resetLimit(String userId) {
        buckets.remove(userId);
        log.info("Rate limit reset for: {}", userId);
    }

    private UserBuckets createBuckets(AiConfiguration.RateLimit limits) {
        Bucket requests = limits.getRequestsPerMinute() > 0
                ? createBucket(limits.getRequestsPerMinute(), Duration.ofMinutes(1))
                : null;
        Bucket tokens = limits.getTokensPerHour() > 0
                ? createBucket(limits.getTokensPerHour(), Duration.ofHours(1))
                : null;
        return new UserBuckets(limits, requests, tokens);
    }

    private Bucket createBucket(long capacity, Duration period) {
        Bandwidth limit = Bandwidth.classic(
                capacity,
                Refill.greedy(capacity, period)
        );
        return Bucket.builder()
                .addLimit(limit)
                .build();
    }

    // a null bucket means that dimension is unlimited
    private record UserBuckets(AiConfiguration.RateLimit limits, Bucket requests, Bucket tokens) {}
}
