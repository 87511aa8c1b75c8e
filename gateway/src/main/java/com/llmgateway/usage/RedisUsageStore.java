package com.llmgateway.usage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmgateway.config.AiProviderConfig;
import com.llmgateway.model.UsageRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Keeps a capped Redis list of usage records plus per-day token counters (global and per user)
 * that expire after the configured retention.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisUsageStore implements UsageRecorder, UsageLedger {

    static final String LOG_KEY = "ai:usage:log";
    static final String COUNTER_PREFIX = "ai:usage:tokens:";
    static final long MAX_LOG_ENTRIES = 10_000;
    private static final DateTimeFormatter DAY = DateTimeFormatter.BASIC_ISO_DATE.withZone(ZoneOffset.UTC);

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final AiProviderConfig config;
    private final Clock clock;

    @Override
    public void record(UsageRecord record) {
        if (!config.getUsage().isEnabled()) {
            return;
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize usage record: {}", e.getMessage());
            return;
        }

        Instant at = record.getCreatedAt() != null ? record.getCreatedAt() : clock.instant();
        String day = DAY.format(at);
        long tokens = record.getTotalTokens();

        Mono<Void> userCounter = record.getUserId() != null
                ? increment(userKey(day, record.getUserId()), tokens)
                : Mono.empty();

        redisTemplate.opsForList().leftPush(LOG_KEY, json)
                .then(Mono.defer(() -> redisTemplate.opsForList().trim(LOG_KEY, 0, MAX_LOG_ENTRIES - 1)))
                .then(increment(dailyKey(day), tokens))
                .then(userCounter)
                .subscribe(
                        done -> { },
                        e -> log.warn("Failed to record AI usage for {}: {}", record.getFeature(), e.getMessage()),
                        () -> log.debug("Recorded {} tokens of {} for user {}", tokens, record.getFeature(), record.getUserId()));
    }

    @Override
    public Mono<Long> userTokensToday(String userId) {
        return read(userKey(today(), userId));
    }

    @Override
    public Mono<Long> tokensToday() {
        return read(dailyKey(today()));
    }

    private Mono<Void> increment(String key, long tokens) {
        return Mono.defer(() -> redisTemplate.opsForValue().increment(key, tokens))
                .flatMap(total -> redisTemplate.expire(key, config.getUsage().getCounterRetention()))
                .then();
    }

    private Mono<Long> read(String key) {
        return redisTemplate.opsForValue().get(key)
                .map(Long::parseLong)
                .defaultIfEmpty(0L);
    }

    private String today() {
        return DAY.format(clock.instant());
    }

    static String dailyKey(String day) {
        return COUNTER_PREFIX + day;
    }

    static String userKey(String day, String userId) {
        return COUNTER_PREFIX + day + ":user:" + userId;
    }
}
