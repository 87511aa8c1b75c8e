package com.llmgateway.usage;

import com.llmgateway.exception.UsageLimitExceededException;
import com.llmgateway.model.AiConfiguration;
import com.llmgateway.testsupport.TestConfigs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.mockito.Mockito.*;

class UsageLimitGuardTest {

    private UsageLedger ledger;
    private UsageLimitGuard guard;
    private final AiConfiguration config = TestConfigs.config().build();

    @BeforeEach
    void setUp() {
        ledger = mock(UsageLedger.class);
        when(ledger.tokensToday()).thenReturn(Mono.just(0L));
        when(ledger.userTokensToday(anyString())).thenReturn(Mono.just(0L));
        guard = new UsageLimitGuard(ledger);
    }

    @Test
    void shouldAllowCallsUnderLimits() {
        when(ledger.tokensToday()).thenReturn(Mono.just(99_999L));
        when(ledger.userTokensToday("u1")).thenReturn(Mono.just(9_999L));

        StepVerifier.create(guard.check("u1", config)).verifyComplete();
    }

    @Test
    void shouldRejectWhenDailyLimitReached() {
        when(ledger.tokensToday()).thenReturn(Mono.just(100_000L));

        StepVerifier.create(guard.check("u1", config))
                .expectErrorMatches(e -> e instanceof UsageLimitExceededException
                        && "daily_limit_exceeded".equals(((UsageLimitExceededException) e).getCode()))
                .verify();
    }

    @Test
    void shouldRejectWhenUserLimitReached() {
        when(ledger.userTokensToday("u1")).thenReturn(Mono.just(10_000L));

        StepVerifier.create(guard.check("u1", config))
                .expectErrorMatches(e -> e instanceof UsageLimitExceededException
                        && "user_limit_exceeded".equals(((UsageLimitExceededException) e).getCode()))
                .verify();
    }

    @Test
    void shouldSkipUserCheckForAnonymousCalls() {
        StepVerifier.create(guard.check(null, config)).verifyComplete();

        verify(ledger, never()).userTokensToday(anyString());
    }

    @Test
    void shouldTreatNonPositiveLimitsAsUnlimited() {
        AiConfiguration unlimited = TestConfigs.config()
                .usageLimit(AiConfiguration.UsageLimit.builder().dailyTokenLimit(0).userTokenLimit(-1).build())
                .build();
        when(ledger.tokensToday()).thenReturn(Mono.just(Long.MAX_VALUE));

        StepVerifier.create(guard.check("u1", unlimited)).verifyComplete();
        verifyNoInteractions(ledger);
    }

    @Test
    void shouldLetCallsThroughWhenLedgerIsUnavailable() {
        when(ledger.tokensToday()).thenReturn(Mono.error(new IllegalStateException("redis down")));

        StepVerifier.create(guard.check("u1", config)).verifyComplete();
    }
}
