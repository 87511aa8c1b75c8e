package com.llmgateway.execution;

import com.llmgateway.exception.GatewayTimeoutException;
import com.llmgateway.exception.UpstreamException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs one adapter call under a {@link RetryPolicy}: every attempt races its own deadline,
 * retryable failures back off and try again, everything else propagates untouched.
 */
@Slf4j
@Component
public class ResilientExecutor {

    private final MeterRegistry meterRegistry;
    private final Scheduler scheduler;

    @Autowired
    public ResilientExecutor(MeterRegistry meterRegistry) {
        this(meterRegistry, Schedulers.parallel());
    }

    public ResilientExecutor(MeterRegistry meterRegistry, Scheduler scheduler) {
        this.meterRegistry = meterRegistry;
        this.scheduler = scheduler;
    }

    public <T> Mono<T> execute(String provider, RetryPolicy policy, Supplier<Mono<T>> call) {
        AtomicInteger attempts = new AtomicInteger();

        Mono<T> attempt = Mono.defer(() -> {
            int number = attempts.incrementAndGet();
            log.debug("Calling provider {} (attempt {}/{})", provider, number, policy.maxRetries() + 1);
            return DeadlineRace.race(Mono.defer(call), policy.timeout(), scheduler)
                    .<T>flatMap(outcome -> {
                        if (outcome instanceof DeadlineRace.Completed<T> completed) {
                            return Mono.justOrEmpty(completed.value());
                        }
                        meterRegistry.counter("ai.routing.timeout", "provider", provider).increment();
                        return Mono.error(new GatewayTimeoutException(
                                provider + " did not answer within " + policy.timeout(), policy.timeout()));
                    });
        });

        return attempt.retryWhen(Retry.from(signals -> signals.<Long>concatMap(signal -> {
            Throwable failure = signal.failure();
            long retry = signal.totalRetries() + 1;
            if (!policy.isRetryable(failure)) {
                return Mono.error(failure);
            }
            if (retry > policy.maxRetries()) {
                log.warn("Provider {} failed after {} attempts: {}", provider, attempts.get(), failure.getMessage());
                return Mono.error(exhausted(provider, failure));
            }
            meterRegistry.counter("ai.routing.retry", "provider", provider).increment();
            log.warn("Provider {} attempt {} failed ({}), retrying in {}",
                    provider, retry, failure.getMessage(), policy.backoff((int) retry));
            return Mono.delay(policy.backoff((int) retry), scheduler);
        })));
    }

    private static UpstreamException exhausted(String provider, Throwable last) {
        if (last instanceof UpstreamException upstream) {
            return new UpstreamException(provider, upstream.getStatus(), upstream.getCode(),
                    upstream.getMessage(), true, upstream);
        }
        return new UpstreamException(provider, 0, "timeout", last.getMessage(), true, last);
    }
}
