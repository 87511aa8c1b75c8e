package com.llmgateway.execution;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;

/**
 * Races a unit of work against a deadline. The result says which side won; a losing call is
 * dropped and may still run to completion upstream.
 */
public final class DeadlineRace {

    private DeadlineRace() {
    }

    public sealed interface Outcome<T> permits Completed, TimedOut {
    }

    public record Completed<T>(T value) implements Outcome<T> {
    }

    public record TimedOut<T>(Duration deadline) implements Outcome<T> {
    }

    public static <T> Mono<Outcome<T>> race(Mono<T> work, Duration deadline, Scheduler scheduler) {
        return work
                .<Outcome<T>>map(Completed::new)
                .timeout(deadline, Mono.fromSupplier(() -> new TimedOut<>(deadline)), scheduler);
    }
}
