package com.llmgateway.execution;

import com.llmgateway.config.AiProviderConfig;
import com.llmgateway.exception.GatewayTimeoutException;
import com.llmgateway.exception.UpstreamException;

import java.time.Duration;

/**
 * How often and how patiently one adapter call is retried.
 *
 * @param maxRetries   retries after the first attempt
 * @param initialDelay delay before the first retry
 * @param backoff      growth of the delay between retries
 * @param timeout      deadline of each individual attempt
 */
public record RetryPolicy(int maxRetries, Duration initialDelay, Backoff backoff, Duration timeout) {

    public enum Backoff {
        /** {@code initialDelay * 2^(attempt-1)} */
        EXPONENTIAL,
        /** {@code initialDelay * attempt} */
        LINEAR
    }

    public static RetryPolicy hosted(AiProviderConfig.PolicySettings settings) {
        return new RetryPolicy(settings.getMaxRetries(), settings.getInitialDelay(), Backoff.EXPONENTIAL,
                settings.getTimeout());
    }

    public static RetryPolicy local(AiProviderConfig.PolicySettings settings) {
        return new RetryPolicy(settings.getMaxRetries(), settings.getInitialDelay(), Backoff.LINEAR,
                settings.getTimeout());
    }

    /**
     * Same deadline, single attempt.
     */
    public RetryPolicy withoutRetries() {
        return new RetryPolicy(0, initialDelay, backoff, timeout);
    }

    /**
     * Delay before retry number {@code attempt} (1-based).
     */
    public Duration backoff(int attempt) {
        if (attempt < 1) {
            return Duration.ZERO;
        }
        return switch (backoff) {
            case EXPONENTIAL -> initialDelay.multipliedBy(1L << Math.min(attempt - 1, 30));
            case LINEAR -> initialDelay.multipliedBy(attempt);
        };
    }

    /**
     * Deadline losses and upstream 429/5xx are worth another attempt; anything else is final.
     */
    public boolean isRetryable(Throwable error) {
        if (error instanceof GatewayTimeoutException) {
            return true;
        }
        return error instanceof UpstreamException upstream && upstream.isRetryable();
    }
}
