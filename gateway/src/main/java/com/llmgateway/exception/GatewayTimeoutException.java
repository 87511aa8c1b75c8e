package com.llmgateway.exception;

import java.time.Duration;

/**
 * A unit of work lost its race against a deadline.
 */
public class GatewayTimeoutException extends GatewayException {

    private final Duration deadline;

    public GatewayTimeoutException(String message, Duration deadline) {
        super("timeout", message);
        this.deadline = deadline;
    }

    public Duration getDeadline() {
        return deadline;
    }
}
