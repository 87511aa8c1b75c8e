package com.llmgateway.exception;

/**
 * A user or the whole installation used up its daily token allowance, or exceeded a rate limit.
 */
public class UsageLimitExceededException extends GatewayException {

    public UsageLimitExceededException(String code, String message) {
        super(code, message);
    }
}
