package com.llmgateway.exception;

/**
 * Base type for every failure the gateway surfaces to its callers.
 */
public abstract class GatewayException extends RuntimeException {

    private final String code;

    protected GatewayException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected GatewayException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
