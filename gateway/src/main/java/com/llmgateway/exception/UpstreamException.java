package com.llmgateway.exception;

/**
 * Failure reported by (or while talking to) an upstream LLM provider.
 *
 * <p>{@code status} is the HTTP status when one was received, otherwise {@code 0}.
 */
public class UpstreamException extends GatewayException {

    private final String provider;
    private final int status;
    private final boolean retryable;

    public UpstreamException(String provider, int status, String code, String message, boolean retryable) {
        super(code, message);
        this.provider = provider;
        this.status = status;
        this.retryable = retryable;
    }

    public UpstreamException(String provider, int status, String code, String message, boolean retryable,
                             Throwable cause) {
        super(code, message, cause);
        this.provider = provider;
        this.status = status;
        this.retryable = retryable;
    }

    /**
     * Builds an exception whose retryable flag follows the HTTP status: 429 and 5xx retry.
     */
    public static UpstreamException fromStatus(String provider, int status, String code, String message) {
        return new UpstreamException(provider, status, code, message, isRetryableStatus(status));
    }

    public static boolean isRetryableStatus(int status) {
        return status == 429 || (status >= 500 && status < 600);
    }

    public String getProvider() {
        return provider;
    }

    public int getStatus() {
        return status;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
