package com.llmgateway.exception;

/**
 * No usable AI configuration, or an update that failed validation.
 */
public class ConfigurationException extends GatewayException {

    public ConfigurationException(String message) {
        super("configuration_error", message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super("configuration_error", message, cause);
    }
}
