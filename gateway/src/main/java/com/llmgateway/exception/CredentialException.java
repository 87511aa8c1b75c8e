package com.llmgateway.exception;

/**
 * Provider secret missing or malformed.
 */
public class CredentialException extends GatewayException {

    public CredentialException(String message) {
        super("no_api_key", message);
    }
}
