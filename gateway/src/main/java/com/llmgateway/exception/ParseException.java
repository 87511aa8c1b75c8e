package com.llmgateway.exception;

public class ParseException extends GatewayException {

    public ParseException(String message) {
        super("parse_error", message);
    }
}
