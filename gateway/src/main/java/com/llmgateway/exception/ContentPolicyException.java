package com.llmgateway.exception;

public class ContentPolicyException extends GatewayException {

    private final String topic;

    public ContentPolicyException(String topic) {
        super("content_blocked", "Request mentions a blocked topic: " + topic);
        this.topic = topic;
    }

    public String getTopic() {
        return topic;
    }
}
