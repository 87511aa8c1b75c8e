package com.llmgateway.event;

/**
 * Outbound port for gateway notifications. Delivery transport is up to the implementation.
 */
public interface GatewayEventPublisher {

    void publish(GatewayEvent event);
}
