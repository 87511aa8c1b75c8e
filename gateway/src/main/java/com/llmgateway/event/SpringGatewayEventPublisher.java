package com.llmgateway.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Publishes gateway events through Spring's {@link ApplicationEventPublisher}; listeners receive
 * them synchronously via {@code @EventListener}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpringGatewayEventPublisher implements GatewayEventPublisher {

    private final ApplicationEventPublisher eventPublisher;

    @Override
    public void publish(GatewayEvent event) {
        log.debug("Publishing event: {}", event.type());
        eventPublisher.publishEvent(event);
    }
}
