package com.llmgateway.event;

import com.llmgateway.model.HealthStatus;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class GatewayEventListenerTest {

    private AnnotationConfigApplicationContext context;
    private MeterRegistry meterRegistry;
    private GatewayEventPublisher publisher;

    @BeforeEach
    void setUp() {
        context = new AnnotationConfigApplicationContext();
        context.registerBean(MeterRegistry.class, SimpleMeterRegistry::new);
        context.register(SpringGatewayEventPublisher.class, GatewayEventListener.class);
        context.refresh();
        meterRegistry = context.getBean(MeterRegistry.class);
        publisher = context.getBean(GatewayEventPublisher.class);
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    @Test
    void healthChangesAreCountedPerStatus() {
        publisher.publish(new GatewayEvent.HealthUpdated("openai", HealthStatus.UP, HealthStatus.DOWN, null,
                Instant.EPOCH));

        assertEquals(1.0, meterRegistry.counter("ai.health.status", "provider", "openai", "status", "down").count());
    }

    @Test
    void fallbacksAreCountedPerRoute() {
        publisher.publish(new GatewayEvent.ProviderFallback("openai", "localllm",
                GatewayEvent.ProviderFallback.HEALTH_CHECK_FAILED, Instant.EPOCH));
        publisher.publish(new GatewayEvent.ProviderFallback("openai", "localllm",
                GatewayEvent.ProviderFallback.HEALTH_CHECK_FAILED, Instant.EPOCH));

        assertEquals(2.0, meterRegistry.counter("ai.routing.fallback", "from", "openai", "to", "localllm").count());
    }

    @Test
    void eventsExposeWireTypes() {
        assertEquals("config.updated", new GatewayEvent.ConfigUpdated("OpenAI", "gpt-4", Instant.EPOCH).type());
        assertEquals("health.updated", new GatewayEvent.HealthUpdated("a", HealthStatus.UNKNOWN, HealthStatus.UP,
                10L, Instant.EPOCH).type());
        assertEquals("provider.fallback", new GatewayEvent.ProviderFallback("a", "b", "r", Instant.EPOCH).type());
    }
}
