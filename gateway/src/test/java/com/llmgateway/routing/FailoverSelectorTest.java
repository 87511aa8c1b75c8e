package com.llmgateway.routing;

import com.llmgateway.event.GatewayEvent;
import com.llmgateway.event.GatewayEventPublisher;
import com.llmgateway.health.ProviderHealthMonitor;
import com.llmgateway.model.AiConfiguration;
import com.llmgateway.model.HealthRecord;
import com.llmgateway.model.HealthStatus;
import com.llmgateway.provider.LlmProvider;
import com.llmgateway.registry.ProviderRegistry;
import com.llmgateway.testsupport.MutableClock;
import com.llmgateway.testsupport.TestConfigs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class FailoverSelectorTest {

    private static final HealthRecord DOWN = new HealthRecord(HealthStatus.DOWN, Instant.EPOCH, null);
    private static final HealthRecord UP = new HealthRecord(HealthStatus.UP, Instant.EPOCH, 300L);

    private LlmProvider a;
    private LlmProvider b;
    private LlmProvider c;
    private ProviderHealthMonitor healthMonitor;
    private GatewayEventPublisher events;
    private FailoverSelector selector;

    @BeforeEach
    void setUp() {
        a = mock(LlmProvider.class);
        b = mock(LlmProvider.class);
        c = mock(LlmProvider.class);
        ProviderRegistry registry = ProviderRegistry.builder()
                .register(a, "a")
                .register(b, "b")
                .register(c, "c")
                .defaultKey("a")
                .build();
        healthMonitor = mock(ProviderHealthMonitor.class);
        when(healthMonitor.get(any())).thenReturn(HealthRecord.UNKNOWN);
        events = mock(GatewayEventPublisher.class);
        selector = new FailoverSelector(registry, healthMonitor, events, new MutableClock());
    }

    private AiConfiguration config(List<String> fallbacks) {
        return TestConfigs.config().provider("A").fallbackProviders(fallbacks).build();
    }

    @Test
    void shouldKeepPrimaryWhenNotDown() {
        ResolvedProvider resolved = selector.resolveAdapter(config(List.of("B")));

        assertEquals("a", resolved.providerKey());
        assertSame(a, resolved.adapter());
        assertFalse(resolved.fallback());
        verifyNoInteractions(events);
    }

    @Test
    void shouldSkipDownFallbacksAndAnnounceSwitch() {
        when(healthMonitor.get("a")).thenReturn(DOWN);
        when(healthMonitor.get("b")).thenReturn(DOWN);
        when(healthMonitor.get("c")).thenReturn(UP);

        ResolvedProvider resolved = selector.resolveAdapter(config(List.of("B", "C")));

        assertEquals("c", resolved.providerKey());
        assertSame(c, resolved.adapter());
        assertTrue(resolved.fallback());

        ArgumentCaptor<GatewayEvent> captor = ArgumentCaptor.forClass(GatewayEvent.class);
        verify(events).publish(captor.capture());
        GatewayEvent.ProviderFallback event = assertInstanceOf(GatewayEvent.ProviderFallback.class, captor.getValue());
        assertEquals("a", event.primary());
        assertEquals("c", event.fallback());
        assertEquals(GatewayEvent.ProviderFallback.HEALTH_CHECK_FAILED, event.reason());
    }

    @Test
    void shouldTreatUncheckedFallbackAsUsable() {
        when(healthMonitor.get("a")).thenReturn(DOWN);

        assertEquals("b", selector.resolveAdapter(config(List.of("b"))).providerKey());
    }

    @Test
    void shouldUsePrimaryWhenEveryProviderIsDown() {
        when(healthMonitor.get(any())).thenReturn(DOWN);

        ResolvedProvider resolved = selector.resolveAdapter(config(List.of("B", "C")));

        assertEquals("a", resolved.providerKey());
        assertFalse(resolved.fallback());
        verifyNoInteractions(events);
    }

    @Test
    void shouldIgnorePrimaryListedAsFallback() {
        when(healthMonitor.get("a")).thenReturn(DOWN);
        when(healthMonitor.get("c")).thenReturn(DOWN);

        ResolvedProvider resolved = selector.resolveAdapter(config(List.of("A", "C")));

        assertEquals("a", resolved.providerKey());
        assertFalse(resolved.fallback());
    }

    @Test
    void shouldUsePrimaryWithoutFallbacks() {
        when(healthMonitor.get("a")).thenReturn(DOWN);

        assertSame(a, selector.resolveAdapter(config(List.of())).adapter());
        assertSame(a, selector.resolveAdapter(config(null)).adapter());
    }
}
