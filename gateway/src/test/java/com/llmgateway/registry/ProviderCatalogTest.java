package com.llmgateway.registry;

import com.llmgateway.registry.ProviderCatalog.Task;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ProviderCatalogTest {

    private final ProviderCatalog catalog = new ProviderCatalog();

    @Test
    void shouldListAllKnownProviders() {
        assertEquals(7, catalog.providers().size());
        assertTrue(catalog.find("deepseek").isPresent());
        assertFalse(catalog.find("LocalLLM").get().requiresApiKey());
    }

    @Test
    void shouldPreferFastestModelWhenSpeedMatters() {
        assertEquals(Optional.of("claude-3-haiku-20240307"), catalog.recommend("Claude", Task.CODE_GENERATION, true, false));
    }

    @Test
    void shouldPreferCheapestModelWhenCostMatters() {
        assertEquals(Optional.of("claude-3-haiku-20240307"), catalog.recommend("claude", Task.CHAT, false, true));
        assertEquals(Optional.of("gpt-3.5-turbo"), catalog.recommend("OpenAI", Task.CODE_ANALYSIS, false, true));
    }

    @Test
    void shouldBalanceLatencyAndCostByDefault() {
        assertEquals(Optional.of("gpt-3.5-turbo"), catalog.recommend("OpenAI", Task.CODE_GENERATION, false, false));
    }

    @Test
    void shouldOnlyRecommendModelsSupportingTheTask() {
        assertEquals(Optional.of("mistral"), catalog.recommend("LocalLLM", Task.CHAT, false, false));
        assertEquals(Optional.of("codellama"), catalog.recommend("LocalLLM", Task.OPTIMIZATION, false, false));
    }

    @Test
    void shouldReturnEmptyForUnknownProvider() {
        assertTrue(catalog.recommend("Gemini", Task.CHAT, false, false).isEmpty());
    }
}
