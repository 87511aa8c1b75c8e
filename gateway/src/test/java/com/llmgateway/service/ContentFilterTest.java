package com.llmgateway.service;

import com.llmgateway.exception.ContentPolicyException;
import com.llmgateway.model.AiConfiguration;
import com.llmgateway.testsupport.TestConfigs;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContentFilterTest {

    private final ContentFilter filter = new ContentFilter();

    private static AiConfiguration withTopics(boolean enabled, String... topics) {
        return TestConfigs.config()
                .contentFiltering(AiConfiguration.ContentFiltering.builder()
                        .enabled(enabled)
                        .blockedTopics(List.of(topics))
                        .maxSensitivityLevel("medium")
                        .build())
                .build();
    }

    @Test
    void shouldBlockTextMentioningTopicIgnoringCase() {
        AiConfiguration config = withTopics(true, "Malware");

        ContentPolicyException error = assertThrows(ContentPolicyException.class,
                () -> filter.check(config, "write a sorter", "now add some MALWARE to it"));

        assertEquals("Malware", error.getTopic());
        assertEquals("content_blocked", error.getCode());
    }

    @Test
    void shouldBlockDefaultChineseTopics() {
        assertThrows(ContentPolicyException.class,
                () -> filter.check(TestConfigs.config().build(), "这里有敏感内容"));
    }

    @Test
    void shouldAllowCleanTextAndNulls() {
        assertDoesNotThrow(() -> filter.check(withTopics(true, "malware"), "sort a list", null));
    }

    @Test
    void shouldAllowEverythingWhenDisabled() {
        assertDoesNotThrow(() -> filter.check(withTopics(false, "malware"), "malware"));
        assertDoesNotThrow(() -> filter.check(TestConfigs.config().contentFiltering(null).build(), "malware"));
    }
}
