package com.llmgateway.service;

import com.llmgateway.exception.ContentPolicyException;
import com.llmgateway.model.AiConfiguration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Blocks requests whose text mentions one of the configured topics.
 */
@Slf4j
@Component
public class ContentFilter {

    public void check(AiConfiguration config, String... texts) {
        AiConfiguration.ContentFiltering filtering = config.getContentFiltering();
        if (filtering == null || !filtering.isEnabled() || filtering.getBlockedTopics() == null) {
            return;
        }
        for (String topic : filtering.getBlockedTopics()) {
            if (topic == null || topic.isBlank()) {
                continue;
            }
            String needle = topic.toLowerCase(Locale.ROOT);
            for (String text : texts) {
                if (text != null && text.toLowerCase(Locale.ROOT).contains(needle)) {
                    log.warn("Request blocked by content filter (topic: {})", topic);
                    throw new ContentPolicyException(topic);
                }
            }
        }
    }
}
