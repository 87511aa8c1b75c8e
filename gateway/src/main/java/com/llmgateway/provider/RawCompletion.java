package com.llmgateway.provider;

import com.llmgateway.model.TokenUsage;

/**
 * Text answer of one provider call.
 *
 * @param usage provider-reported usage, {@code null} when the provider did not report any
 */
public record RawCompletion(String id, String content, TokenUsage usage) {
}
