package com.llmgateway.provider;

import com.llmgateway.model.TokenUsage;

public record ChatReply(String content, TokenUsage usage) {
}
