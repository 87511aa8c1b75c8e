package com.llmgateway.parse;

import com.llmgateway.model.TokenUsage;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Word-based token approximation for providers that do not report usage.
 *
 * <p>Deterministic for identical input: {@code prompt = round(words * 1.3)},
 * {@code completion = round(prompt * 1.5)}.
 */
@Component
public class TokenEstimator {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final double TOKENS_PER_WORD = 1.3;
    private static final double COMPLETION_RATIO = 1.5;

    public int countWords(String text) {
        if (text == null) {
            return 0;
        }
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return 0;
        }
        return WHITESPACE.split(trimmed).length;
    }

    public int countTokens(String text) {
        return (int) Math.round(countWords(text) * TOKENS_PER_WORD);
    }

    public TokenUsage estimate(String promptText) {
        int promptTokens = countTokens(promptText);
        int completionTokens = (int) Math.round(promptTokens * COMPLETION_RATIO);
        return TokenUsage.of(promptTokens, completionTokens);
    }

    /**
     * Reported usage wins when present; otherwise falls back to {@link #estimate(String)}.
     */
    public TokenUsage resolve(TokenUsage reported, String promptText) {
        if (reported != null) {
            return reported;
        }
        return estimate(promptText);
    }
}
