package com.llmgateway.provider;

import java.util.Map;

/**
 * DeepSeek speaks the OpenAI protocol; older model names are folded onto the current ones.
 */
public class DeepSeekProvider extends OpenAiCompatibleProvider {

    public static final String PROVIDER_NAME = "deepseek";

    private static final String CHAT_MODEL = "deepseek-chat";
    private static final Map<String, String> MODEL_ALIASES = Map.of(
            "deepseek-chat", CHAT_MODEL,
            "deepseek-coder", CHAT_MODEL,
            "deepseek-llm-7b-chat", CHAT_MODEL,
            "deepseek-coder-6.7b-instruct", CHAT_MODEL,
            "deepseek-reasoner", "deepseek-reasoner");

    public DeepSeekProvider(ProviderSupport support) {
        super(support, PROVIDER_NAME);
    }

    @Override
    protected String builtInDefaultModel() {
        return CHAT_MODEL;
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://api.deepseek.com";
    }

    /**
     * Unknown names, including the bare provider name, map to {@code deepseek-chat}.
     */
    @Override
    protected String resolveModel(String model) {
        return MODEL_ALIASES.getOrDefault(model, CHAT_MODEL);
    }
}
