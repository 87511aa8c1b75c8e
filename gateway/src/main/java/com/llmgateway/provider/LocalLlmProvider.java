package com.llmgateway.provider;

import com.llmgateway.model.ChatModels.Message;
import com.llmgateway.model.TaskModels.ConnectionTestResult;
import com.llmgateway.model.TaskModels.Quota;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Self-hosted OpenAI-compatible server (llama.cpp, vLLM, Ollama's /v1 endpoint).
 * Runs without a credential; a key is forwarded only when one is configured.
 */
@Slf4j
public class LocalLlmProvider extends OpenAiCompatibleProvider {

    public static final String PROVIDER_NAME = "localllm";

    public LocalLlmProvider(ProviderSupport support) {
        super(support, PROVIDER_NAME);
    }

    @Override
    public boolean isLocal() {
        return true;
    }

    @Override
    protected String builtInDefaultModel() {
        return "codellama";
    }

    @Override
    protected String defaultBaseUrl() {
        return "http://localhost:8080/v1";
    }

    /**
     * Many local servers do not implement {@code /models}; a one-word chat proves the endpoint instead.
     */
    @Override
    public Mono<ConnectionTestResult> testConnection(CallSettings call) {
        return guarded("test", listModels(call)
                .onErrorResume(e -> {
                    log.debug("Local model listing failed ({}), probing with a minimal chat", e.getMessage());
                    return complete(List.of(Message.user("Hello")), call.withMaxTokens(10))
                            .map(reply -> new ConnectionTestResult(List.of(model(call)), 0, Quota.NOMINAL));
                }));
    }
}
