package com.llmgateway.provider;

import com.llmgateway.model.ChatModels;
import com.llmgateway.model.ChatModels.Message;
import com.llmgateway.model.TaskModels.ConnectionTestResult;
import com.llmgateway.model.TaskModels.Quota;
import com.llmgateway.model.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Adapter for the OpenAI chat-completions protocol. Also serves Zhipu, Baidu and MiniMax,
 * which are reached through OpenAI-compatible endpoints.
 */
@Slf4j
public class OpenAiCompatibleProvider extends AbstractLlmProvider {

    public static final String PROVIDER_NAME = "openai";

    public OpenAiCompatibleProvider(ProviderSupport support) {
        super(support, PROVIDER_NAME);
    }

    protected OpenAiCompatibleProvider(ProviderSupport support, String name) {
        super(support, name);
    }

    @Override
    protected String builtInDefaultModel() {
        return "gpt-3.5-turbo";
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://api.openai.com/v1";
    }

    @Override
    protected Mono<RawCompletion> complete(List<Message> messages, CallSettings call) {
        String model = model(call);
        ChatModels.ChatRequest request = ChatModels.ChatRequest.builder()
                .model(model)
                .messages(messages)
                .temperature(call.temperature())
                .maxTokens(call.maxTokens())
                .build();

        log.debug("{} chat request: model={}", getName(), model);

        return checkCredentials(call).then(mapErrors(support.webClient().post()
                .uri(baseUrl(call) + "/chat/completions")
                .headers(headers -> authorize(headers, call))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(ChatModels.ChatResponse.class)
                .map(this::toCompletion)));
    }

    @Override
    public Mono<ConnectionTestResult> testConnection(CallSettings call) {
        return guarded("test", checkCredentials(call).then(listModels(call)));
    }

    protected Mono<ConnectionTestResult> listModels(CallSettings call) {
        return mapErrors(support.webClient().get()
                .uri(baseUrl(call) + "/models")
                .headers(headers -> authorize(headers, call))
                .retrieve()
                .bodyToMono(ChatModels.ModelList.class)
                .map(list -> new ConnectionTestResult(
                        list.getData() == null ? List.of() : list.getData().stream()
                                .map(ChatModels.ModelInfo::getId)
                                .filter(Objects::nonNull)
                                .toList(),
                        0,
                        Quota.NOMINAL)));
    }

    protected void authorize(HttpHeaders headers, CallSettings call) {
        if (hasText(call.apiKey())) {
            headers.setBearerAuth(call.apiKey());
        }
    }

    private RawCompletion toCompletion(ChatModels.ChatResponse response) {
        String content = "";
        if (response.getChoices() != null && !response.getChoices().isEmpty()) {
            ChatModels.Choice choice = response.getChoices().get(0);
            if (choice.getMessage() != null && choice.getMessage().getContent() != null) {
                content = choice.getMessage().getContent();
            } else if (choice.getText() != null) {
                content = choice.getText();
            }
        }

        TokenUsage usage = null;
        ChatModels.Usage reported = response.getUsage();
        if (reported != null && reported.getPromptTokens() != null) {
            int prompt = reported.getPromptTokens();
            int completion = reported.getCompletionTokens() != null ? reported.getCompletionTokens() : 0;
            int total = reported.getTotalTokens() != null ? reported.getTotalTokens() : prompt + completion;
            usage = new TokenUsage(prompt, completion, total);
        }

        String id = response.getId() != null ? response.getId() : getName() + "-" + UUID.randomUUID().toString().substring(0, 8);
        return new RawCompletion(id, content, usage);
    }
}
