package com.llmgateway.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.llmgateway.model.ChatModels.Message;
import com.llmgateway.model.TaskModels.ConnectionTestResult;
import com.llmgateway.model.TaskModels.Quota;
import com.llmgateway.model.TokenUsage;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
public class ClaudeProvider extends AbstractLlmProvider {

    public static final String PROVIDER_NAME = "claude";
    static final String ANTHROPIC_VERSION = "2023-06-01";
    private static final int DEFAULT_MAX_TOKENS = 4096;

    // Anthropic has no model listing endpoint
    static final List<String> AVAILABLE_MODELS = List.of(
            "claude-3-opus-20240229",
            "claude-3-sonnet-20240229",
            "claude-3-haiku-20240307",
            "claude-2.1",
            "claude-2.0",
            "claude-instant-1.2");

    public ClaudeProvider(ProviderSupport support) {
        super(support, PROVIDER_NAME);
    }

    @Override
    protected String builtInDefaultModel() {
        return "claude-3-haiku-20240307";
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://api.anthropic.com/v1";
    }

    @Override
    protected Mono<RawCompletion> complete(List<Message> messages, CallSettings call) {
        String model = model(call);
        ClaudeRequest request = convertToClaudeRequest(messages, model, call);

        log.debug("Claude messages request: model={}", model);

        return checkCredentials(call).then(mapErrors(support.webClient().post()
                .uri(baseUrl(call) + "/messages")
                .header("x-api-key", call.apiKey())
                .header("anthropic-version", ANTHROPIC_VERSION)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(ClaudeResponse.class)
                .map(this::toCompletion)));
    }

    @Override
    public Mono<ConnectionTestResult> testConnection(CallSettings call) {
        return guarded("test", complete(List.of(Message.user("Hello")), call.withMaxTokens(10))
                .map(reply -> new ConnectionTestResult(AVAILABLE_MODELS, 0, Quota.NOMINAL)));
    }

    private ClaudeRequest convertToClaudeRequest(List<Message> messages, String model, CallSettings call) {
        ClaudeRequest request = new ClaudeRequest();
        request.setModel(model);
        request.setMaxTokens(call.maxTokens() != null ? call.maxTokens() : DEFAULT_MAX_TOKENS);
        request.setTemperature(call.temperature());

        // Claude takes the system prompt as a top-level field
        String system = messages.stream()
                .filter(m -> "system".equals(m.getRole()))
                .map(Message::getContent)
                .collect(Collectors.joining("\n\n"));
        request.setSystem(system.isEmpty() ? null : system);

        request.setMessages(messages.stream()
                .filter(m -> !"system".equals(m.getRole()))
                .map(m -> new ClaudeRequest.Message(m.getRole(), m.getContent()))
                .collect(Collectors.toList()));
        return request;
    }

    private RawCompletion toCompletion(ClaudeResponse response) {
        String content = "";
        if (response.getContent() != null) {
            content = response.getContent().stream()
                    .filter(c -> "text".equals(c.getType()))
                    .map(ClaudeResponse.ContentBlock::getText)
                    .collect(Collectors.joining());
        }

        TokenUsage usage = null;
        if (response.getUsage() != null && response.getUsage().getInputTokens() != null) {
            int output = response.getUsage().getOutputTokens() != null ? response.getUsage().getOutputTokens() : 0;
            usage = TokenUsage.of(response.getUsage().getInputTokens(), output);
        }

        String id = response.getId() != null ? response.getId() : "claude-" + UUID.randomUUID().toString().substring(0, 8);
        return new RawCompletion(id, content, usage);
    }

    // Claude API DTOs
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ClaudeRequest {
        private String model;

        @JsonProperty("max_tokens")
        private Integer maxTokens;

        private String system;
        private List<Message> messages;
        private Double temperature;

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        public static class Message {
            private String role;
            private String content;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ClaudeResponse {
        private String id;
        private String type;
        private List<ContentBlock> content;
        private String model;

        @JsonProperty("stop_reason")
        private String stopReason;

        private Usage usage;

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        @JsonIgnoreProperties(ignoreUnknown = true)
        public static class ContentBlock {
            private String type;
            private String text;
        }

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        @JsonIgnoreProperties(ignoreUnknown = true)
        public static class Usage {
            @JsonProperty("input_tokens")
            private Integer inputTokens;

            @JsonProperty("output_tokens")
            private Integer outputTokens;
        }
    }
}
