package com.llmgateway.prompt;

import com.llmgateway.model.ChatModels.Message;
import com.llmgateway.model.TaskModels.AnalyzeCodeOptions;
import com.llmgateway.model.TaskModels.ChatOptions;
import com.llmgateway.model.TaskModels.ExplainCodeOptions;
import com.llmgateway.model.TaskModels.GenerateCodeOptions;
import com.llmgateway.model.TaskModels.OptimizeCodeOptions;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Builds the message list sent to a provider for each task. A caller-supplied custom prompt
 * replaces the built-in system prompt of the task.
 */
@Component
public class PromptBuilder {

    static final String GENERATE_SYSTEM = "你是一位专业的代码生成助手，擅长根据需求描述生成高质量、符合最佳实践的代码。"
            + "请根据提供的需求和上下文，生成清晰、简洁、易于维护的代码。";
    static final String ANALYZE_SYSTEM = "你是一位代码质量分析专家，擅长发现代码中的问题、优化机会和安全隐患。"
            + "请对提供的代码进行全面分析，并给出具体的改进建议。";
    static final String OPTIMIZE_SYSTEM = "你是一位代码优化专家，擅长重构和改进现有代码。"
            + "请根据优化目标对提供的代码进行改进，同时保持代码功能不变，并详细说明所做的更改。";
    static final String CHAT_SYSTEM = "你是一位编程助手，可以回答与编程、开发相关的问题。"
            + "请尽可能提供准确、有帮助的回答，并在适当时提供代码示例。";
    static final String EXPLAIN_SYSTEM = "你是一位代码解释专家，擅长分析代码并以清晰易懂的方式解释其功能和实现逻辑。"
            + "请对提供的代码进行解释，分析其设计思路和实现细节。";

    public List<Message> generate(String prompt, String language, GenerateCodeOptions options) {
        options = options != null ? options : new GenerateCodeOptions();
        StringBuilder user = new StringBuilder()
                .append("需求描述: ").append(prompt).append("\n\n")
                .append("目标语言: ").append(language).append('\n');
        if (hasText(options.getFramework())) {
            user.append("目标框架/库: ").append(options.getFramework()).append('\n');
        }
        if (hasText(options.getContext())) {
            user.append("\n当前文件内容:\n").append(fenced(options.getContext())).append('\n');
        }
        user.append("\n请生成满足上述需求的代码，并简要解释实现思路。");
        return List.of(Message.system(systemPrompt(GENERATE_SYSTEM, options.getCustomPrompt())),
                Message.user(user.toString()));
    }

    public List<Message> analyze(String code, String language, AnalyzeCodeOptions options) {
        options = options != null ? options : new AnalyzeCodeOptions();
        String level = options.getAnalysisLevel() != null
                ? options.getAnalysisLevel().name().toLowerCase(Locale.ROOT)
                : "detailed";
        StringBuilder user = new StringBuilder()
                .append("分析深度: ").append(level).append("\n\n")
                .append("编程语言: ").append(language).append("\n\n");
        if (hasText(options.getContext())) {
            user.append("上下文代码:\n").append(fenced(options.getContext())).append("\n\n");
        }
        user.append("需要分析的代码:\n").append(fenced(code)).append("\n\n")
                .append("请对上述代码进行").append(level).append("级别的分析，并以 ```json 代码块返回如下结构：\n")
                .append("{\"score\": 0-100, \"issues\": [{\"severity\": \"error|warning|info\", \"message\": \"\", \"fix\": \"\"}], ")
                .append("\"strengths\": [], \"summary\": \"\"}");
        return List.of(Message.system(systemPrompt(ANALYZE_SYSTEM, options.getCustomPrompt())),
                Message.user(user.toString()));
    }

    public List<Message> optimize(String code, String language, OptimizeCodeOptions options) {
        options = options != null ? options : new OptimizeCodeOptions();
        List<String> goals = options.getOptimizationGoals() != null ? options.getOptimizationGoals() : List.of();
        StringBuilder user = new StringBuilder()
                .append("编程语言: ").append(language).append("\n\n");
        if (!goals.isEmpty()) {
            user.append("优化目标: ").append(String.join(", ", goals)).append("\n\n");
        }
        if (hasText(options.getContext())) {
            user.append("上下文代码:\n").append(fenced(options.getContext())).append("\n\n");
        }
        user.append("需要优化的代码:\n").append(fenced(code)).append("\n\n")
                .append("请对上述代码进行优化，");
        if (!goals.isEmpty()) {
            user.append("重点关注").append(String.join(", ", goals)).append("方面，");
        }
        user.append("保持功能不变的前提下提高代码质量。");
        if (options.isExplanation()) {
            user.append("\n\n请详细说明优化过程中所做的更改及其原因。");
        }
        return List.of(Message.system(systemPrompt(OPTIMIZE_SYSTEM, options.getCustomPrompt())),
                Message.user(user.toString()));
    }

    /**
     * System prompt, then the prior conversation, then the new user message.
     */
    public List<Message> chat(List<Message> messages, ChatOptions options) {
        options = options != null ? options : new ChatOptions();
        String system = systemPrompt(CHAT_SYSTEM, options.getCustomPrompt());
        if (hasText(options.getCodeContext())) {
            system += "\n\n当前代码上下文:\n" + fenced(options.getCodeContext());
        }
        List<Message> conversation = new ArrayList<>();
        conversation.add(Message.system(system));
        if (options.getHistory() != null) {
            conversation.addAll(options.getHistory());
        }
        conversation.addAll(messages);
        return conversation;
    }

    public List<Message> explain(String code, String language, ExplainCodeOptions options) {
        options = options != null ? options : new ExplainCodeOptions();
        String detail = hasText(options.getDetailLevel()) ? options.getDetailLevel() : "detailed";
        String audience = hasText(options.getAudience()) ? options.getAudience() : "intermediate";
        String user = "编程语言: " + language + "\n"
                + "解释详细程度: " + detail + "\n"
                + "目标读者: " + audience + "\n\n"
                + "需要解释的代码:\n" + fenced(code) + "\n\n"
                + "请对上述代码进行" + detail + "级别的解释，使" + audience + "级别的开发者能够理解，包括：\n"
                + "1. 代码的整体功能和用途\n"
                + "2. 关键算法或设计模式的解释\n"
                + "3. 各函数/方法的作用和实现\n"
                + "4. 可能的边界情况或限制\n"
                + "5. 代码中的特殊技巧或不常见语法";
        return List.of(Message.system(EXPLAIN_SYSTEM), Message.user(user));
    }

    /**
     * Flattens a message list into the text the token estimator counts.
     */
    public static String serialize(List<Message> messages) {
        return messages.stream()
                .map(Message::getContent)
                .filter(c -> c != null && !c.isEmpty())
                .collect(Collectors.joining("\n"));
    }

    private static String systemPrompt(String builtIn, String customPrompt) {
        return hasText(customPrompt) ? customPrompt : builtIn;
    }

    private static String fenced(String code) {
        return "```\n" + code + "\n```";
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
