package com.llmgateway.prompt;

import com.llmgateway.model.ChatModels.Message;
import com.llmgateway.model.TaskModels.AnalysisLevel;
import com.llmgateway.model.TaskModels.AnalyzeCodeOptions;
import com.llmgateway.model.TaskModels.ChatOptions;
import com.llmgateway.model.TaskModels.GenerateCodeOptions;
import com.llmgateway.model.TaskModels.OptimizeCodeOptions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PromptBuilderTest {

    private final PromptBuilder promptBuilder = new PromptBuilder();

    @Test
    void generateIncludesFrameworkAndContext() {
        List<Message> messages = promptBuilder.generate("todo list", "typescript", GenerateCodeOptions.builder()
                .framework("react")
                .context("export {}")
                .build());

        assertEquals(2, messages.size());
        assertEquals("system", messages.get(0).getRole());
        assertEquals(PromptBuilder.GENERATE_SYSTEM, messages.get(0).getContent());
        String user = messages.get(1).getContent();
        assertTrue(user.contains("需求描述: todo list"));
        assertTrue(user.contains("目标框架/库: react"));
        assertTrue(user.contains("```\nexport {}\n```"));
    }

    @Test
    void customPromptReplacesBuiltInSystemPrompt() {
        List<Message> messages = promptBuilder.analyze("x = 1", "python", AnalyzeCodeOptions.builder()
                .analysisLevel(AnalysisLevel.BASIC)
                .customPrompt("You are terse.")
                .build());

        assertEquals("You are terse.", messages.get(0).getContent());
        assertTrue(messages.get(1).getContent().contains("分析深度: basic"));
        assertTrue(messages.get(1).getContent().contains("```json"));
    }

    @Test
    void optimizeListsGoalsAndAsksForExplanationByDefault() {
        String user = promptBuilder.optimize("for i in range(10): pass", "python", OptimizeCodeOptions.builder()
                .optimizationGoals(List.of("performance", "readability"))
                .build()).get(1).getContent();

        assertTrue(user.contains("优化目标: performance, readability"));
        assertTrue(user.contains("请详细说明优化过程中所做的更改及其原因"));
    }

    @Test
    void chatPutsHistoryBetweenSystemPromptAndNewMessage() {
        List<Message> conversation = promptBuilder.chat(List.of(Message.user("and now?")), ChatOptions.builder()
                .history(List.of(Message.user("hello"), Message.assistant("hi")))
                .codeContext("int x;")
                .build());

        assertEquals(4, conversation.size());
        assertTrue(conversation.get(0).getContent().startsWith(PromptBuilder.CHAT_SYSTEM));
        assertTrue(conversation.get(0).getContent().contains("int x;"));
        assertEquals("hi", conversation.get(2).getContent());
        assertEquals("and now?", conversation.get(3).getContent());
    }

    @Test
    void missingOptionsUseDefaults() {
        assertEquals(PromptBuilder.EXPLAIN_SYSTEM, promptBuilder.explain("x", "c", null).get(0).getContent());
        assertTrue(promptBuilder.explain("x", "c", null).get(1).getContent().contains("目标读者: intermediate"));
        assertEquals(2, promptBuilder.chat(List.of(Message.user("q")), null).size());
    }

    @Test
    void serializeJoinsNonEmptyContents() {
        assertEquals("a\nb", PromptBuilder.serialize(List.of(Message.system("a"), Message.user(""), Message.user("b"))));
    }
}
