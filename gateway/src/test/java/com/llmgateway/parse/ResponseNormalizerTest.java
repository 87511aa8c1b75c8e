package com.llmgateway.parse;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmgateway.exception.ParseException;
import com.llmgateway.model.TaskModels.AnalyzeCodeResult;
import com.llmgateway.model.TaskModels.GenerateCodeResult;
import com.llmgateway.model.TaskModels.OptimizeCodeResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResponseNormalizerTest {

    private final ResponseNormalizer normalizer = new ResponseNormalizer(new ObjectMapper());

    // ===== JSON stage =====

    @Test
    void shouldReadAnalysisFromJsonFence() {
        String text = "```json {\"score\":80,\"issues\":[{\"severity\":\"warning\",\"message\":\"unused var\","
                + "\"fix\":\"remove it\"}],\"strengths\":[\"clear naming\"],\"summary\":\"solid\"} ```";

        AnalyzeCodeResult result = normalizer.normalizeAnalyze(text);

        assertEquals(80, result.score());
        assertEquals(List.of("[warning] unused var - 建议: remove it"), result.issues());
        assertEquals(List.of("clear naming"), result.strengths());
        assertEquals("solid", result.summary());
    }

    @Test
    void shouldRenderIssueWithoutFixAndDefaultSeverity() {
        String text = "```json\n{\"issues\":[{\"message\":\"magic number\"},\"plain issue\"],\"summary\":\"ok\"}\n```";

        AnalyzeCodeResult result = normalizer.normalizeAnalyze(text);

        assertEquals(50, result.score());
        assertEquals(List.of("[info] magic number", "plain issue"), result.issues());
    }

    @Test
    void shouldReadGenerateResultFromBareJsonObject() {
        String text = "{\"generatedCode\":\"print(1)\",\"explanation\":\"prints one\",\"alternatives\":[\"echo 1\"]}";

        GenerateCodeResult result = normalizer.normalizeGenerate(text);

        assertEquals("print(1)", result.generatedCode());
        assertEquals("prints one", result.explanation());
        assertEquals(List.of("echo 1"), result.alternatives());
        assertNull(result.usage());
    }

    @Test
    void shouldFallBackWhenJsonIsInvalid() {
        String text = "```json\n{not json\n```\n总结: 代码整体结构清晰";

        AnalyzeCodeResult result = normalizer.normalizeAnalyze(text);

        assertEquals("代码整体结构清晰", result.summary());
        assertEquals(50, result.score());
    }

    // ===== Marker stage =====

    @Test
    void shouldTakeExplanationFromMarkerWithoutCodeBlock() {
        GenerateCodeResult result = normalizer.normalizeGenerate("说明: 这是一个排序函数");

        assertEquals("这是一个排序函数", result.explanation());
        assertEquals("", result.generatedCode());
    }

    @Test
    void shouldAcceptFullWidthColonMarker() {
        GenerateCodeResult result = normalizer.normalizeGenerate("实现思路：先排序再去重\n```python\nsorted(set(xs))\n```");

        assertEquals("sorted(set(xs))", result.generatedCode());
        assertEquals("先排序再去重", result.explanation());
    }

    @Test
    void shouldTakeFirstBlockAsCodeAndTrailingProseAsExplanation() {
        String text = "Here you go:\n```java\nint a = 1;\n```\nor\n```java\nint b = 2;\n```\nBoth work fine.";

        GenerateCodeResult result = normalizer.normalizeGenerate(text);

        assertEquals("int a = 1;", result.generatedCode());
        assertEquals("Both work fine.", result.explanation());
    }

    @Test
    void shouldExtractAlternatives() {
        String text = "```js\nconst x = 1;\n```\n替代方案:\n- use let\n- use var";

        GenerateCodeResult result = normalizer.normalizeGenerate(text);

        assertEquals(List.of("use let", "use var"), result.alternatives());
    }

    @Test
    void shouldReadSeverityLinesScoreAndStrengths() {
        String text = """
                评分: 72
                - [error] possible null dereference
                - warning: long method
                优点: naming is consistent
                总结: needs some cleanup
                """;

        AnalyzeCodeResult result = normalizer.normalizeAnalyze(text);

        assertEquals(72, result.score());
        assertEquals(List.of("[error] possible null dereference", "[warning] long method"), result.issues());
        assertEquals(List.of("naming is consistent"), result.strengths());
        assertEquals("needs some cleanup", result.summary());
    }

    @Test
    void shouldReadOptimizedCodeAndChanges() {
        String text = "```python\nreturn sum(xs)\n```\n修改: replaced the loop with sum()\n说明: shorter and faster";

        OptimizeCodeResult result = normalizer.normalizeOptimize(text);

        assertEquals("return sum(xs)", result.optimizedCode());
        assertEquals(List.of("replaced the loop with sum()"), result.changes());
        assertEquals("shorter and faster", result.improvementSummary());
    }

    // ===== Whole-text stage =====

    @Test
    void shouldUseWholeTextAsSummaryWhenNothingElseMatches() {
        AnalyzeCodeResult result = normalizer.normalizeAnalyze("The code looks reasonable overall.");

        assertEquals(50, result.score());
        assertTrue(result.issues().isEmpty());
        assertTrue(result.strengths().isEmpty());
        assertEquals("The code looks reasonable overall.", result.summary());
    }

    @Test
    void shouldFailWhenResponseIsBlank() {
        assertThrows(ParseException.class, () -> normalizer.normalizeGenerate("   "));
        assertThrows(ParseException.class, () -> normalizer.normalizeAnalyze(""));
        assertThrows(ParseException.class, () -> normalizer.normalizeOptimize(null));
    }
}
