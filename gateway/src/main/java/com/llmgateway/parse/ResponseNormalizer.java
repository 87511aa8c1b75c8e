package com.llmgateway.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmgateway.exception.ParseException;
import com.llmgateway.model.TaskModels.AnalyzeCodeResult;
import com.llmgateway.model.TaskModels.GenerateCodeResult;
import com.llmgateway.model.TaskModels.OptimizeCodeResult;
import com.llmgateway.parse.CodeBlockExtractor.CodeBlock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns free-form provider text into task results.
 *
 * <p>Each task runs the same three stages, always in this order:
 * <ol>
 *   <li>a {@code json} (or unlabeled) fenced block parsed against the task schema,</li>
 *   <li>marker heuristics: explanation markers, first fenced block as code, severity-labelled lines,</li>
 *   <li>the whole response minus fenced blocks as the summary/explanation.</li>
 * </ol>
 * Only when all three come up empty is a {@link ParseException} raised. Returned results carry no usage;
 * the caller attaches it.
 */
@Slf4j
@Component
public class ResponseNormalizer {

    static final int DEFAULT_SCORE = 50;
    static final String FIX_PREFIX = " - 建议: ";

    private static final List<String> EXPLANATION_MARKERS = List.of(
            "解释", "说明", "实现思路", "代码解释", "实现说明", "实现解释", "思路说明");
    private static final String[] COLONS = {":", "："};

    private static final String SEVERITY_WORDS = "error|warning|info|critical|错误|严重|警告|提示";
    private static final Pattern SEVERITY_LINE = Pattern.compile(
            "^\\s*(?:[-*•]|\\d+[.)])?\\s*(?:\\[(" + SEVERITY_WORDS + ")\\]\\s*[:：-]?|(" + SEVERITY_WORDS + ")\\s*[:：])\\s*(.+)$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern PROBLEM_LINE = Pattern.compile("(?:问题|缺陷)[^\\n]*?[：:]\\s*([^\\n]+)");
    private static final Pattern SCORE = Pattern.compile("(?:评分|得分|分数|score)[^\\d\\n]*?(\\d{1,3})",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern STRENGTH = Pattern.compile("(?:优点|优势|亮点|strengths?)[^\\n]*?[：:]\\s*([^\\n]+)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern SUMMARY = Pattern.compile("(?:总体评价|总结|总体建议|summary)[^\\n]*?[：:]\\s*([^\\n]+)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern CHANGE = Pattern.compile("(?:变更|修改|优化)[^\\n]*?[：:]\\s*([^\\n]+)");
    private static final Pattern ALTERNATIVES = Pattern.compile("(?:替代方案|其他实现|可选方案)[:：](.*?)(?=\\n\\n|$)",
            Pattern.DOTALL);
    private static final Pattern LIST_SPLIT = Pattern.compile("\\n[*\\-\\d.]+\\s+");
    private static final Pattern LEADING_BULLET = Pattern.compile("^[*\\-\\d.]+\\s+");

    private final ObjectMapper objectMapper;

    public ResponseNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // ---- generate ----

    public GenerateCodeResult normalizeGenerate(String text) {
        Optional<JsonNode> json = parseFencedJson(text, "generatedCode", "explanation");
        if (json.isPresent()) {
            JsonNode node = json.get();
            return new GenerateCodeResult(
                    textField(node, "generatedCode"),
                    textField(node, "explanation"),
                    stringList(node.get("alternatives")),
                    null);
        }

        String code = CodeBlockExtractor.firstContent(text);
        Optional<String> explanation = extractExplanation(text);
        if (!code.isEmpty() || explanation.isPresent()) {
            return new GenerateCodeResult(code, explanation.orElseGet(() -> withoutBlocks(text)),
                    extractAlternatives(text), null);
        }

        return new GenerateCodeResult("", requireProse(text, "generate"), List.of(), null);
    }

    // ---- analyze ----

    public AnalyzeCodeResult normalizeAnalyze(String text) {
        Optional<JsonNode> json = parseFencedJson(text, "score", "issues", "strengths", "summary");
        if (json.isPresent()) {
            JsonNode node = json.get();
            List<String> issues = new ArrayList<>();
            JsonNode issueNodes = node.get("issues");
            if (issueNodes != null && issueNodes.isArray()) {
                issueNodes.forEach(issue -> issues.add(formatIssue(issue)));
            }
            return new AnalyzeCodeResult(
                    score(node.get("score")),
                    issues,
                    stringList(node.get("strengths")),
                    textField(node, "summary"),
                    null);
        }

        if (text != null) {
            Matcher scoreMatch = SCORE.matcher(text);
            Integer score = scoreMatch.find() ? Integer.valueOf(scoreMatch.group(1)) : null;
            List<String> issues = extractIssues(text);
            List<String> strengths = allGroups(STRENGTH, text);
            Matcher summaryMatch = SUMMARY.matcher(text);
            String summary = summaryMatch.find() ? summaryMatch.group(1).strip() : null;
            if (score != null || !issues.isEmpty() || !strengths.isEmpty() || summary != null) {
                return new AnalyzeCodeResult(
                        score != null ? score : DEFAULT_SCORE,
                        issues,
                        strengths,
                        summary != null ? summary : withoutBlocks(text),
                        null);
            }
        }

        return new AnalyzeCodeResult(DEFAULT_SCORE, List.of(), List.of(), requireProse(text, "analyze"), null);
    }

    // ---- optimize ----

    public OptimizeCodeResult normalizeOptimize(String text) {
        Optional<JsonNode> json = parseFencedJson(text, "optimizedCode", "changes", "improvementSummary");
        if (json.isPresent()) {
            JsonNode node = json.get();
            return new OptimizeCodeResult(
                    textField(node, "optimizedCode"),
                    stringList(node.get("changes")),
                    textField(node, "improvementSummary"),
                    null);
        }

        String code = CodeBlockExtractor.firstContent(text);
        Optional<String> explanation = extractExplanation(text);
        List<String> changes = text == null ? List.of() : allGroups(CHANGE, CodeBlockExtractor.removeBlocks(text));
        if (!code.isEmpty() || explanation.isPresent() || !changes.isEmpty()) {
            return new OptimizeCodeResult(code, changes, explanation.orElseGet(() -> withoutBlocks(text)), null);
        }

        return new OptimizeCodeResult("", List.of(), requireProse(text, "optimize"), null);
    }

    // ---- shared stages ----

    /**
     * Stage one: the {@code json} block, else the first unlabeled block, else the raw text when it
     * is a bare object. The object must carry at least one of {@code schemaFields}.
     */
    Optional<JsonNode> parseFencedJson(String text, String... schemaFields) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        List<CodeBlock> blocks = CodeBlockExtractor.extract(text);
        String candidate = blocks.stream()
                .filter(b -> "json".equalsIgnoreCase(b.language()))
                .map(CodeBlock::content)
                .findFirst()
                .orElseGet(() -> blocks.stream()
                        .filter(b -> !b.isLabeled())
                        .map(CodeBlock::content)
                        .findFirst()
                        .orElse(null));
        if (candidate == null && text.strip().startsWith("{")) {
            candidate = text.strip();
        }
        if (candidate == null) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(candidate);
            if (node == null || !node.isObject()) {
                return Optional.empty();
            }
            for (String field : schemaFields) {
                if (node.has(field)) {
                    return Optional.of(node);
                }
            }
            log.debug("JSON block does not match the expected fields, falling back to markers");
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.debug("Fenced block is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * Stage two explanation: text after the first known marker up to the next fence, otherwise the
     * prose after the last fenced block.
     */
    Optional<String> extractExplanation(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        for (String marker : EXPLANATION_MARKERS) {
            for (String colon : COLONS) {
                int idx = text.indexOf(marker + colon);
                if (idx < 0) {
                    continue;
                }
                int start = idx + marker.length() + colon.length();
                int end = CodeBlockExtractor.nextFence(text, start);
                String explanation = (end >= 0 ? text.substring(start, end) : text.substring(start)).strip();
                return Optional.of(explanation);
            }
        }
        if (!CodeBlockExtractor.extract(text).isEmpty()) {
            String trailing = CodeBlockExtractor.afterLastBlock(text);
            if (!trailing.isEmpty()) {
                return Optional.of(trailing);
            }
        }
        return Optional.empty();
    }

    List<String> extractIssues(String text) {
        List<String> issues = new ArrayList<>();
        for (String line : CodeBlockExtractor.removeBlocks(text).split("\\R")) {
            Matcher m = SEVERITY_LINE.matcher(line);
            if (m.matches()) {
                String label = m.group(1) != null ? m.group(1) : m.group(2);
                issues.add("[" + severity(label) + "] " + m.group(3).strip());
                continue;
            }
            Matcher problem = PROBLEM_LINE.matcher(line);
            if (problem.find()) {
                String issue = problem.group(1).strip();
                issues.add("[" + severity(issue) + "] " + issue);
            }
        }
        return issues;
    }

    List<String> extractAlternatives(String text) {
        if (text == null) {
            return List.of();
        }
        Matcher m = ALTERNATIVES.matcher(text);
        if (!m.find()) {
            return List.of();
        }
        List<String> items = new ArrayList<>();
        for (String item : LIST_SPLIT.split(m.group(1).strip())) {
            String cleaned = LEADING_BULLET.matcher(item.strip()).replaceFirst("").strip();
            if (!cleaned.isEmpty()) {
                items.add(cleaned);
            }
        }
        return items;
    }

    private String formatIssue(JsonNode issue) {
        if (issue.isTextual()) {
            return issue.asText();
        }
        String severity = issue.hasNonNull("severity") ? issue.get("severity").asText() : "info";
        String message = issue.hasNonNull("message") ? issue.get("message").asText() : "";
        String fix = issue.hasNonNull("fix") ? issue.get("fix").asText() : "";
        StringBuilder sb = new StringBuilder("[").append(severity).append("] ").append(message);
        if (!fix.isBlank()) {
            sb.append(FIX_PREFIX).append(fix);
        }
        return sb.toString();
    }

    private static String severity(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.matches("(?s).*(错误|严重|critical|error).*")) {
            return "error";
        }
        if (lower.matches("(?s).*(警告|warning).*")) {
            return "warning";
        }
        return "info";
    }

    private static int score(JsonNode node) {
        if (node == null || node.isNull()) {
            return DEFAULT_SCORE;
        }
        if (node.isNumber()) {
            return node.asInt();
        }
        try {
            return (int) Math.round(Double.parseDouble(node.asText().strip()));
        } catch (NumberFormatException e) {
            return DEFAULT_SCORE;
        }
    }

    private static String textField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText();
    }

    private static List<String> stringList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(item -> values.add(item.isTextual() ? item.asText() : item.toString()));
        }
        return values;
    }

    private static List<String> allGroups(Pattern pattern, String text) {
        List<String> values = new ArrayList<>();
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            values.add(m.group(1).strip());
        }
        return values;
    }

    private static String withoutBlocks(String text) {
        return CodeBlockExtractor.removeBlocks(text).strip();
    }

    private static String requireProse(String text, String task) {
        String prose = withoutBlocks(text);
        if (prose.isEmpty()) {
            throw new ParseException("Provider returned no usable content for " + task);
        }
        return prose;
    }
}
