package com.llmgateway.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Markdown fence handling shared by the normalizer stages.
 */
public final class CodeBlockExtractor {

    private static final Pattern FENCE = Pattern.compile("```([\\w+#.-]*)[ \\t]*\\n?(.*?)```", Pattern.DOTALL);
    private static final String FENCE_MARK = "```";

    private CodeBlockExtractor() {
    }

    public record CodeBlock(String language, String content) {

        public boolean isLabeled() {
            return !language.isEmpty();
        }
    }

    public static List<CodeBlock> extract(String text) {
        List<CodeBlock> blocks = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return blocks;
        }
        Matcher m = FENCE.matcher(text);
        while (m.find()) {
            blocks.add(new CodeBlock(m.group(1), m.group(2).strip()));
        }
        return blocks;
    }

    public static String firstContent(String text) {
        List<CodeBlock> blocks = extract(text);
        return blocks.isEmpty() ? "" : blocks.get(0).content();
    }

    public static String removeBlocks(String text) {
        if (text == null) {
            return "";
        }
        return FENCE.matcher(text).replaceAll("");
    }

    /**
     * Prose after the closing fence of the last block, or empty when there is none.
     */
    public static String afterLastBlock(String text) {
        if (text == null) {
            return "";
        }
        int last = text.lastIndexOf(FENCE_MARK);
        if (last < 0) {
            return "";
        }
        return text.substring(last + FENCE_MARK.length()).strip();
    }

    /**
     * Index of the next fence at or after {@code from}, or -1.
     */
    public static int nextFence(String text, int from) {
        return text.indexOf(FENCE_MARK, from);
    }
}
