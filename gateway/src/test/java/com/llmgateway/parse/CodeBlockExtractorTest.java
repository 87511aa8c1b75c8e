package com.llmgateway.parse;

import com.llmgateway.parse.CodeBlockExtractor.CodeBlock;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CodeBlockExtractorTest {

    @Test
    void shouldExtractLabeledAndUnlabeledBlocks() {
        String text = "intro\n```c++\nint main() {}\n```\nmiddle\n```\nplain\n```";

        List<CodeBlock> blocks = CodeBlockExtractor.extract(text);

        assertEquals(2, blocks.size());
        assertEquals(new CodeBlock("c++", "int main() {}"), blocks.get(0));
        assertFalse(blocks.get(1).isLabeled());
        assertEquals("plain", blocks.get(1).content());
    }

    @Test
    void shouldRemoveBlocksAndFindTrailingProse() {
        String text = "before\n```py\nx = 1\n```\nafter";

        assertEquals("before\n\nafter", CodeBlockExtractor.removeBlocks(text));
        assertEquals("after", CodeBlockExtractor.afterLastBlock(text));
        assertEquals("", CodeBlockExtractor.afterLastBlock("no fences here"));
    }
}
