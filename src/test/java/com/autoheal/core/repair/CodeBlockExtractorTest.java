package com.autoheal.core.repair;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CodeBlockExtractorTest {

    @Test
    void testFencedBlockWins() {
        String response = "The fix:\n```python\nimport os\nprint(os.sep)\n```\nThen rerun.";

        assertEquals(Optional.of("import os\nprint(os.sep)\n"), CodeBlockExtractor.extract(response));
    }

    @Test
    void testUnfencedCodeIsTakenWhole() {
        assertEquals(Optional.of("def f():\n    return 1\n"), CodeBlockExtractor.extract("def f():\n    return 1"));
    }

    @Test
    void testProseYieldsNothing() {
        assertTrue(CodeBlockExtractor.extract("Check the indentation on line 3.").isEmpty());
        assertTrue(CodeBlockExtractor.extract("```\n\n```").isEmpty());
        assertTrue(CodeBlockExtractor.extract(null).isEmpty());
    }
}
