package io.github.sparkrew.callflow.flow_extractor.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceMaskerTest {

    @Test
    void testMask_KeepsLengthAndLineBreaks() {
        String text = """
                // Helper.log();
                int a = 1; /* new Foo()
                   still comment */ call();
                """;
        String masked = SourceMasker.mask(text);
        assertEquals(text.length(), masked.length());
        assertEquals(text.chars().filter(c -> c == '\n').count(), masked.chars().filter(c -> c == '\n').count());
        assertFalse(masked.contains("Helper"));
        assertFalse(masked.contains("Foo"));
        assertTrue(masked.contains("int a = 1;"));
        assertTrue(masked.contains("call();"));
    }

    @Test
    void testMask_BlanksLiteralContentsButKeepsQuotes() {
        String text = "String s = \"Helper.log() { }\"; char c = '{'; char q = '\\'';";
        String masked = SourceMasker.mask(text);
        assertEquals(text.length(), masked.length());
        assertFalse(masked.contains("Helper"));
        assertFalse(masked.contains("{"));
        assertTrue(masked.startsWith("String s = \""));
        assertTrue(masked.contains("char q = '  ';"));
    }

    @Test
    void testMask_EscapedQuoteDoesNotEndString() {
        String text = "String s = \"a\\\"b.call()\"; after();";
        String masked = SourceMasker.mask(text);
        assertFalse(masked.contains("call"));
        assertTrue(masked.contains("after();"));
    }

    @Test
    void testMask_TextBlock() {
        String text = "String s = \"\"\"\n    new Hidden() { }\n    \"\"\"; visible();";
        String masked = SourceMasker.mask(text);
        assertEquals(text.length(), masked.length());
        assertFalse(masked.contains("Hidden"));
        assertTrue(masked.contains("visible();"));
        assertEquals(2, masked.chars().filter(c -> c == '\n').count());
    }

    @Test
    void testMask_UnterminatedStringStopsAtEndOfLine() {
        String text = "String s = \"broken\nnext();";
        String masked = SourceMasker.mask(text);
        assertFalse(masked.contains("broken"));
        assertTrue(masked.endsWith("next();"));
    }

    @Test
    void testMask_UnterminatedBlockCommentRunsToEnd() {
        String text = "keep(); /* lost();";
        String masked = SourceMasker.mask(text);
        assertTrue(masked.startsWith("keep();"));
        assertFalse(masked.contains("lost"));
    }
}
