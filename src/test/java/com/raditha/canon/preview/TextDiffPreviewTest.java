package com.raditha.canon.preview;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TextDiffPreview.
 */
class TextDiffPreviewTest {

    private final TextDiffPreview preview = new TextDiffPreview();

    @Test
    void testEqualTextsGiveEmptyDiff() {
        assertEquals("", preview.unifiedDiff("a.yaml", "a: 1\n", "a: 1\n"));
        assertEquals(0, preview.changedLines("a: 1\n", "a: 1\n"));
    }

    @Test
    void testUnifiedDiff() {
        String diff = preview.unifiedDiff("task.yaml", "a: 1\nb: 2\nc: 3\n", "a: 1\nb: 20\nc: 3\n");

        assertTrue(diff.startsWith("--- a/task.yaml\n+++ b/task.yaml\n"), diff);
        assertTrue(diff.contains("\n-b: 2\n+b: 20"), diff);
        assertTrue(diff.contains(" a: 1"), diff);
    }

    @Test
    void testContextLines() {
        String original = "a: 1\nb: 2\nc: 3\nd: 4\ne: 5\n";
        String patched = "a: 1\nb: 2\nc: 30\nd: 4\ne: 5\n";

        String narrow = preview.unifiedDiff("f", original, patched, 0);

        assertFalse(narrow.contains(" b: 2"), narrow);
        assertTrue(preview.unifiedDiff("f", original, patched).contains(" b: 2"));
    }

    @Test
    void testChangedLines() {
        assertEquals(2, preview.changedLines("a: 1\nb: 2\n", "a: 1\nb: 3\n"));
        assertEquals(1, preview.changedLines("a: 1\n", "a: 1\nb: 2\n"));
        assertEquals(1, preview.changedLines("", "a"));
    }
}
