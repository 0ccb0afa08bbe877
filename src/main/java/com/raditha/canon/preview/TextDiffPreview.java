package com.raditha.canon.preview;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.util.Arrays;
import java.util.List;

/**
 * Generates unified diffs between a document and its patched text.
 * Uses java-diff-utils library.
 */
public class TextDiffPreview {

    private static final int DEFAULT_CONTEXT = 3;

    /**
     * Generate a unified diff between original and patched text.
     *
     * @param name     file name shown in the diff header
     * @param original original text
     * @param patched  patched text
     * @return unified diff, empty when the texts are equal
     */
    public String unifiedDiff(String name, String original, String patched) {
        return unifiedDiff(name, original, patched, DEFAULT_CONTEXT);
    }

    /**
     * Generate diff with custom context lines.
     */
    public String unifiedDiff(String name, String original, String patched, int contextLines) {
        List<String> before = lines(original);
        List<String> after = lines(patched);

        Patch<String> patch = DiffUtils.diff(before, after);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + name,
                "b/" + name,
                before,
                patch,
                contextLines);

        return String.join("\n", unifiedDiff);
    }

    /**
     * Number of lines that differ between the two texts, counting both sides.
     */
    public int changedLines(String original, String patched) {
        Patch<String> patch = DiffUtils.diff(lines(original), lines(patched));
        return patch.getDeltas().stream()
                .mapToInt(d -> d.getSource().size() + d.getTarget().size())
                .sum();
    }

    private static List<String> lines(String text) {
        if (text.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(text.split("\n", -1));
    }
}
