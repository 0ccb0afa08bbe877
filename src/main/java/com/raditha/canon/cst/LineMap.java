package com.raditha.canon.cst;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts character offsets of a source text into 1-indexed line and column numbers.
 */
public final class LineMap {

    private final int[] lineStarts;
    private final String lineBreak;

    private LineMap(int[] lineStarts, String lineBreak) {
        this.lineStarts = lineStarts;
        this.lineBreak = lineBreak;
    }

    public static LineMap of(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        String lineBreak = null;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
                if (lineBreak == null) {
                    lineBreak = i > 0 && text.charAt(i - 1) == '\r' ? "\r\n" : "\n";
                }
            }
        }
        int[] array = new int[starts.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = starts.get(i);
        }
        return new LineMap(array, lineBreak == null ? "\n" : lineBreak);
    }

    public int line(int offset) {
        int lo = 0;
        int hi = lineStarts.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo + 1;
    }

    public int column(int offset) {
        return offset - lineStarts[line(offset) - 1] + 1;
    }

    /**
     * The line terminator of the text, taken from its first line; {@code \n} for single-line text.
     */
    public String lineBreak() {
        return lineBreak;
    }

    public int lineCount() {
        return lineStarts.length;
    }
}
