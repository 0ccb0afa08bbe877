package com.raditha.canon.cst;

/**
 * Half-open character range {@code [start, end)} of a node's content in the text it was parsed
 * from. Trivia is not part of the span.
 */
public record Span(int start, int end) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    public boolean encloses(Span other) {
        return other.start >= start && other.end <= end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
