package com.raditha.canon.cst;

import java.util.ArrayList;
import java.util.List;

/**
 * Non-semantic text attached to one boundary of a node: whitespace, line breaks, separators
 * and comments. Reassembled verbatim.
 */
public record Trivia(String text) {

    public static final Trivia EMPTY = new Trivia("");

    public Trivia {
        if (text == null) {
            text = "";
        }
    }

    public static Trivia of(String text) {
        return text == null || text.isEmpty() ? EMPTY : new Trivia(text);
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    public boolean hasLineBreak() {
        return text.indexOf('\n') >= 0;
    }

    public boolean endsWithLineBreak() {
        return text.endsWith("\n");
    }

    public Trivia append(String more) {
        return more.isEmpty() ? this : new Trivia(text + more);
    }

    public Trivia prepend(String more) {
        return more.isEmpty() ? this : new Trivia(more + text);
    }

    /**
     * Text after the last line break, normally the indentation of the following node.
     */
    public String lastLine() {
        int nl = text.lastIndexOf('\n');
        return nl < 0 ? text : text.substring(nl + 1);
    }

    /**
     * Text up to and including the last line break; empty when there is none.
     */
    public String upToLastLine() {
        int nl = text.lastIndexOf('\n');
        return nl < 0 ? "" : text.substring(0, nl + 1);
    }

    /**
     * Comments in this trivia, each from the marker to the end of its line.
     *
     * @param marker comment marker of the format, or null when the format has no comments
     */
    public List<String> comments(String marker) {
        List<String> result = new ArrayList<>();
        if (marker == null || marker.isEmpty()) {
            return result;
        }
        int from = 0;
        while (true) {
            int at = text.indexOf(marker, from);
            if (at < 0) {
                break;
            }
            int eol = text.indexOf('\n', at);
            String comment = eol < 0 ? text.substring(at) : text.substring(at, eol);
            if (comment.endsWith("\r")) {
                comment = comment.substring(0, comment.length() - 1);
            }
            result.add(comment);
            if (eol < 0) {
                break;
            }
            from = eol + 1;
        }
        return result;
    }

    public boolean hasComment(String marker) {
        return marker != null && !marker.isEmpty() && text.contains(marker);
    }

    @Override
    public String toString() {
        return text.replace("\n", "\\n");
    }
}
