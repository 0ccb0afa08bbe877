package com.raditha.canon.normalization.rules;

import com.raditha.canon.semantic.SemanticPath;

import java.util.ArrayList;
import java.util.List;

/**
 * Pattern over semantic paths. Segments are separated by dots: a literal key, {@code *} for any
 * key, {@code [*]} for any sequence index, {@code [n]} for one index and {@code **} for any number
 * of segments. A key containing dots is written quoted in brackets: {@code labels['app.kubernetes.io/name']}.
 * {@code $} alone is the root.
 */
public final class PathPattern {

    private static final String ANY_KEY = "*";
    private static final String ANY_INDEX = "[*]";
    private static final String ANY_DEPTH = "**";

    private final String text;
    private final List<String> parts;

    private PathPattern(String text, List<String> parts) {
        this.text = text;
        this.parts = parts;
    }

    public static PathPattern compile(String pattern) {
        if (pattern == null) {
            throw new IllegalArgumentException("Path pattern cannot be null");
        }
        String s = pattern.trim();
        if (s.startsWith("$")) {
            s = s.substring(1);
        }
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '.') {
                flush(current, parts);
            } else if (c == '[') {
                flush(current, parts);
                int close = s.indexOf(']', i);
                if (close < 0) {
                    throw new IllegalArgumentException("Unterminated index in path pattern: " + pattern);
                }
                parts.add(s.substring(i, close + 1));
                i = close;
            } else {
                current.append(c);
            }
        }
        flush(current, parts);
        return new PathPattern(pattern, List.copyOf(parts));
    }

    private static void flush(StringBuilder current, List<String> parts) {
        if (current.length() > 0) {
            parts.add(current.toString());
            current.setLength(0);
        }
    }

    public boolean matches(SemanticPath path) {
        return matches(0, path.segments(), 0);
    }

    private boolean matches(int p, List<SemanticPath.Segment> segments, int s) {
        if (p == parts.size()) {
            return s == segments.size();
        }
        String part = parts.get(p);
        if (ANY_DEPTH.equals(part)) {
            for (int skip = s; skip <= segments.size(); skip++) {
                if (matches(p + 1, segments, skip)) {
                    return true;
                }
            }
            return false;
        }
        if (s == segments.size()) {
            return false;
        }
        SemanticPath.Segment segment = segments.get(s);
        boolean ok;
        if (isQuotedKey(part)) {
            ok = segment.isKey() && part.substring(2, part.length() - 2).equals(segment.key());
        } else if (part.startsWith("[")) {
            ok = !segment.isKey() && (ANY_INDEX.equals(part)
                    || part.substring(1, part.length() - 1).trim().equals(Integer.toString(segment.index())));
        } else {
            ok = segment.isKey() && (ANY_KEY.equals(part) || part.equals(segment.key()));
        }
        return ok && matches(p + 1, segments, s + 1);
    }

    private static boolean isQuotedKey(String part) {
        return part.length() >= 4 && (part.startsWith("['") && part.endsWith("']")
                || part.startsWith("[\"") && part.endsWith("\"]"));
    }

    @Override
    public String toString() {
        return text;
    }
}
