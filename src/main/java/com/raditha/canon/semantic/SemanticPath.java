package com.raditha.canon.semantic;

import java.util.ArrayList;
import java.util.List;

/**
 * Location of a node by keys and indexes from the root, e.g. {@code $.spec.params[0].name}.
 */
public record SemanticPath(List<Segment> segments) {

    public static final SemanticPath ROOT = new SemanticPath(List.of());

    /**
     * One step: a mapping key, or a sequence index when {@code key} is null.
     */
    public record Segment(String key, int index) {

        public static Segment key(String key) {
            return new Segment(key, -1);
        }

        public static Segment index(int index) {
            if (index < 0) {
                throw new IllegalArgumentException("index must be >= 0");
            }
            return new Segment(null, index);
        }

        public boolean isKey() {
            return key != null;
        }

        @Override
        public String toString() {
            if (!isKey()) {
                return "[" + index + "]";
            }
            if (key.isEmpty() || key.chars().anyMatch(c -> c == '.' || c == '[' || c == ']' || c == '\'')) {
                return "['" + key.replace("'", "''") + "']";
            }
            return "." + key;
        }
    }

    public SemanticPath {
        segments = List.copyOf(segments);
    }

    /**
     * Parse a path such as {@code spec.params[0].name}, {@code $.a['b.c']} or {@code $}.
     */
    public static SemanticPath parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        String s = text.trim();
        if (s.startsWith("$")) {
            s = s.substring(1);
        }
        List<Segment> result = new ArrayList<>();
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '.') {
                i++;
                continue;
            }
            if (c == '[') {
                int close;
                if (i + 1 < s.length() && s.charAt(i + 1) == '\'') {
                    StringBuilder key = new StringBuilder();
                    int j = i + 2;
                    while (true) {
                        if (j >= s.length()) {
                            throw new IllegalArgumentException("Unterminated quoted key in path: " + text);
                        }
                        if (s.charAt(j) == '\'') {
                            if (j + 1 < s.length() && s.charAt(j + 1) == '\'') {
                                key.append('\'');
                                j += 2;
                                continue;
                            }
                            break;
                        }
                        key.append(s.charAt(j++));
                    }
                    close = s.indexOf(']', j);
                    if (close < 0) {
                        throw new IllegalArgumentException("Unterminated key in path: " + text);
                    }
                    result.add(Segment.key(key.toString()));
                } else {
                    close = s.indexOf(']', i);
                    if (close < 0) {
                        throw new IllegalArgumentException("Unterminated index in path: " + text);
                    }
                    try {
                        result.add(Segment.index(Integer.parseInt(s.substring(i + 1, close).trim())));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid index in path: " + text, e);
                    }
                }
                i = close + 1;
                continue;
            }
            int end = i;
            while (end < s.length() && s.charAt(end) != '.' && s.charAt(end) != '[') {
                end++;
            }
            result.add(Segment.key(s.substring(i, end)));
            i = end;
        }
        return new SemanticPath(result);
    }

    public SemanticPath child(String key) {
        return append(Segment.key(key));
    }

    public SemanticPath child(int index) {
        return append(Segment.index(index));
    }

    private SemanticPath append(Segment segment) {
        List<Segment> next = new ArrayList<>(segments);
        next.add(segment);
        return new SemanticPath(next);
    }

    public SemanticPath parent() {
        if (segments.isEmpty()) {
            throw new IllegalStateException("The root has no parent");
        }
        return new SemanticPath(segments.subList(0, segments.size() - 1));
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public Segment last() {
        if (segments.isEmpty()) {
            throw new IllegalStateException("The root path has no segments");
        }
        return segments.get(segments.size() - 1);
    }

    public int depth() {
        return segments.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("$");
        for (Segment segment : segments) {
            sb.append(segment);
        }
        return sb.toString();
    }
}
