package com.raditha.canon.exceptions;

/**
 * Where a problem was found: the path of the node in the tree plus an approximate
 * position in the source text.
 *
 * @param path   tree path such as {@code $.spec.params[2].name}
 * @param line   1-indexed line, or 0 when the node has no source span
 * @param column 1-indexed column, or 0 when the node has no source span
 */
public record SourceLocation(String path, int line, int column) {

    public static final SourceLocation UNKNOWN = new SourceLocation("$", 0, 0);

    public SourceLocation {
        if (path == null || path.isEmpty()) {
            path = "$";
        }
    }

    public static SourceLocation of(String path) {
        return new SourceLocation(path, 0, 0);
    }

    public boolean hasPosition() {
        return line > 0;
    }

    public SourceLocation withPath(String newPath) {
        return new SourceLocation(newPath, line, column);
    }

    @Override
    public String toString() {
        if (!hasPosition()) {
            return path;
        }
        return path + " (line " + line + ", column " + column + ")";
    }
}
