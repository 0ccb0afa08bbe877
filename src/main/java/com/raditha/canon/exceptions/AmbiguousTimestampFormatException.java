package com.raditha.canon.exceptions;

import java.util.List;

/**
 * A scalar matched more than one configured timestamp pattern and the matches disagree
 * on the instant they denote.
 */
public class AmbiguousTimestampFormatException extends CanonException {

    private final transient List<String> patterns;

    public AmbiguousTimestampFormatException(String literal, List<String> patterns, SourceLocation location) {
        super("Timestamp '" + literal + "' is ambiguous between patterns " + patterns, location, "timestamp");
        this.patterns = List.copyOf(patterns);
    }

    public List<String> getPatterns() {
        return patterns;
    }
}
