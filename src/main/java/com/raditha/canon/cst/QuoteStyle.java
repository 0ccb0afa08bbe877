package com.raditha.canon.cst;

/**
 * Quoting of a scalar literal.
 */
public enum QuoteStyle {
    PLAIN,
    SINGLE,
    DOUBLE;

    /**
     * Detect the quote style of a raw scalar literal.
     */
    public static QuoteStyle fromLiteral(String literal) {
        if (literal.length() >= 2) {
            char first = literal.charAt(0);
            char last = literal.charAt(literal.length() - 1);
            if (first == '"' && last == '"') {
                return DOUBLE;
            }
            if (first == '\'' && last == '\'') {
                return SINGLE;
            }
        }
        return PLAIN;
    }

    public char quoteChar() {
        return switch (this) {
            case SINGLE -> '\'';
            case DOUBLE -> '"';
            case PLAIN -> throw new IllegalStateException("plain scalars have no quote character");
        };
    }

    public static QuoteStyle fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("QuoteStyle value cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "plain", "none" -> PLAIN;
            case "single", "'" -> SINGLE;
            case "double", "\"" -> DOUBLE;
            default -> throw new IllegalArgumentException(
                    "Invalid quote style: " + value + ". Must be: plain, single, or double");
        };
    }
}
