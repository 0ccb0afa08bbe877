package com.raditha.canon.cst;

/**
 * A typed slice of source text produced by a format grammar.
 *
 * @param type   token kind
 * @param text   exact source text of the token
 * @param offset character offset of the token in the source
 * @param style  presentation flags of the node the token starts (ignored for trivia and close)
 */
public record Token(TokenType type, String text, int offset, NodeStyle style) {

    public Token {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (text == null) {
            text = "";
        }
        if (style == null) {
            style = NodeStyle.PLAIN;
        }
    }

    public static Token trivia(String text, int offset) {
        return new Token(TokenType.TRIVIA, text, offset, null);
    }

    public static Token scalar(String text, int offset, NodeStyle style) {
        return new Token(TokenType.SCALAR, text, offset, style);
    }

    public static Token opaque(String text, int offset, NodeStyle style) {
        return new Token(TokenType.OPAQUE, text, offset, style);
    }

    public static Token openSequence(String text, int offset, NodeStyle style) {
        return new Token(TokenType.OPEN_SEQUENCE, text, offset, style);
    }

    public static Token openMapping(String text, int offset, NodeStyle style) {
        return new Token(TokenType.OPEN_MAPPING, text, offset, style);
    }

    public static Token close(String text, int offset) {
        return new Token(TokenType.CLOSE, text, offset, null);
    }

    public int end() {
        return offset + text.length();
    }
}
