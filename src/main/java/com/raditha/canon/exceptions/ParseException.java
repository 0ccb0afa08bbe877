package com.raditha.canon.exceptions;

/**
 * Malformed input. Raised by format grammars and by the normalizer for content that
 * cannot be given a meaning (such as duplicate mapping keys). Never recovered from.
 */
public class ParseException extends CanonException {

    public ParseException(String message, SourceLocation location, String grammar) {
        super(message, location, grammar);
    }

    public ParseException(String message, SourceLocation location, String grammar, Throwable cause) {
        super(message, location, grammar, cause);
    }
}
