package com.raditha.canon.cst;

/**
 * Kinds of tokens a format grammar hands to the {@link CstBuilder}.
 */
public enum TokenType {
    /** Whitespace, line breaks, separators, indicators and comments. */
    TRIVIA,

    /** A scalar literal, exactly as spelled in the source. */
    SCALAR,

    /** Content passed through without interpretation. */
    OPAQUE,

    /** Start of a sequence; the text is the opening delimiter, empty for block layout. */
    OPEN_SEQUENCE,

    /** Start of a mapping; the text is the opening delimiter, empty for block layout. */
    OPEN_MAPPING,

    /** End of the innermost open container; the text is the closing delimiter. */
    CLOSE
}
