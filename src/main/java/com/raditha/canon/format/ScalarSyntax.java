package com.raditha.canon.format;

import com.raditha.canon.cst.Layout;
import com.raditha.canon.cst.QuoteStyle;

/**
 * Lexical rules for scalar literals of one format: how quoted text is unescaped and escaped, and
 * which texts may be written without quotes.
 */
public interface ScalarSyntax {

    /**
     * Text denoted by a literal.
     *
     * @throws IllegalArgumentException if the literal is malformed
     */
    String decode(String literal, QuoteStyle quote);

    /**
     * Literal spelling {@code text} in the given quote style.
     */
    String encode(String text, QuoteStyle quote);

    /**
     * Whether the quote style can spell the text at all.
     */
    boolean supports(QuoteStyle quote, String text);

    /**
     * Whether the text can be written unquoted without being misread structurally. Whether it would
     * be read back as a number, boolean or timestamp is decided by the normalization rules.
     */
    boolean canBePlain(String text, Layout context);
}
