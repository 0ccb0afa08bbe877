package com.raditha.canon.normalization;

import com.raditha.canon.cst.QuoteStyle;
import com.raditha.canon.exceptions.SourceLocation;
import com.raditha.canon.format.FormatProfile;
import com.raditha.canon.semantic.SemanticPath;

/**
 * A scalar literal as seen by the normalization rules.
 *
 * @param literal  exact source spelling
 * @param quote    quoting of the literal
 * @param text     the literal with quoting and escapes resolved
 * @param key      key of the enclosing mapping entry, null for sequence items and the root
 * @param path     semantic path of the value
 * @param profile  conventions of the format
 * @param location where the literal is, for error messages
 */
public record ScalarInput(
        String literal,
        QuoteStyle quote,
        String text,
        String key,
        SemanticPath path,
        FormatProfile profile,
        SourceLocation location) {

    public boolean isPlain() {
        return quote == QuoteStyle.PLAIN;
    }
}
