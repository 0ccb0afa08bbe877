package com.raditha.canon.normalization;

import com.raditha.canon.cst.Layout;
import com.raditha.canon.cst.QuoteStyle;
import com.raditha.canon.format.FormatProfile;
import com.raditha.canon.semantic.SemanticPath;

/**
 * Where a scalar is being written.
 *
 * @param profile        conventions of the target format
 * @param layout         layout of the enclosing collection
 * @param key            key of the enclosing mapping entry, null for sequence items
 * @param path           semantic path of the value
 * @param preferredQuote quoting to use when the text allows it, null for none
 * @param reader         how the written literal will be read back
 */
public record RenderContext(
        FormatProfile profile,
        Layout layout,
        String key,
        SemanticPath path,
        QuoteStyle preferredQuote,
        ScalarReader reader) {

    public RenderContext withPreferredQuote(QuoteStyle quote) {
        return new RenderContext(profile, layout, key, path, quote, reader);
    }
}
