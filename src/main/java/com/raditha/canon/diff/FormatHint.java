package com.raditha.canon.diff;

import com.raditha.canon.cst.Layout;
import com.raditha.canon.cst.QuoteStyle;

/**
 * Explicit formatting for text written by an edit, overriding what would be copied from the
 * replaced node or from siblings. Either part may be null.
 *
 * @param quote  quoting of written strings
 * @param layout layout of written collections, and how an empty collection is opened up on insert
 */
public record FormatHint(QuoteStyle quote, Layout layout) {

    public static FormatHint quote(QuoteStyle quote) {
        return new FormatHint(quote, null);
    }

    public static FormatHint block() {
        return new FormatHint(null, Layout.BLOCK);
    }

    public static FormatHint flow() {
        return new FormatHint(null, Layout.FLOW);
    }
}
