package com.raditha.canon.format;

import com.raditha.canon.cst.QuoteStyle;

/**
 * Formatting conventions of a grammar, used when new text has to be written: rendering replaced
 * scalars and synthesizing inserted nodes.
 *
 * @param name                name of the grammar
 * @param commentMarker       comment start marker, or null when the format has no comments
 * @param flowOnly            whether every collection is delimited ({@code JSON})
 * @param typedQuotedStrings  whether quoted strings are candidates for typed rules such as timestamps
 * @param keyQuote            quoting of newly written keys
 * @param fallbackQuote       quoting used when a string cannot be written in the preferred style
 * @param indentUnit          spaces per nesting level for block layout
 * @param keyValueSeparator   text between a key and an inline value
 * @param flowSeparator       separator between flow collection entries on one line
 * @param orphanCommentPolicy where comments of deleted nodes are kept
 * @param syntax              scalar escaping rules
 */
public record FormatProfile(
        String name,
        String commentMarker,
        boolean flowOnly,
        boolean typedQuotedStrings,
        QuoteStyle keyQuote,
        QuoteStyle fallbackQuote,
        int indentUnit,
        String keyValueSeparator,
        String flowSeparator,
        OrphanCommentPolicy orphanCommentPolicy,
        ScalarSyntax syntax) {

    public FormatProfile {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("name cannot be empty");
        }
        if (indentUnit < 1) {
            throw new IllegalArgumentException("indentUnit must be >= 1");
        }
        if (syntax == null) {
            throw new IllegalArgumentException("syntax cannot be null");
        }
        if (orphanCommentPolicy == null) {
            orphanCommentPolicy = OrphanCommentPolicy.ATTACH_TO_PREVIOUS;
        }
    }

    public FormatProfile withOrphanCommentPolicy(OrphanCommentPolicy policy) {
        return new FormatProfile(name, commentMarker, flowOnly, typedQuotedStrings, keyQuote, fallbackQuote,
                indentUnit, keyValueSeparator, flowSeparator, policy, syntax);
    }

    public boolean hasComments() {
        return commentMarker != null && !commentMarker.isEmpty();
    }
}
