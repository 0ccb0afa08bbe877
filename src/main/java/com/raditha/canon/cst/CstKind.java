package com.raditha.canon.cst;

/**
 * The closed set of concrete syntax node kinds shared by every format grammar.
 */
public enum CstKind {
    /** A single literal: plain, quoted, number, boolean, null. */
    SCALAR,

    /** Ordered children, block ({@code - a}) or flow ({@code [a, b]}). */
    SEQUENCE,

    /** Children alternate key, value, key, value... */
    MAPPING,

    /** Content the grammar recognizes but does not model (block scalars, anchors, tags). */
    OPAQUE;

    public boolean isContainer() {
        return this == SEQUENCE || this == MAPPING;
    }
}
