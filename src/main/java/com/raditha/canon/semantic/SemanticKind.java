package com.raditha.canon.semantic;

/**
 * Kinds of values in the canonical semantic tree.
 */
public enum SemanticKind {
    NULL,
    BOOL,
    INT,
    FLOAT,
    STRING,
    TIMESTAMP,
    SEQUENCE,
    MAPPING,
    /** Content the grammar could not interpret; compared by its source text. */
    OPAQUE;

    public boolean isContainer() {
        return this == SEQUENCE || this == MAPPING;
    }

    public boolean isScalar() {
        return !isContainer();
    }
}
