package com.raditha.canon.normalization;

/**
 * Normalization rules that can be recorded against a semantic node.
 */
public enum RuleKind {
    QUOTE_STYLE,
    NUMBER_SPELLING,
    BOOLEAN_SPELLING,
    NULL_SPELLING,
    TIMESTAMP,
    DURATION,
    VALUE_ALIAS,
    EMBEDDED_JSON,
    OPAQUE,
    CONTAINER,
    SYNTHETIC_DEFAULT
}
