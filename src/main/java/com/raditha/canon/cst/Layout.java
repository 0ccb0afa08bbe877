package com.raditha.canon.cst;

/**
 * How a node is laid out in its source: indentation driven, or delimited by brackets.
 * Scalars carry the layout of the collection they sit in.
 */
public enum Layout {
    BLOCK,
    FLOW
}
