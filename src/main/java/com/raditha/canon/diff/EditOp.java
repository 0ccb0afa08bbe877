package com.raditha.canon.diff;

/**
 * Structural operations of a patch.
 */
public enum EditOp {
    /** Replace the value of the target node. */
    REPLACE_VALUE,
    /** Insert a new child into the target container. */
    INSERT_CHILD,
    /** Remove a child of the target container. */
    DELETE_CHILD,
    /** Move one child of the target sequence to a new index. */
    MOVE_CHILD,
    /** Put all children of the target sequence into a new order. */
    REORDER_SIBLINGS
}
