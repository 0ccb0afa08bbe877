package com.raditha.canon.diff;

import com.raditha.canon.semantic.NodeId;
import com.raditha.canon.semantic.SemanticNode;

import java.util.List;

/**
 * One edit of a patch, addressed by semantic ids of the tree the patch was computed against.
 *
 * @param op     the operation
 * @param target node to replace, or the container whose children change
 * @param child  the child deleted or moved; for inserts the id of the new value
 * @param key    key of an inserted mapping entry
 * @param index  for inserts the slot the new child takes, for moves the destination index;
 *               -1 to append
 * @param value  new value of a replace or insert
 * @param order  complete new child order of a reorder
 * @param hint   explicit formatting, or null
 */
public record Edit(
        EditOp op,
        NodeId target,
        NodeId child,
        String key,
        int index,
        SemanticNode value,
        List<NodeId> order,
        FormatHint hint) {

    public Edit {
        if (op == null || target == null) {
            throw new IllegalArgumentException("Edits need an operation and a target");
        }
        order = order == null ? List.of() : List.copyOf(order);
    }

    public static Edit replaceValue(NodeId target, SemanticNode value) {
        return new Edit(EditOp.REPLACE_VALUE, target, null, null, -1, value, null, null);
    }

    public static Edit insertChild(NodeId parent, String key, int slot, SemanticNode value) {
        return new Edit(EditOp.INSERT_CHILD, parent, value.id(), key, slot, value, null, null);
    }

    public static Edit insertChild(NodeId parent, int index, SemanticNode value) {
        return new Edit(EditOp.INSERT_CHILD, parent, value.id(), null, index, value, null, null);
    }

    public static Edit deleteChild(NodeId parent, NodeId child) {
        return new Edit(EditOp.DELETE_CHILD, parent, child, null, -1, null, null, null);
    }

    public static Edit moveChild(NodeId parent, NodeId child, int toIndex) {
        return new Edit(EditOp.MOVE_CHILD, parent, child, null, toIndex, null, null, null);
    }

    public static Edit reorderSiblings(NodeId parent, List<NodeId> order) {
        return new Edit(EditOp.REORDER_SIBLINGS, parent, null, null, -1, null, order, null);
    }

    public Edit withHint(FormatHint newHint) {
        return new Edit(op, target, child, key, index, value, order, newHint);
    }

    @Override
    public String toString() {
        return switch (op) {
            case REPLACE_VALUE -> op + " " + target + " := " + value;
            case INSERT_CHILD -> op + " " + target + (key != null ? "." + key : "[" + index + "]") + " := " + value;
            case DELETE_CHILD -> op + " " + target + " - " + child;
            case MOVE_CHILD -> op + " " + target + " " + child + " -> " + index;
            case REORDER_SIBLINGS -> op + " " + target + " " + order;
        };
    }
}
