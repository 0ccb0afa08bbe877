package com.raditha.canon.cst;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read access to an id-indexed node arena. Implemented by frozen trees and by working copies.
 */
public interface NodeLookup {

    CstNode node(int id);

    boolean contains(int id);

    int rootId();

    default Optional<CstNode> parentOf(int id) {
        int parent = node(id).parent();
        return parent == CstNode.NO_PARENT ? Optional.empty() : Optional.of(node(parent));
    }

    default List<CstNode> childrenOf(int id) {
        List<CstNode> result = new ArrayList<>();
        for (int child : node(id).children()) {
            result.add(node(child));
        }
        return result;
    }

    /**
     * Position of the node in its parent's child list, or -1 for the root.
     */
    default int siblingIndex(int id) {
        return parentOf(id).map(p -> p.children().indexOf(id)).orElse(-1);
    }

    /**
     * Ids of the node and all its descendants, in document order.
     */
    default List<Integer> subtree(int id) {
        List<Integer> result = new ArrayList<>();
        collect(id, result);
        return result;
    }

    private void collect(int id, List<Integer> out) {
        out.add(id);
        for (int child : node(id).children()) {
            collect(child, out);
        }
    }

    /**
     * Human readable path of a node, e.g. {@code $.spec.params[1].name}. Keys resolve to the path
     * of the value they introduce.
     */
    default String pathOf(int id) {
        StringBuilder sb = new StringBuilder();
        appendPath(id, sb);
        return sb.isEmpty() ? "$" : "$" + sb;
    }

    private void appendPath(int id, StringBuilder sb) {
        CstNode node = node(id);
        if (node.parent() == CstNode.NO_PARENT) {
            return;
        }
        CstNode parent = node(node.parent());
        appendPath(parent.id(), sb);
        int index = parent.children().indexOf(id);
        if (parent.kind() == CstKind.MAPPING) {
            int keyIndex = index - (index % 2);
            sb.append('.').append(keyText(node(parent.children().get(keyIndex)).literal()));
        } else {
            sb.append('[').append(index).append(']');
        }
    }

    private static String keyText(String literal) {
        QuoteStyle quote = QuoteStyle.fromLiteral(literal);
        return quote == QuoteStyle.PLAIN ? literal : literal.substring(1, literal.length() - 1);
    }
}
