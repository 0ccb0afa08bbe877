package com.raditha.canon.patch;

import com.raditha.canon.diff.Edit;
import com.raditha.canon.diff.EditOp;
import com.raditha.canon.exceptions.InvalidEditException;
import com.raditha.canon.exceptions.SourceLocation;
import com.raditha.canon.semantic.NodeId;
import com.raditha.canon.semantic.SemanticKind;
import com.raditha.canon.semantic.SemanticNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies an edit to a structure held inside one literal, such as a JSON list in a quoted
 * string. The structure is edited as a value and written back whole; nodes the edit does not
 * touch keep their ids.
 */
final class EmbeddedValueEditor {

    private final SourceLocation location;
    private final String operation;

    EmbeddedValueEditor(SourceLocation location, String operation) {
        this.location = location;
        this.operation = operation;
    }

    /**
     * @return {@code root} with the edit applied
     * @throws InvalidEditException when the edit does not fit the structure
     */
    SemanticNode apply(SemanticNode root, Edit edit) {
        SemanticNode result = rewrite(root, edit);
        if (result == null) {
            throw invalid("No node " + edit.target() + " inside the embedded value");
        }
        return result;
    }

    /**
     * The node with the edit applied below it, or null when the target is not there.
     */
    private SemanticNode rewrite(SemanticNode node, Edit edit) {
        if (node.id().equals(edit.target())) {
            return applyAt(node, edit);
        }
        if (node.kind() == SemanticKind.SEQUENCE) {
            List<SemanticNode> items = new ArrayList<>(node.items());
            for (int i = 0; i < items.size(); i++) {
                SemanticNode rewritten = rewrite(items.get(i), edit);
                if (rewritten != null) {
                    items.set(i, rewritten);
                    return node.withItems(items);
                }
            }
        } else if (node.kind() == SemanticKind.MAPPING) {
            for (Map.Entry<String, SemanticNode> e : node.entries().entrySet()) {
                SemanticNode rewritten = rewrite(e.getValue(), edit);
                if (rewritten != null) {
                    Map<String, SemanticNode> entries = new LinkedHashMap<>(node.entries());
                    entries.put(e.getKey(), rewritten);
                    return node.withEntries(entries);
                }
            }
        }
        return null;
    }

    private SemanticNode applyAt(SemanticNode node, Edit edit) {
        if (edit.op() == EditOp.REPLACE_VALUE) {
            if (edit.value() == null) {
                throw invalid("Replace needs a value");
            }
            return edit.value();
        }
        if (!node.isContainer()) {
            throw invalid(edit.target() + " is not a collection");
        }
        return switch (edit.op()) {
            case INSERT_CHILD -> insert(node, edit);
            case DELETE_CHILD -> delete(node, edit.child());
            case MOVE_CHILD -> move(node, edit.child(), edit.index());
            case REORDER_SIBLINGS -> reorder(node, edit.order());
            case REPLACE_VALUE -> throw new IllegalStateException("handled above");
        };
    }

    private SemanticNode insert(SemanticNode node, Edit edit) {
        if (edit.value() == null) {
            throw invalid("Insert needs a value");
        }
        if (node.kind() == SemanticKind.MAPPING) {
            if (edit.key() == null) {
                throw invalid("Inserting into a mapping needs a key");
            }
            if (node.entries().containsKey(edit.key())) {
                throw invalid("Key '" + edit.key() + "' already exists");
            }
            List<Map.Entry<String, SemanticNode>> slots = new ArrayList<>(node.entries().entrySet());
            int slot = edit.index() < 0 || edit.index() > slots.size() ? slots.size() : edit.index();
            slots.add(slot, Map.entry(edit.key(), edit.value()));
            return node.withEntries(toMap(slots));
        }
        List<SemanticNode> items = new ArrayList<>(node.items());
        int index = edit.index() < 0 ? items.size() : edit.index();
        if (index > items.size()) {
            throw invalid("Index " + index + " is past the end of a sequence of " + items.size());
        }
        items.add(index, edit.value());
        return node.withItems(items);
    }

    private SemanticNode delete(SemanticNode node, NodeId child) {
        if (child == null) {
            throw invalid("Delete needs the child to remove");
        }
        if (node.kind() == SemanticKind.MAPPING) {
            Map<String, SemanticNode> entries = new LinkedHashMap<>(node.entries());
            if (!entries.values().removeIf(v -> v.id().equals(child))) {
                throw invalid(child + " is not a child of " + node.id());
            }
            return node.withEntries(entries);
        }
        List<SemanticNode> items = new ArrayList<>(node.items());
        if (!items.removeIf(item -> item.id().equals(child))) {
            throw invalid(child + " is not a child of " + node.id());
        }
        return node.withItems(items);
    }

    private SemanticNode move(SemanticNode node, NodeId child, int index) {
        List<NodeId> order = new ArrayList<>();
        node.children().forEach(c -> order.add(c.id()));
        if (child == null || !order.remove(child)) {
            throw invalid(child + " is not a child of " + node.id());
        }
        if (index < 0 || index > order.size()) {
            throw invalid("Cannot move to index " + index + " of " + (order.size() + 1) + " entries");
        }
        order.add(index, child);
        return reorder(node, order);
    }

    private SemanticNode reorder(SemanticNode node, List<NodeId> order) {
        if (order.size() != node.children().size() || new HashSet<>(order).size() != order.size()) {
            throw invalid("New order names " + order.size() + " of " + node.children().size() + " entries");
        }
        if (node.kind() == SemanticKind.MAPPING) {
            List<Map.Entry<String, SemanticNode>> slots = new ArrayList<>();
            for (NodeId id : order) {
                slots.add(node.entries().entrySet().stream()
                        .filter(e -> e.getValue().id().equals(id))
                        .findFirst()
                        .orElseThrow(() -> invalid(id + " is not a child of " + node.id())));
            }
            return node.withEntries(toMap(slots));
        }
        List<SemanticNode> items = new ArrayList<>();
        Set<NodeId> known = new HashSet<>();
        node.items().forEach(item -> known.add(item.id()));
        for (NodeId id : order) {
            if (!known.contains(id)) {
                throw invalid(id + " is not a child of " + node.id());
            }
            node.items().stream().filter(item -> item.id().equals(id)).findFirst().ifPresent(items::add);
        }
        return node.withItems(items);
    }

    private static Map<String, SemanticNode> toMap(List<Map.Entry<String, SemanticNode>> slots) {
        Map<String, SemanticNode> result = new LinkedHashMap<>();
        slots.forEach(e -> result.put(e.getKey(), e.getValue()));
        return result;
    }

    private InvalidEditException invalid(String message) {
        return new InvalidEditException(message, location, operation);
    }
}
