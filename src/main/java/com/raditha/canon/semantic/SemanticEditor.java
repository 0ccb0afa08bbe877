package com.raditha.canon.semantic;

import com.raditha.canon.exceptions.InvalidEditException;
import com.raditha.canon.exceptions.SourceLocation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Copy-on-write editing of a semantic tree. Every operation replaces the nodes on the path from
 * the root to the edited node and shares everything else with the previous version. Edited nodes
 * keep their ids; new values get fresh ids.
 * <p>
 * The result is meant to be diffed against the tree the editor started from.
 */
public class SemanticEditor {

    private final String lineage;
    private SemanticNode root;

    public SemanticEditor(SemanticTree tree) {
        this.lineage = tree.lineage();
        this.root = tree.root();
    }

    /**
     * Replace the value at {@code path}. When the path names a missing key of an existing
     * mapping, the key is added.
     */
    public SemanticEditor set(String path, Object value) {
        return set(SemanticPath.parse(path), value);
    }

    public SemanticEditor set(SemanticPath path, Object value) {
        if (path.isRoot()) {
            root = SemanticValues.of(lineage, value).withId(root.id());
            return this;
        }
        SemanticPath.Segment last = path.last();
        root = update(root, path.parent(), 0, parent -> {
            if (last.isKey()) {
                requireKind(parent, SemanticKind.MAPPING, path, "set");
                Map<String, SemanticNode> entries = new LinkedHashMap<>(parent.entries());
                SemanticNode existing = entries.get(last.key());
                entries.put(last.key(), replacement(existing, value));
                return parent.withEntries(entries);
            }
            requireKind(parent, SemanticKind.SEQUENCE, path, "set");
            checkIndex(parent, last.index(), parent.items().size() - 1, path, "set");
            List<SemanticNode> items = new ArrayList<>(parent.items());
            items.set(last.index(), replacement(items.get(last.index()), value));
            return parent.withItems(items);
        });
        return this;
    }

    /**
     * Insert a value into the sequence at {@code path} before {@code index}.
     */
    public SemanticEditor insert(String path, int index, Object value) {
        SemanticPath sequencePath = SemanticPath.parse(path);
        root = update(root, sequencePath, 0, sequence -> {
            requireKind(sequence, SemanticKind.SEQUENCE, sequencePath, "insert");
            checkIndex(sequence, index, sequence.items().size(), sequencePath, "insert");
            List<SemanticNode> items = new ArrayList<>(sequence.items());
            items.add(index, SemanticValues.of(lineage, value));
            return sequence.withItems(items);
        });
        return this;
    }

    /**
     * Append a value to the sequence at {@code path}.
     */
    public SemanticEditor append(String path, Object value) {
        SemanticPath sequencePath = SemanticPath.parse(path);
        root = update(root, sequencePath, 0, sequence -> {
            requireKind(sequence, SemanticKind.SEQUENCE, sequencePath, "append");
            List<SemanticNode> items = new ArrayList<>(sequence.items());
            items.add(SemanticValues.of(lineage, value));
            return sequence.withItems(items);
        });
        return this;
    }

    /**
     * Remove the mapping entry or sequence item at {@code path}.
     */
    public SemanticEditor delete(String path) {
        SemanticPath target = SemanticPath.parse(path);
        if (target.isRoot()) {
            throw new InvalidEditException("The root cannot be deleted", SourceLocation.of("$"), "delete");
        }
        SemanticPath.Segment last = target.last();
        root = update(root, target.parent(), 0, parent -> {
            if (last.isKey()) {
                requireKind(parent, SemanticKind.MAPPING, target, "delete");
                if (!parent.entries().containsKey(last.key())) {
                    throw new InvalidEditException("No key '" + last.key() + "'", SourceLocation.of(target.toString()),
                            "delete");
                }
                Map<String, SemanticNode> entries = new LinkedHashMap<>(parent.entries());
                entries.remove(last.key());
                return parent.withEntries(entries);
            }
            requireKind(parent, SemanticKind.SEQUENCE, target, "delete");
            checkIndex(parent, last.index(), parent.items().size() - 1, target, "delete");
            List<SemanticNode> items = new ArrayList<>(parent.items());
            items.remove(last.index());
            return parent.withItems(items);
        });
        return this;
    }

    /**
     * Move an item of the sequence at {@code path} from one index to another; the item keeps its id.
     */
    public SemanticEditor move(String path, int from, int to) {
        SemanticPath sequencePath = SemanticPath.parse(path);
        root = update(root, sequencePath, 0, sequence -> {
            requireKind(sequence, SemanticKind.SEQUENCE, sequencePath, "move");
            int size = sequence.items().size();
            checkIndex(sequence, from, size - 1, sequencePath, "move");
            checkIndex(sequence, to, size - 1, sequencePath, "move");
            List<SemanticNode> items = new ArrayList<>(sequence.items());
            SemanticNode item = items.remove(from);
            items.add(to, item);
            return sequence.withItems(items);
        });
        return this;
    }

    /**
     * Reorder the entries of the mapping at {@code path}. Keys not listed keep their relative
     * order after the listed ones.
     */
    public SemanticEditor reorderKeys(String path, List<String> order) {
        SemanticPath mappingPath = SemanticPath.parse(path);
        root = update(root, mappingPath, 0, mapping -> {
            requireKind(mapping, SemanticKind.MAPPING, mappingPath, "reorder");
            Map<String, SemanticNode> entries = new LinkedHashMap<>();
            for (String key : order) {
                if (mapping.entries().containsKey(key)) {
                    entries.put(key, mapping.entries().get(key));
                }
            }
            mapping.entries().forEach(entries::putIfAbsent);
            return mapping.withEntries(entries);
        });
        return this;
    }

    public SemanticTree result() {
        return new SemanticTree(lineage, root);
    }

    private SemanticNode replacement(SemanticNode existing, Object value) {
        SemanticNode fresh = SemanticValues.of(lineage, value);
        return existing == null ? fresh : fresh.withId(existing.id());
    }

    private SemanticNode update(SemanticNode node, SemanticPath path, int depth, UnaryOperator<SemanticNode> change) {
        if (depth == path.depth()) {
            return change.apply(node);
        }
        SemanticPath.Segment segment = path.segments().get(depth);
        SemanticPath here = new SemanticPath(path.segments().subList(0, depth + 1));
        if (segment.isKey()) {
            SemanticNode child = node.kind() == SemanticKind.MAPPING ? node.entries().get(segment.key()) : null;
            if (child == null) {
                throw new InvalidEditException("No node at " + here, SourceLocation.of(here.toString()), "edit");
            }
            Map<String, SemanticNode> entries = new LinkedHashMap<>(node.entries());
            entries.put(segment.key(), update(child, path, depth + 1, change));
            return node.withEntries(entries);
        }
        if (node.kind() != SemanticKind.SEQUENCE || segment.index() >= node.items().size()) {
            throw new InvalidEditException("No node at " + here, SourceLocation.of(here.toString()), "edit");
        }
        List<SemanticNode> items = new ArrayList<>(node.items());
        items.set(segment.index(), update(items.get(segment.index()), path, depth + 1, change));
        return node.withItems(items);
    }

    private static void requireKind(SemanticNode node, SemanticKind kind, SemanticPath path, String operation) {
        if (node.kind() != kind) {
            throw new InvalidEditException("Expected a " + kind + " but found " + node.kind(),
                    SourceLocation.of(path.toString()), operation);
        }
    }

    private static void checkIndex(SemanticNode node, int index, int max, SemanticPath path, String operation) {
        if (index < 0 || index > max) {
            throw new InvalidEditException("Index " + index + " out of range 0.." + max,
                    SourceLocation.of(path.toString()), operation);
        }
    }
}
