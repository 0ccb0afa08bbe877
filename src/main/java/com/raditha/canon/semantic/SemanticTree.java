package com.raditha.canon.semantic;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The canonical view of a document: a tree of {@link SemanticNode}s with an index by id.
 * Immutable.
 */
public final class SemanticTree {

    private final String lineage;
    private final SemanticNode root;
    private final Map<NodeId, SemanticNode> index = new HashMap<>();
    private final Map<NodeId, NodeId> parents = new HashMap<>();
    private final Map<NodeId, SemanticPath> paths = new HashMap<>();

    public SemanticTree(String lineage, SemanticNode root) {
        this.lineage = lineage;
        this.root = root;
        register(root, null, SemanticPath.ROOT);
    }

    private void register(SemanticNode node, NodeId parent, SemanticPath path) {
        if (index.putIfAbsent(node.id(), node) != null) {
            throw new IllegalArgumentException("Duplicate semantic id " + node.id() + " at " + path);
        }
        if (parent != null) {
            parents.put(node.id(), parent);
        }
        paths.put(node.id(), path);
        if (node.kind() == SemanticKind.SEQUENCE) {
            for (int i = 0; i < node.items().size(); i++) {
                register(node.items().get(i), node.id(), path.child(i));
            }
        } else if (node.kind() == SemanticKind.MAPPING) {
            node.entries().forEach((key, value) -> register(value, node.id(), path.child(key)));
        }
    }

    public String lineage() {
        return lineage;
    }

    public SemanticNode root() {
        return root;
    }

    public Optional<SemanticNode> node(NodeId id) {
        return Optional.ofNullable(index.get(id));
    }

    public boolean contains(NodeId id) {
        return index.containsKey(id);
    }

    public Optional<SemanticNode> parentOf(NodeId id) {
        return Optional.ofNullable(parents.get(id)).map(index::get);
    }

    public Optional<SemanticPath> pathOf(NodeId id) {
        return Optional.ofNullable(paths.get(id));
    }

    /**
     * Key under which the node is stored in its parent mapping, if it is a mapping value.
     */
    public Optional<String> keyOf(NodeId id) {
        SemanticPath path = paths.get(id);
        if (path == null || path.isRoot() || !path.last().isKey()) {
            return Optional.empty();
        }
        return Optional.of(path.last().key());
    }

    public Optional<SemanticNode> find(SemanticPath path) {
        SemanticNode current = root;
        for (SemanticPath.Segment segment : path.segments()) {
            if (segment.isKey()) {
                if (current.kind() != SemanticKind.MAPPING || !current.entries().containsKey(segment.key())) {
                    return Optional.empty();
                }
                current = current.entries().get(segment.key());
            } else {
                if (current.kind() != SemanticKind.SEQUENCE || segment.index() >= current.items().size()) {
                    return Optional.empty();
                }
                current = current.items().get(segment.index());
            }
        }
        return Optional.of(current);
    }

    public Optional<SemanticNode> find(String path) {
        return find(SemanticPath.parse(path));
    }

    public int size() {
        return index.size();
    }

    /**
     * Start a copy-on-write edit of this tree.
     */
    public SemanticEditor edit() {
        return new SemanticEditor(this);
    }

    /**
     * Whether both trees denote the same data, ignoring ids, formatting and mapping order.
     */
    public boolean semanticallyEquals(SemanticTree other) {
        return root.equals(other.root);
    }

    @Override
    public String toString() {
        return "SemanticTree[" + lineage + "]" + root;
    }
}
