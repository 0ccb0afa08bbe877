package com.raditha.canon.semantic;

import java.util.UUID;

/**
 * Stable identity of a semantic node. Unique within a lineage, the family of documents derived
 * from one parse. Nodes backed by the source text are named after their syntax node, so
 * re-normalizing an unedited subtree yields the same ids.
 *
 * @param lineage lineage of the document the node belongs to
 * @param local   id within the lineage
 */
public record NodeId(String lineage, String local) {

    public NodeId {
        if (lineage == null || lineage.isEmpty()) {
            throw new IllegalArgumentException("lineage cannot be empty");
        }
        if (local == null || local.isEmpty()) {
            throw new IllegalArgumentException("local id cannot be empty");
        }
    }

    /**
     * Id of the semantic node backed by a syntax node.
     */
    public static NodeId backed(String lineage, int cstNodeId) {
        return new NodeId(lineage, "c" + cstNodeId);
    }

    /**
     * Id of a node created by an edit, unrelated to any source text.
     */
    public static NodeId fresh(String lineage) {
        return new NodeId(lineage, "n" + UUID.randomUUID());
    }

    /**
     * Deterministic id of a synthetic child, derived from its parent and key.
     */
    public NodeId child(String key) {
        return new NodeId(lineage, local + "/" + key);
    }

    @Override
    public String toString() {
        return local;
    }
}
