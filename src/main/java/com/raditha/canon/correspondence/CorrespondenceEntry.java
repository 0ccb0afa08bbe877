package com.raditha.canon.correspondence;

import com.raditha.canon.cst.Span;
import com.raditha.canon.normalization.RuleKind;
import com.raditha.canon.normalization.RuleTag;
import com.raditha.canon.semantic.NodeId;
import com.raditha.canon.semantic.SemanticKind;
import com.raditha.canon.semantic.SemanticNode;
import com.raditha.canon.semantic.SemanticPath;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Links one semantic node to the syntax node it was read from and the rule that read it.
 *
 * @param semanticId  the semantic node
 * @param cstNodeId   backing syntax node, or -1 for synthetic nodes
 * @param parentCstId syntax node of the enclosing collection, or -1 for the root
 * @param key         mapping key the node is stored under, null for sequence items and the root
 * @param path        semantic path of the node
 * @param rule        the rule that produced the value
 * @param ordinal     slot index in the enclosing collection
 * @param span        source span of the backing syntax node, null when there is none
 * @param stale       the backing text was changed by an edit and the entry may no longer be used
 * @param synthetic   the node was materialized from a default and claims no text
 */
public record CorrespondenceEntry(
        NodeId semanticId,
        int cstNodeId,
        int parentCstId,
        String key,
        SemanticPath path,
        RuleTag rule,
        int ordinal,
        Span span,
        boolean stale,
        boolean synthetic) {

    public static final int NO_NODE = -1;

    public CorrespondenceEntry {
        if (semanticId == null) {
            throw new IllegalArgumentException("semanticId cannot be null");
        }
        if (synthetic && cstNodeId != NO_NODE) {
            throw new IllegalArgumentException("Synthetic node " + semanticId + " cannot claim syntax node " + cstNodeId);
        }
        if (!synthetic && cstNodeId < 0) {
            throw new IllegalArgumentException("Node " + semanticId + " needs a backing syntax node");
        }
    }

    public static CorrespondenceEntry backed(NodeId semanticId, int cstNodeId, int parentCstId, String key,
                                             SemanticPath path, RuleTag rule, int ordinal, Span span) {
        return new CorrespondenceEntry(semanticId, cstNodeId, parentCstId, key, path, rule, ordinal, span, false, false);
    }

    public static CorrespondenceEntry synthetic(NodeId semanticId, int parentCstId, String key, SemanticPath path,
                                                RuleTag rule, int ordinal) {
        return new CorrespondenceEntry(semanticId, NO_NODE, parentCstId, key, path, rule, ordinal, null, false, true);
    }

    /**
     * Entries for the nodes below {@code value}, a structure read from the single scalar
     * {@code hostCstId}. They claim no text: an edit to any of them rewrites the host literal.
     */
    public static List<CorrespondenceEntry> embeddedBelow(SemanticNode value, int hostCstId, SemanticPath path) {
        List<CorrespondenceEntry> result = new ArrayList<>();
        addEmbedded(value, hostCstId, path, result);
        return result;
    }

    private static void addEmbedded(SemanticNode value, int hostCstId, SemanticPath path,
                                    List<CorrespondenceEntry> result) {
        if (value.kind() == SemanticKind.SEQUENCE) {
            for (int i = 0; i < value.items().size(); i++) {
                SemanticNode item = value.items().get(i);
                result.add(synthetic(item.id(), hostCstId, null, path.child(i), RuleTag.embedded(item.kind()), i));
                addEmbedded(item, hostCstId, path.child(i), result);
            }
        } else if (value.kind() == SemanticKind.MAPPING) {
            int i = 0;
            for (Map.Entry<String, SemanticNode> e : value.entries().entrySet()) {
                SemanticPath childPath = path.child(e.getKey());
                result.add(synthetic(e.getValue().id(), hostCstId, e.getKey(), childPath,
                        RuleTag.embedded(e.getValue().kind()), i++));
                addEmbedded(e.getValue(), hostCstId, childPath, result);
            }
        }
    }

    public boolean isSynthetic() {
        return synthetic;
    }

    /**
     * Whether the node sits inside a structure read from a single string literal.
     */
    public boolean isEmbedded() {
        return synthetic && rule != null && rule.kind() == RuleKind.EMBEDDED_JSON;
    }

    public CorrespondenceEntry markStale() {
        return new CorrespondenceEntry(semanticId, cstNodeId, parentCstId, key, path, rule, ordinal, span, true,
                synthetic);
    }

    public CorrespondenceEntry withOrdinal(int newOrdinal, Span newSpan) {
        return new CorrespondenceEntry(semanticId, cstNodeId, parentCstId, key, path, rule, newOrdinal, newSpan, stale,
                synthetic);
    }
}
