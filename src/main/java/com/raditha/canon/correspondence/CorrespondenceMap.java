package com.raditha.canon.correspondence;

import com.raditha.canon.cst.CstKind;
import com.raditha.canon.cst.CstNode;
import com.raditha.canon.cst.NodeLookup;
import com.raditha.canon.cst.Span;
import com.raditha.canon.semantic.NodeId;
import com.raditha.canon.util.LayeredMap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Bidirectional index between the semantic tree and the concrete syntax tree of one document.
 * Immutable; every change goes through a {@link Builder}.
 * <p>
 * Entries are indexed by semantic id, by backing syntax node, by exact source span and, for
 * synthetic entries, by the syntax node of the mapping that hosts them. A map derived through a
 * builder shares these indexes with the map it came from and stores only the entries that changed.
 */
public final class CorrespondenceMap {

    private final String lineage;
    private final LayeredMap<NodeId, CorrespondenceEntry> bySemantic;
    private final LayeredMap<Integer, NodeId> byCst;
    private final LayeredMap<Span, NodeId> bySpan;
    private final LayeredMap<Integer, Set<NodeId>> syntheticByHost;

    private CorrespondenceMap(String lineage, LayeredMap<NodeId, CorrespondenceEntry> bySemantic,
                              LayeredMap<Integer, NodeId> byCst, LayeredMap<Span, NodeId> bySpan,
                              LayeredMap<Integer, Set<NodeId>> syntheticByHost) {
        this.lineage = lineage;
        this.bySemantic = bySemantic;
        this.byCst = byCst;
        this.bySpan = bySpan;
        this.syntheticByHost = syntheticByHost;
    }

    private static CorrespondenceMap empty(String lineage) {
        return new CorrespondenceMap(lineage, LayeredMap.empty(), LayeredMap.empty(), LayeredMap.empty(),
                LayeredMap.empty());
    }

    public static Builder builder(String lineage) {
        return new Builder(empty(lineage));
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public String lineage() {
        return lineage;
    }

    public Optional<CorrespondenceEntry> lookupBySemanticId(NodeId id) {
        return Optional.ofNullable(bySemantic.get(id));
    }

    public Optional<CorrespondenceEntry> lookupByCstNode(int cstNodeId) {
        return Optional.ofNullable(byCst.get(cstNodeId)).map(bySemantic::get);
    }

    /**
     * The entry whose backing node covers exactly {@code span}. When nested nodes share a span
     * the outermost one is returned.
     */
    public Optional<CorrespondenceEntry> lookupByCstSpan(Span span) {
        return Optional.ofNullable(bySpan.get(span)).map(bySemantic::get);
    }

    /**
     * Entries whose source span lies within {@code span}, outermost first. Scans every entry.
     */
    public List<CorrespondenceEntry> entriesWithin(Span span) {
        List<CorrespondenceEntry> result = new ArrayList<>();
        bySemantic.forEach((id, entry) -> {
            if (entry.span() != null && span.encloses(entry.span())) {
                result.add(entry);
            }
        });
        result.sort(Comparator.comparingInt((CorrespondenceEntry e) -> e.span().start())
                .thenComparing(e -> -e.span().length()));
        return result;
    }

    /**
     * Synthetic entries hosted by a mapping node, at any depth below it.
     */
    public List<CorrespondenceEntry> syntheticHostedBy(int hostCstId) {
        List<CorrespondenceEntry> result = new ArrayList<>();
        Set<NodeId> ids = syntheticByHost.get(hostCstId);
        if (ids != null) {
            for (NodeId id : ids) {
                result.add(bySemantic.get(id));
            }
        }
        return result;
    }

    public Collection<CorrespondenceEntry> entries() {
        return bySemantic.values();
    }

    public int size() {
        return bySemantic.size();
    }

    /**
     * Mark every entry backed by the node or one of its descendants stale, including synthetic
     * entries hosted by one of those nodes.
     */
    public CorrespondenceMap invalidate(NodeLookup tree, int cstNodeId) {
        Builder builder = toBuilder();
        builder.invalidate(tree, cstNodeId);
        return builder.build();
    }

    /**
     * Recompute ordinals and spans from a tree derived from the one this map was built for.
     * Entries keep their semantic ids; entries whose syntax node no longer exists are dropped.
     */
    public CorrespondenceMap reindex(NodeLookup tree) {
        Builder builder = toBuilder();
        bySemantic.forEach((id, entry) -> builder.refresh(tree, entry));
        return builder.build();
    }

    /**
     * Like {@link #reindex(NodeLookup)}, limited to the entries a set of changed syntax nodes can
     * affect: entries backed by or hosted by those nodes, and entries backed by their children.
     *
     * @param changedCstIds nodes written or removed since this map matched {@code tree}
     */
    public CorrespondenceMap reindex(NodeLookup tree, Collection<Integer> changedCstIds) {
        Builder builder = toBuilder();
        Set<NodeId> seen = new HashSet<>();
        for (int cstId : changedCstIds) {
            for (NodeId id : builder.anchoredAt(cstId)) {
                if (seen.add(id)) {
                    builder.get(id).ifPresent(entry -> builder.refresh(tree, entry));
                }
            }
            if (tree.contains(cstId)) {
                for (int child : tree.node(cstId).children()) {
                    NodeId id = byCst.get(child);
                    if (id != null && seen.add(id)) {
                        builder.get(id).ifPresent(entry -> builder.refresh(tree, entry));
                    }
                }
            }
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return "CorrespondenceMap[" + lineage + ", " + bySemantic.size() + " entries]";
    }

    /**
     * Mutable builder recording changes on top of a map, with an undo log so a failed edit can be
     * rolled back together with the syntax tree working copy.
     */
    public static final class Builder {

        private final CorrespondenceMap base;
        /** Entries written or removed; a null value marks a removed entry. */
        private final Map<NodeId, CorrespondenceEntry> changes = new LinkedHashMap<>();
        /** Syntax nodes that entries written here are anchored at; may hold ids since moved on. */
        private final Map<Integer, Set<NodeId>> changedAnchors = new HashMap<>();
        private final List<Change> journal = new ArrayList<>();

        private record Change(NodeId id, boolean touched, CorrespondenceEntry previous) {
        }

        private Builder(CorrespondenceMap base) {
            this.base = base;
        }

        public Builder put(CorrespondenceEntry entry) {
            record(entry.semanticId());
            changes.put(entry.semanticId(), entry);
            changedAnchors.computeIfAbsent(anchor(entry), k -> new LinkedHashSet<>()).add(entry.semanticId());
            return this;
        }

        public Builder remove(NodeId id) {
            if (get(id).isPresent()) {
                record(id);
                changes.put(id, null);
            }
            return this;
        }

        private void record(NodeId id) {
            journal.add(new Change(id, changes.containsKey(id), changes.get(id)));
        }

        public Optional<CorrespondenceEntry> get(NodeId id) {
            if (changes.containsKey(id)) {
                return Optional.ofNullable(changes.get(id));
            }
            return base.lookupBySemanticId(id);
        }

        /**
         * Ids of entries that were anchored at a syntax node, either backed by it or hosted by it,
         * before this builder or since.
         */
        private Set<NodeId> anchoredAt(int cstNodeId) {
            Set<NodeId> ids = new LinkedHashSet<>();
            NodeId backed = base.byCst.get(cstNodeId);
            if (backed != null) {
                ids.add(backed);
            }
            Set<NodeId> hosted = base.syntheticByHost.get(cstNodeId);
            if (hosted != null) {
                ids.addAll(hosted);
            }
            ids.addAll(changedAnchors.getOrDefault(cstNodeId, Set.of()));
            return ids;
        }

        /**
         * Entries hosted directly or indirectly by a syntax node: backed by it or a descendant, or
         * synthetic under one of those.
         */
        public List<CorrespondenceEntry> under(NodeLookup tree, int cstNodeId) {
            List<CorrespondenceEntry> result = new ArrayList<>();
            for (int id : tree.subtree(cstNodeId)) {
                for (NodeId candidate : anchoredAt(id)) {
                    get(candidate).filter(e -> anchor(e) == id).ifPresent(result::add);
                }
            }
            return result;
        }

        /**
         * The live entry backed by a syntax node, if any.
         */
        public Optional<CorrespondenceEntry> backedBy(int cstNodeId) {
            for (NodeId id : anchoredAt(cstNodeId)) {
                Optional<CorrespondenceEntry> entry = get(id)
                        .filter(e -> !e.isSynthetic() && !e.stale() && e.cstNodeId() == cstNodeId);
                if (entry.isPresent()) {
                    return entry;
                }
            }
            return Optional.empty();
        }

        /**
         * Current synthetic entries hosted by a syntax node: defaults of a mapping, or the
         * nodes of a structure held in a scalar.
         */
        public List<CorrespondenceEntry> syntheticHostedBy(int hostCstId) {
            List<CorrespondenceEntry> result = new ArrayList<>();
            for (NodeId id : anchoredAt(hostCstId)) {
                get(id).filter(e -> e.isSynthetic() && e.parentCstId() == hostCstId).ifPresent(result::add);
            }
            return result;
        }

        public Builder invalidate(NodeLookup tree, int cstNodeId) {
            for (CorrespondenceEntry entry : under(tree, cstNodeId)) {
                if (!entry.stale()) {
                    put(entry.markStale());
                }
            }
            return this;
        }

        /**
         * Brings one entry in line with {@code tree}: drops it when its node is gone, otherwise
         * updates its ordinal and span.
         */
        private void refresh(NodeLookup tree, CorrespondenceEntry entry) {
            if (entry.isSynthetic()) {
                if (entry.parentCstId() != CorrespondenceEntry.NO_NODE && !tree.contains(entry.parentCstId())) {
                    remove(entry.semanticId());
                }
                return;
            }
            if (!tree.contains(entry.cstNodeId())) {
                remove(entry.semanticId());
                return;
            }
            CstNode node = tree.node(entry.cstNodeId());
            int ordinal = entry.ordinal();
            if (node.parent() != CstNode.NO_PARENT) {
                CstNode parent = tree.node(node.parent());
                int index = parent.children().indexOf(node.id());
                ordinal = parent.kind() == CstKind.MAPPING ? index / 2 : index;
            }
            CorrespondenceEntry updated = entry.withOrdinal(ordinal, node.span());
            if (!updated.equals(entry)) {
                put(updated);
            }
        }

        public int checkpoint() {
            return journal.size();
        }

        public void rollback(int checkpoint) {
            for (int i = journal.size() - 1; i >= checkpoint; i--) {
                Change change = journal.remove(i);
                if (change.touched()) {
                    changes.put(change.id(), change.previous());
                } else {
                    changes.remove(change.id());
                }
            }
        }

        /**
         * The map with the recorded changes applied. Costs time in proportion to the changes.
         *
         * @throws IllegalArgumentException if two entries claim the same syntax node
         */
        public CorrespondenceMap build() {
            if (changes.isEmpty()) {
                return base;
            }
            Map<Integer, NodeId> cstChanges = new HashMap<>();
            Map<Span, NodeId> spanChanges = new HashMap<>();
            Map<Integer, Set<NodeId>> hostChanges = new HashMap<>();

            for (NodeId id : changes.keySet()) {
                CorrespondenceEntry old = base.bySemantic.get(id);
                if (old == null) {
                    continue;
                }
                if (old.isSynthetic()) {
                    Set<NodeId> hosted = new LinkedHashSet<>(current(hostChanges, base.syntheticByHost,
                            old.parentCstId(), Set.of()));
                    hosted.remove(id);
                    hostChanges.put(old.parentCstId(), hosted.isEmpty() ? null : Set.copyOf(hosted));
                } else {
                    if (id.equals(current(cstChanges, base.byCst, old.cstNodeId(), null))) {
                        cstChanges.put(old.cstNodeId(), null);
                    }
                    if (old.span() != null && id.equals(current(spanChanges, base.bySpan, old.span(), null))) {
                        spanChanges.put(old.span(), null);
                    }
                }
            }

            for (CorrespondenceEntry entry : changes.values()) {
                if (entry == null) {
                    continue;
                }
                NodeId id = entry.semanticId();
                if (entry.isSynthetic()) {
                    Set<NodeId> hosted = new LinkedHashSet<>(current(hostChanges, base.syntheticByHost,
                            entry.parentCstId(), Set.of()));
                    hosted.add(id);
                    hostChanges.put(entry.parentCstId(), Set.copyOf(hosted));
                    continue;
                }
                NodeId holder = current(cstChanges, base.byCst, entry.cstNodeId(), null);
                if (holder != null && !holder.equals(id)) {
                    throw new IllegalArgumentException("Syntax node " + entry.cstNodeId() + " backs both " + holder
                            + " and " + id);
                }
                cstChanges.put(entry.cstNodeId(), id);
                if (entry.span() != null && current(spanChanges, base.bySpan, entry.span(), null) == null) {
                    spanChanges.put(entry.span(), id);
                }
            }

            return new CorrespondenceMap(base.lineage, base.bySemantic.with(changes), base.byCst.with(cstChanges),
                    base.bySpan.with(spanChanges), base.syntheticByHost.with(hostChanges));
        }

        private static <K, V> V current(Map<K, V> pending, LayeredMap<K, V> index, K key, V fallback) {
            V value = pending.containsKey(key) ? pending.get(key) : index.get(key);
            return value != null ? value : fallback;
        }

        private static int anchor(CorrespondenceEntry entry) {
            return entry.isSynthetic() ? entry.parentCstId() : entry.cstNodeId();
        }
    }
}
