package com.raditha.canon.cst;

import com.raditha.canon.exceptions.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable staging area for building a new tree from an existing one. Nodes stay immutable; the
 * working copy only records which node object an id points to now. Unchanged nodes are read from
 * the source tree, which is never modified, and {@link #freeze()} stores just the recorded changes
 * on top of it.
 * <p>
 * Changes are journaled so a caller can roll back to a checkpoint, which the patch-back engine
 * uses to keep a failed edit from leaking into the result.
 */
public final class CstWorkingCopy implements NodeLookup {

    private final ConcreteSyntaxTree origin;
    /** Nodes written or removed; a null value marks a removed node. */
    private final Map<Integer, CstNode> changes = new HashMap<>();
    private final List<Change> journal = new ArrayList<>();
    private int nextId;

    private record Change(int id, boolean touched, CstNode previous, int previousNextId) {
    }

    CstWorkingCopy(ConcreteSyntaxTree origin) {
        this.origin = origin;
        this.nextId = origin.nextId();
    }

    private CstNode lookup(int id) {
        if (changes.containsKey(id)) {
            return changes.get(id);
        }
        return origin.nodeOrNull(id);
    }

    @Override
    public CstNode node(int id) {
        CstNode node = lookup(id);
        if (node == null) {
            throw new IllegalArgumentException("No node " + id + " in working copy of " + origin.lineage());
        }
        return node;
    }

    @Override
    public boolean contains(int id) {
        return lookup(id) != null;
    }

    @Override
    public int rootId() {
        return origin.rootId();
    }

    public String lineage() {
        return origin.lineage();
    }

    public String grammar() {
        return origin.grammar();
    }

    public String lineBreak() {
        return origin.lineBreak();
    }

    public int allocateId() {
        journal.add(new Change(-1, false, null, nextId));
        return nextId++;
    }

    public void put(CstNode node) {
        record(node.id());
        changes.put(node.id(), node);
    }

    public void remove(int id) {
        if (contains(id)) {
            record(id);
            changes.put(id, null);
        }
    }

    private void record(int id) {
        journal.add(new Change(id, changes.containsKey(id), changes.get(id), nextId));
    }

    /**
     * Remove a node and all its descendants. The parent's child list is left to the caller.
     */
    public void removeSubtree(int id) {
        for (int descendant : subtree(id)) {
            remove(descendant);
        }
    }

    public void replaceChildren(int parentId, List<Integer> children) {
        put(node(parentId).withChildren(children));
    }

    /**
     * Ids of the nodes written or removed so far.
     */
    public Set<Integer> changedIds() {
        return Collections.unmodifiableSet(new HashSet<>(changes.keySet()));
    }

    public int checkpoint() {
        return journal.size();
    }

    public void rollback(int checkpoint) {
        for (int i = journal.size() - 1; i >= checkpoint; i--) {
            Change change = journal.remove(i);
            if (change.id() >= 0) {
                if (change.touched()) {
                    changes.put(change.id(), change.previous());
                } else {
                    changes.remove(change.id());
                }
            }
            nextId = change.previousNextId();
        }
    }

    public SourceLocation locate(int id) {
        return ConcreteSyntaxTree.locate(this, origin.lineMap(), id, pathOf(id));
    }

    public SourceLocation locate(int id, String path) {
        return ConcreteSyntaxTree.locate(this, origin.lineMap(), id, path);
    }

    public ConcreteSyntaxTree freeze() {
        return origin.derive(changes, nextId);
    }
}
