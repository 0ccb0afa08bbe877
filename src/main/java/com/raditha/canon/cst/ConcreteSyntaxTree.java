package com.raditha.canon.cst;

import com.raditha.canon.exceptions.SourceLocation;
import com.raditha.canon.util.LayeredMap;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An immutable concrete syntax tree: an arena of {@link CstNode}s indexed by integer id.
 * <p>
 * Every tree belongs to a lineage, fixed when the source was parsed and inherited by every tree
 * derived from it through patch-back. Node ids are unique within a lineage. A derived tree shares
 * the arena of the tree it came from and stores only the nodes that changed.
 */
public final class ConcreteSyntaxTree implements NodeLookup {

    private final String lineage;
    private final String grammar;
    private final int rootId;
    private final LayeredMap<Integer, CstNode> nodes;
    private final int nextId;
    private final LineMap lineMap;

    ConcreteSyntaxTree(String lineage, String grammar, int rootId, Map<Integer, CstNode> nodes,
                       int nextId, LineMap lineMap) {
        this(lineage, grammar, rootId, LayeredMap.of(nodes), nextId, lineMap);
    }

    private ConcreteSyntaxTree(String lineage, String grammar, int rootId, LayeredMap<Integer, CstNode> nodes,
                               int nextId, LineMap lineMap) {
        this.lineage = lineage;
        this.grammar = grammar;
        this.rootId = rootId;
        this.nodes = nodes;
        this.nextId = nextId;
        this.lineMap = lineMap;
        if (!this.nodes.containsKey(rootId)) {
            throw new IllegalArgumentException("Root node " + rootId + " is not part of the tree");
        }
    }

    public String lineage() {
        return lineage;
    }

    /**
     * Name of the grammar that produced the tree, e.g. {@code yaml}.
     */
    public String grammar() {
        return grammar;
    }

    @Override
    public int rootId() {
        return rootId;
    }

    public CstNode root() {
        return nodes.get(rootId);
    }

    @Override
    public CstNode node(int id) {
        CstNode node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("No node " + id + " in tree " + lineage);
        }
        return node;
    }

    @Override
    public boolean contains(int id) {
        return nodes.containsKey(id);
    }

    public List<CstNode> children(int id) {
        return childrenOf(id);
    }

    public Optional<CstNode> parent(int id) {
        return parentOf(id);
    }

    public Optional<Span> span(int id) {
        return Optional.ofNullable(node(id).span());
    }

    public int size() {
        return nodes.size();
    }

    int nextId() {
        return nextId;
    }

    /**
     * The node with the id, or null when there is none.
     */
    CstNode nodeOrNull(int id) {
        return nodes.get(id);
    }

    /**
     * A tree of the same lineage with {@code changes} applied; a null value removes its node.
     */
    ConcreteSyntaxTree derive(Map<Integer, CstNode> changes, int newNextId) {
        return new ConcreteSyntaxTree(lineage, grammar, rootId, nodes.with(changes), newNextId, lineMap);
    }

    LineMap lineMap() {
        return lineMap;
    }

    /**
     * Line terminator of the parsed source, used for every line written by an edit.
     */
    public String lineBreak() {
        return lineMap == null ? "\n" : lineMap.lineBreak();
    }

    /**
     * Path plus approximate source position of a node, for error messages. Synthesized nodes
     * report the position of their closest parsed ancestor.
     */
    public SourceLocation locate(int id) {
        return locate(this, lineMap, id, pathOf(id));
    }

    /**
     * Source position of a node, reported under a path the caller already knows.
     */
    public SourceLocation locate(int id, String path) {
        return locate(this, lineMap, id, path);
    }

    static SourceLocation locate(NodeLookup lookup, LineMap lineMap, int id, String path) {
        int current = id;
        while (current != CstNode.NO_PARENT && lookup.contains(current)) {
            Span span = lookup.node(current).span();
            if (span != null && lineMap != null) {
                return new SourceLocation(path, lineMap.line(span.start()), lineMap.column(span.start()));
            }
            current = lookup.node(current).parent();
        }
        return SourceLocation.of(path);
    }

    /**
     * Start a copy-on-write working copy of this tree.
     */
    public CstWorkingCopy edit() {
        return new CstWorkingCopy(this);
    }
}
