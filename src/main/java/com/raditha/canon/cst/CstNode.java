package com.raditha.canon.cst;

import java.util.List;
import java.util.Objects;

/**
 * One node of a concrete syntax tree. Immutable: every change produces a new node that keeps
 * the same id, so trees can share unchanged nodes by reference.
 * <p>
 * Scalars and opaque nodes keep their exact source spelling in {@link #literal()}. Containers keep
 * their opening delimiter there ({@code "["}, {@code "{"}, or empty for block layout) and their
 * closing delimiter, including any trivia right before it, in {@link #closing()}.
 */
public final class CstNode {

    public static final int NO_PARENT = -1;

    private final int id;
    private final int parent;
    private final CstKind kind;
    private final String literal;
    private final String closing;
    private final List<Integer> children;
    private final Trivia leading;
    private final Trivia trailing;
    private final NodeStyle style;
    private final Span span;

    private CstNode(int id, int parent, CstKind kind, String literal, String closing, List<Integer> children,
                    Trivia leading, Trivia trailing, NodeStyle style, Span span) {
        this.id = id;
        this.parent = parent;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.literal = literal == null ? "" : literal;
        this.closing = closing == null ? "" : closing;
        this.children = children == null ? List.of() : List.copyOf(children);
        this.leading = leading == null ? Trivia.EMPTY : leading;
        this.trailing = trailing == null ? Trivia.EMPTY : trailing;
        this.style = style == null ? NodeStyle.PLAIN : style;
        this.span = span;
        if (!kind.isContainer() && !this.children.isEmpty()) {
            throw new IllegalArgumentException(kind + " node " + id + " cannot have children");
        }
        if (kind == CstKind.MAPPING && this.children.size() % 2 != 0) {
            throw new IllegalArgumentException("Mapping node " + id + " has an unpaired key");
        }
    }

    public static CstNode scalar(int id, int parent, String literal, NodeStyle style, Span span) {
        return new CstNode(id, parent, CstKind.SCALAR, literal, "", List.of(), Trivia.EMPTY, Trivia.EMPTY, style, span);
    }

    public static CstNode opaque(int id, int parent, String literal, NodeStyle style, Span span) {
        return new CstNode(id, parent, CstKind.OPAQUE, literal, "", List.of(), Trivia.EMPTY, Trivia.EMPTY, style, span);
    }

    public static CstNode container(int id, int parent, CstKind kind, String open, String close,
                                    List<Integer> children, NodeStyle style, Span span) {
        if (!kind.isContainer()) {
            throw new IllegalArgumentException(kind + " is not a container kind");
        }
        return new CstNode(id, parent, kind, open, close, children, Trivia.EMPTY, Trivia.EMPTY, style, span);
    }

    public int id() {
        return id;
    }

    public int parent() {
        return parent;
    }

    public CstKind kind() {
        return kind;
    }

    public String literal() {
        return literal;
    }

    public String closing() {
        return closing;
    }

    public List<Integer> children() {
        return children;
    }

    public Trivia leading() {
        return leading;
    }

    public Trivia trailing() {
        return trailing;
    }

    public NodeStyle style() {
        return style;
    }

    /**
     * Content span in the text this node was parsed from; null for synthesized nodes.
     */
    public Span span() {
        return span;
    }

    public boolean isContainer() {
        return kind.isContainer();
    }

    public boolean isSynthesized() {
        return span == null;
    }

    /**
     * Number of slots: items of a sequence, key/value entries of a mapping.
     */
    public int slotCount() {
        return kind == CstKind.MAPPING ? children.size() / 2 : children.size();
    }

    public CstNode withLiteral(String newLiteral) {
        return new CstNode(id, parent, kind, newLiteral, closing, children, leading, trailing, style, span);
    }

    public CstNode withClosing(String newClosing) {
        return new CstNode(id, parent, kind, literal, newClosing, children, leading, trailing, style, span);
    }

    public CstNode withChildren(List<Integer> newChildren) {
        return new CstNode(id, parent, kind, literal, closing, newChildren, leading, trailing, style, span);
    }

    public CstNode withLeading(Trivia newLeading) {
        return new CstNode(id, parent, kind, literal, closing, children, newLeading, trailing, style, span);
    }

    public CstNode withTrailing(Trivia newTrailing) {
        return new CstNode(id, parent, kind, literal, closing, children, leading, newTrailing, style, span);
    }

    public CstNode withStyle(NodeStyle newStyle) {
        return new CstNode(id, parent, kind, literal, closing, children, leading, trailing, newStyle, span);
    }

    public CstNode withParent(int newParent) {
        return new CstNode(id, newParent, kind, literal, closing, children, leading, trailing, style, span);
    }

    /**
     * Same id and parent, everything else taken from {@code replacement}.
     */
    public CstNode replacedBy(CstNode replacement) {
        return new CstNode(id, parent, replacement.kind, replacement.literal, replacement.closing,
                replacement.children, replacement.leading, replacement.trailing, replacement.style, replacement.span);
    }

    @Override
    public String toString() {
        return kind + "#" + id + (kind.isContainer() ? children.toString() : "(" + literal + ")");
    }
}
