package com.raditha.canon.patch;

import com.raditha.canon.cst.CstKind;
import com.raditha.canon.cst.CstNode;
import com.raditha.canon.cst.CstWorkingCopy;
import com.raditha.canon.cst.Layout;
import com.raditha.canon.cst.NodeStyle;
import com.raditha.canon.cst.QuoteStyle;
import com.raditha.canon.cst.Trivia;
import com.raditha.canon.format.FormatProfile;
import com.raditha.canon.format.ScalarSyntax;
import com.raditha.canon.normalization.RenderContext;
import com.raditha.canon.normalization.RuleTag;
import com.raditha.canon.normalization.ScalarReader;
import com.raditha.canon.normalization.ScalarRenderer;
import com.raditha.canon.semantic.NodeId;
import com.raditha.canon.semantic.SemanticKind;
import com.raditha.canon.semantic.SemanticNode;
import com.raditha.canon.semantic.SemanticPath;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes new syntax subtrees for semantic values, in block or single-line flow layout, into a
 * working copy. Callers choose the id and the boundary trivia of the top node; everything below
 * it is laid out from the format profile.
 */
final class CstSynthesizer {

    /**
     * A semantic node that received text.
     */
    record Created(NodeId semanticId, int cstId, int parentCstId, String key, SemanticPath path,
                   SemanticNode value) {
    }

    private final CstWorkingCopy cst;
    private final FormatProfile profile;
    private final ScalarRenderer renderer;
    private final ScalarReader reader;
    private final List<Created> created = new ArrayList<>();

    CstSynthesizer(CstWorkingCopy cst, FormatProfile profile, ScalarRenderer renderer, ScalarReader reader) {
        this.cst = cst;
        this.profile = profile;
        this.renderer = renderer;
        this.reader = reader;
    }

    /**
     * Nodes written since the last call.
     */
    List<Created> drainCreated() {
        List<Created> result = List.copyOf(created);
        created.clear();
        return result;
    }

    static String spaces(int count) {
        return " ".repeat(Math.max(0, count));
    }

    String renderScalar(SemanticNode value, RuleTag tag, Layout layout, String key, SemanticPath path,
                        QuoteStyle quote) {
        return renderer.render(value, tag, new RenderContext(profile, layout, key, path, quote, reader));
    }

    /**
     * A scalar, or a collection written on one line in flow layout.
     */
    void flow(int id, int parent, SemanticNode value, String leading, String trailing, SemanticPath path, String key,
              QuoteStyle quote) {
        if (!value.isContainer()) {
            scalar(id, parent, value, leading, trailing, Layout.FLOW, path, key, quote);
            return;
        }
        List<Integer> children = new ArrayList<>();
        if (value.kind() == SemanticKind.MAPPING) {
            int i = 0;
            for (Map.Entry<String, SemanticNode> e : value.entries().entrySet()) {
                int keyId = cst.allocateId();
                key(keyId, id, e.getKey(), i == 0 ? "" : profile.flowSeparator(), Layout.FLOW);
                int valueId = cst.allocateId();
                flow(valueId, id, e.getValue(), profile.keyValueSeparator(), "", path.child(e.getKey()), e.getKey(),
                        quote);
                children.add(keyId);
                children.add(valueId);
                i++;
            }
        } else {
            List<SemanticNode> items = value.items();
            for (int i = 0; i < items.size(); i++) {
                int itemId = cst.allocateId();
                flow(itemId, id, items.get(i), i == 0 ? "" : profile.flowSeparator(), "", path.child(i), null, quote);
                children.add(itemId);
            }
        }
        boolean mapping = value.kind() == SemanticKind.MAPPING;
        CstNode node = CstNode.container(id, parent, mapping ? CstKind.MAPPING : CstKind.SEQUENCE,
                        mapping ? "{" : "[", mapping ? "}" : "]", children, NodeStyle.flow(-1), null)
                .withLeading(Trivia.of(leading))
                .withTrailing(Trivia.of(trailing));
        cst.put(node);
        created.add(new Created(value.id(), id, parent, key, path, value));
    }

    void scalar(int id, int parent, SemanticNode value, String leading, String trailing, Layout layout,
                SemanticPath path, String key, QuoteStyle quote) {
        String literal = renderScalar(value, null, layout, key, path, quote);
        CstNode node = value.kind() == SemanticKind.OPAQUE
                ? CstNode.opaque(id, parent, literal, NodeStyle.block(-1), null)
                : CstNode.scalar(id, parent, literal, NodeStyle.scalar(QuoteStyle.fromLiteral(literal), layout, -1),
                null);
        cst.put(node.withLeading(Trivia.of(leading)).withTrailing(Trivia.of(trailing)));
        created.add(new Created(value.id(), id, parent, key, path, value));
    }

    /**
     * A mapping key, in the profile's key quoting when the text allows it.
     */
    void key(int id, int parent, String text, String leading, Layout layout) {
        ScalarSyntax syntax = profile.syntax();
        QuoteStyle quote = profile.keyQuote();
        String literal;
        if (quote == QuoteStyle.PLAIN && !text.isEmpty() && syntax.canBePlain(text, layout)) {
            literal = text;
        } else {
            if (quote == QuoteStyle.PLAIN || !syntax.supports(quote, text)) {
                quote = syntax.supports(profile.fallbackQuote(), text) ? profile.fallbackQuote() : QuoteStyle.DOUBLE;
            }
            literal = syntax.encode(text, quote);
        }
        cst.put(CstNode.scalar(id, parent, literal, NodeStyle.scalar(quote, layout, -1), null)
                .withLeading(Trivia.of(leading)));
    }

    /**
     * The value of a block mapping entry whose key sits at column {@code keyIndent}.
     */
    void blockValue(int id, int parent, SemanticNode value, int keyIndent, SemanticPath path, String key,
                    QuoteStyle quote) {
        if (!value.isContainer() || value.children().isEmpty()) {
            inline(id, parent, value, profile.keyValueSeparator(), cst.lineBreak(), path, key, quote);
            return;
        }
        int indent = keyIndent + profile.indentUnit();
        String opener = profile.keyValueSeparator().stripTrailing() + cst.lineBreak();
        blockContainer(id, parent, value, indent, opener, false, path, key, quote);
    }

    /**
     * A block sequence item. {@code leading} holds the dash; nested content lines up with
     * {@code column}, the column after it.
     */
    void blockItem(int id, int parent, SemanticNode value, String leading, int column, SemanticPath path,
                   QuoteStyle quote) {
        if (!value.isContainer() || value.children().isEmpty()) {
            inline(id, parent, value, leading, cst.lineBreak(), path, null, quote);
            return;
        }
        blockContainer(id, parent, value, column, leading, true, path, null, quote);
    }

    /**
     * A non-empty collection in block layout with its entries at column {@code indent}. When
     * {@code compact} the first entry continues the line the leading trivia ends on.
     */
    void blockContainer(int id, int parent, SemanticNode value, int indent, String leading, boolean compact,
                        SemanticPath path, String key, QuoteStyle quote) {
        List<Integer> children = value.kind() == SemanticKind.MAPPING
                ? blockEntries(id, value, indent, compact ? "" : spaces(indent), path, quote)
                : blockItems(id, value, indent, compact ? "- " : spaces(indent) + "- ", path, quote);
        CstKind kind = value.kind() == SemanticKind.MAPPING ? CstKind.MAPPING : CstKind.SEQUENCE;
        cst.put(CstNode.container(id, parent, kind, "", "", children, NodeStyle.block(indent), null)
                .withLeading(Trivia.of(leading)));
        created.add(new Created(value.id(), id, parent, key, path, value));
    }

    List<Integer> blockEntries(int parent, SemanticNode mapping, int indent, String firstLeading, SemanticPath path,
                               QuoteStyle quote) {
        List<Integer> children = new ArrayList<>();
        for (Map.Entry<String, SemanticNode> e : mapping.entries().entrySet()) {
            int keyId = cst.allocateId();
            key(keyId, parent, e.getKey(), children.isEmpty() ? firstLeading : spaces(indent), Layout.BLOCK);
            int valueId = cst.allocateId();
            blockValue(valueId, parent, e.getValue(), indent, path.child(e.getKey()), e.getKey(), quote);
            children.add(keyId);
            children.add(valueId);
        }
        return children;
    }

    List<Integer> blockItems(int parent, SemanticNode sequence, int indent, String firstPrefix, SemanticPath path,
                             QuoteStyle quote) {
        List<Integer> children = new ArrayList<>();
        String prefix = spaces(indent) + "- ";
        List<SemanticNode> items = sequence.items();
        for (int i = 0; i < items.size(); i++) {
            int itemId = cst.allocateId();
            blockItem(itemId, parent, items.get(i), i == 0 ? firstPrefix : prefix, prefix.length(), path.child(i),
                    quote);
            children.add(itemId);
        }
        return children;
    }

    private void inline(int id, int parent, SemanticNode value, String leading, String trailing, SemanticPath path,
                        String key, QuoteStyle quote) {
        if (value.isContainer()) {
            flow(id, parent, value, leading, trailing, path, key, quote);
        } else {
            scalar(id, parent, value, leading, trailing, Layout.BLOCK, path, key, quote);
        }
    }
}
