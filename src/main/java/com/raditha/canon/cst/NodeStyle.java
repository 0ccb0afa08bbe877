package com.raditha.canon.cst;

/**
 * Format-specific presentation flags of a node.
 *
 * @param quote  quoting of a scalar (PLAIN for containers)
 * @param layout block or flow
 * @param indent column (0-based) where the node's slot starts: the key column for mapping keys,
 *               the dash column for block sequence items, -1 when not meaningful
 */
public record NodeStyle(QuoteStyle quote, Layout layout, int indent) {

    public static final NodeStyle PLAIN = new NodeStyle(QuoteStyle.PLAIN, Layout.BLOCK, -1);

    public NodeStyle {
        if (quote == null) {
            quote = QuoteStyle.PLAIN;
        }
        if (layout == null) {
            layout = Layout.BLOCK;
        }
    }

    public static NodeStyle scalar(QuoteStyle quote, Layout layout, int indent) {
        return new NodeStyle(quote, layout, indent);
    }

    public static NodeStyle block(int indent) {
        return new NodeStyle(QuoteStyle.PLAIN, Layout.BLOCK, indent);
    }

    public static NodeStyle flow(int indent) {
        return new NodeStyle(QuoteStyle.PLAIN, Layout.FLOW, indent);
    }

    public NodeStyle withQuote(QuoteStyle newQuote) {
        return new NodeStyle(newQuote, layout, indent);
    }

    public NodeStyle withIndent(int newIndent) {
        return new NodeStyle(quote, layout, newIndent);
    }

    public NodeStyle withLayout(Layout newLayout) {
        return new NodeStyle(quote, newLayout, indent);
    }

    public boolean isFlow() {
        return layout == Layout.FLOW;
    }
}
