package com.raditha.canon.cst;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Assembles a {@link ConcreteSyntaxTree} from the token stream of a format grammar.
 * <p>
 * Trivia is attached to node boundaries rather than kept as separate nodes:
 * <ul>
 * <li>after a completed node that ends mid-line, trivia up to and including the first line break
 * becomes that node's trailing trivia;</li>
 * <li>mapping keys never take trailing trivia, so the key/value separator leads the value;</li>
 * <li>everything else waits and becomes the leading trivia of the next node;</li>
 * <li>trivia still waiting when a container closes is folded into the container's closing text;</li>
 * <li>trivia after the root node becomes the root's trailing trivia.</li>
 * </ul>
 * Tokens must cover the source contiguously.
 */
public class CstBuilder {

    private final String grammar;
    private final String lineage;

    private final Map<Integer, CstNode> nodes = new HashMap<>();
    private final Deque<Frame> stack = new ArrayDeque<>();
    private final StringBuilder pending = new StringBuilder();
    private int nextId;
    private int lastCompleted = CstNode.NO_PARENT;
    private int rootId = CstNode.NO_PARENT;
    private int position;
    private String source = "";

    private static final class Frame {
        final int id;
        final CstKind kind;
        final Token open;
        final Trivia leading;
        final List<Integer> children = new ArrayList<>();

        Frame(int id, CstKind kind, Token open, Trivia leading) {
            this.id = id;
            this.kind = kind;
            this.open = open;
            this.leading = leading;
        }
    }

    public CstBuilder(String grammar) {
        this(grammar, UUID.randomUUID().toString());
    }

    public CstBuilder(String grammar, String lineage) {
        this.grammar = grammar;
        this.lineage = lineage;
    }

    /**
     * Build a tree from a complete token stream.
     *
     * @param tokens tokens in source order
     * @param source the text the tokens were cut from
     * @return the assembled tree
     * @throws IllegalStateException if the stream is not a well-formed tree or does not cover the source
     */
    public ConcreteSyntaxTree build(List<Token> tokens, String source) {
        this.source = source;
        for (Token token : coalesceTrivia(tokens)) {
            if (token.offset() != position) {
                throw new IllegalStateException(grammar + " token " + token.type() + " starts at " + token.offset()
                        + " but the previous token ended at " + position);
            }
            position = token.end();
            switch (token.type()) {
                case TRIVIA -> acceptTrivia(token.text());
                case SCALAR -> completeLeaf(token, CstKind.SCALAR);
                case OPAQUE -> completeLeaf(token, CstKind.OPAQUE);
                case OPEN_SEQUENCE -> open(token, CstKind.SEQUENCE);
                case OPEN_MAPPING -> open(token, CstKind.MAPPING);
                case CLOSE -> close(token);
            }
        }
        if (!stack.isEmpty()) {
            throw new IllegalStateException(grammar + " token stream left " + stack.size() + " container(s) open");
        }
        if (rootId == CstNode.NO_PARENT) {
            throw new IllegalStateException(grammar + " token stream has no root node");
        }
        if (position != source.length()) {
            throw new IllegalStateException(grammar + " tokens cover " + position + " of " + source.length()
                    + " characters");
        }
        if (!pending.isEmpty()) {
            CstNode root = nodes.get(rootId);
            nodes.put(rootId, root.withTrailing(root.trailing().append(pending.toString())));
            pending.setLength(0);
        }
        return new ConcreteSyntaxTree(lineage, grammar, rootId, nodes, nextId, LineMap.of(source));
    }

    private static List<Token> coalesceTrivia(List<Token> tokens) {
        List<Token> result = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            if (token.type() == TokenType.TRIVIA) {
                if (token.text().isEmpty()) {
                    continue;
                }
                if (!result.isEmpty() && result.get(result.size() - 1).type() == TokenType.TRIVIA) {
                    Token previous = result.remove(result.size() - 1);
                    result.add(Token.trivia(previous.text() + token.text(), previous.offset()));
                    continue;
                }
            }
            result.add(token);
        }
        return result;
    }

    private void acceptTrivia(String text) {
        if (lastCompleted != CstNode.NO_PARENT) {
            int nl = text.indexOf('\n');
            if (nl >= 0) {
                CstNode node = nodes.get(lastCompleted);
                nodes.put(lastCompleted, node.withTrailing(node.trailing().append(text.substring(0, nl + 1))));
                lastCompleted = CstNode.NO_PARENT;
                pending.append(text, nl + 1, text.length());
                return;
            }
        }
        pending.append(text);
    }

    private Trivia takePending() {
        Trivia trivia = Trivia.of(pending.toString());
        pending.setLength(0);
        return trivia;
    }

    private int currentParent() {
        return stack.isEmpty() ? CstNode.NO_PARENT : stack.peek().id;
    }

    private void completeLeaf(Token token, CstKind kind) {
        int id = nextId++;
        Span span = new Span(token.offset(), token.end());
        CstNode node = kind == CstKind.OPAQUE
                ? CstNode.opaque(id, currentParent(), token.text(), token.style(), span)
                : CstNode.scalar(id, currentParent(), token.text(), token.style(), span);
        nodes.put(id, node.withLeading(takePending()));
        attach(id);
        lastCompleted = takesTrailing(id) ? id : CstNode.NO_PARENT;
    }

    private void open(Token token, CstKind kind) {
        if (stack.isEmpty() && rootId != CstNode.NO_PARENT) {
            throw new IllegalStateException(grammar + " token stream has more than one root node");
        }
        int id = nextId++;
        stack.push(new Frame(id, kind, token, takePending()));
        lastCompleted = CstNode.NO_PARENT;
    }

    private void close(Token token) {
        if (stack.isEmpty()) {
            throw new IllegalStateException(grammar + " CLOSE token at " + token.offset() + " without an open container");
        }
        Frame frame = stack.pop();
        String closing = pending + token.text();
        pending.setLength(0);
        Span span = new Span(frame.open.offset(), token.end());
        CstNode node = CstNode.container(frame.id, currentParent(), frame.kind, frame.open.text(), closing,
                frame.children, frame.open.style(), span).withLeading(frame.leading);
        nodes.put(frame.id, node);
        attach(frame.id);
        lastCompleted = takesTrailing(frame.id) ? frame.id : CstNode.NO_PARENT;
    }

    private boolean takesTrailing(int id) {
        if (position > 0 && position <= source.length() && source.charAt(position - 1) == '\n') {
            return false;
        }
        if (stack.isEmpty()) {
            return true;
        }
        Frame parent = stack.peek();
        boolean isKey = parent.kind == CstKind.MAPPING && parent.children.size() % 2 == 1;
        return !isKey;
    }

    private void attach(int id) {
        if (stack.isEmpty()) {
            if (rootId != CstNode.NO_PARENT) {
                throw new IllegalStateException(grammar + " token stream has more than one root node");
            }
            rootId = id;
        } else {
            stack.peek().children.add(id);
        }
    }
}
