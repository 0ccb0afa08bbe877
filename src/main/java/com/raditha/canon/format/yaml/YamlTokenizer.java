package com.raditha.canon.format.yaml;

import com.raditha.canon.cst.Layout;
import com.raditha.canon.cst.LineMap;
import com.raditha.canon.cst.NodeStyle;
import com.raditha.canon.cst.QuoteStyle;
import com.raditha.canon.cst.Token;
import com.raditha.canon.exceptions.ParseException;
import com.raditha.canon.exceptions.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-pass scanner for the supported YAML subset. Emits a contiguous token stream:
 * indicators ({@code "- "}, {@code ": "}, {@code ","}), whitespace and comments are emitted as
 * trivia, block containers get empty open and close tokens.
 * <p>
 * A block container opens at the start of the line holding its first entry, before the
 * indentation, so the line break after {@code key:} leads the container and every entry's
 * leading trivia ends with its own indentation.
 */
final class YamlTokenizer {

    private static final String RESERVED = "%@`";

    private final String src;
    private final LineMap lines;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;
    private boolean documentStarted;

    YamlTokenizer(String src) {
        this.src = src;
        this.lines = LineMap.of(src);
    }

    List<Token> tokenize() {
        int content = nextContent(0, true);
        if (content < 0) {
            emitTriviaTo(src.length());
            tokens.add(Token.scalar("", pos, NodeStyle.scalar(QuoteStyle.PLAIN, Layout.BLOCK, 0)));
            return tokens;
        }
        parseBlockNode(-1, content, true);
        int next = nextContent(pos, false);
        if (next >= 0) {
            throw error("Unexpected content after the root node", next);
        }
        emitTriviaTo(src.length());
        return tokens;
    }

    // ---------------------------------------------------------------- block context

    private void parseBlockNode(int ownerIndent, int content, boolean allowCollections) {
        int col = column(content);
        if (isSequenceIndicator(content)) {
            if (!allowCollections) {
                throw error("Block sequence entries are not allowed here", content);
            }
            openBlockAt(content);
            parseBlockSequence(col);
            return;
        }
        if (allowCollections && isMappingKeyAt(content)) {
            openBlockAt(content);
            parseBlockMapping(col);
            return;
        }
        emitTriviaTo(content);
        parseInlineValue(ownerIndent);
        expectLineEnd();
    }

    private void openBlockAt(int content) {
        int at = hasLineBreak(pos, content) ? lineStart(content) : content;
        emitTriviaTo(at);
    }

    private void parseBlockMapping(int col) {
        tokens.add(Token.openMapping("", pos, NodeStyle.block(col)));
        while (true) {
            int content = nextContent(pos, false);
            emitTriviaTo(content);
            scanBlockKey(col);
            int colon = skipSpaces(pos);
            if (colon >= src.length() || src.charAt(colon) != ':') {
                throw error("Expected ':' after mapping key", colon);
            }
            emitTriviaTo(colon + 1);

            int value = nextContent(pos, false);
            if (value >= 0 && !hasLineBreak(pos, value)) {
                parseBlockNode(col, value, false);
            } else if (value >= 0 && (column(value) > col
                    || (column(value) == col && isSequenceIndicator(value)))) {
                parseBlockNode(col, value, true);
            } else {
                tokens.add(Token.scalar("", pos, NodeStyle.scalar(QuoteStyle.PLAIN, Layout.BLOCK, col)));
            }

            int next = nextContent(pos, false);
            if (next < 0 || column(next) < col) {
                break;
            }
            if (column(next) > col) {
                throw error("Bad indentation of a mapping entry", next);
            }
            if (isSequenceIndicator(next)) {
                throw error("Sequence entry where a mapping key was expected", next);
            }
        }
        closeBlock();
    }

    private void parseBlockSequence(int col) {
        tokens.add(Token.openSequence("", pos, NodeStyle.block(col)));
        while (true) {
            int dash = nextContent(pos, false);
            emitTriviaTo(dash + 1);

            int value = nextContent(pos, false);
            if (value >= 0 && (!hasLineBreak(pos, value) || column(value) > col)) {
                parseBlockNode(col, value, true);
            } else {
                tokens.add(Token.scalar("", pos, NodeStyle.scalar(QuoteStyle.PLAIN, Layout.BLOCK, col)));
            }

            int next = nextContent(pos, false);
            if (next < 0 || column(next) < col) {
                break;
            }
            if (column(next) > col) {
                throw error("Bad indentation of a sequence entry", next);
            }
            if (!isSequenceIndicator(next)) {
                // key of the enclosing mapping, written at the same column
                break;
            }
        }
        closeBlock();
    }

    private void closeBlock() {
        if (pos > 0 && src.charAt(pos - 1) != '\n') {
            int eol = src.indexOf('\n', pos);
            if (eol >= 0) {
                emitTriviaTo(eol + 1);
            }
        }
        tokens.add(Token.close("", pos));
    }

    private void scanBlockKey(int col) {
        char ch = src.charAt(pos);
        int end;
        QuoteStyle quote = QuoteStyle.PLAIN;
        if (ch == '"' || ch == '\'') {
            end = scanQuoted(pos);
            if (hasLineBreak(pos, end)) {
                throw error("Multi-line keys are not supported", pos);
            }
            quote = ch == '"' ? QuoteStyle.DOUBLE : QuoteStyle.SINGLE;
        } else {
            end = pos;
            while (end < src.length()) {
                char c = src.charAt(end);
                if (c == '\n' || c == '\r' || (c == ':' && isBlankAt(end + 1))) {
                    break;
                }
                end++;
            }
            while (end > pos && isSpace(src.charAt(end - 1))) {
                end--;
            }
        }
        emitScalar(end, quote, Layout.BLOCK, col);
    }

    private void parseInlineValue(int ownerIndent) {
        char ch = src.charAt(pos);
        int col = column(pos);
        if (ch == '"' || ch == '\'') {
            emitScalar(scanQuoted(pos), ch == '"' ? QuoteStyle.DOUBLE : QuoteStyle.SINGLE, Layout.BLOCK, col);
        } else if (ch == '[' || ch == '{') {
            parseFlowCollection();
        } else if (ch == '|' || ch == '>') {
            emitOpaque(indentedBlockEnd(lineContentEnd(pos, true), ownerIndent), col);
        } else if (ch == '&' || ch == '*' || ch == '!') {
            emitOpaque(indentedBlockEnd(lineContentEnd(pos, false), ownerIndent), col);
        } else if (ch == '?' && isBlankAt(pos + 1)) {
            throw error("Explicit mapping keys are not supported", pos);
        } else if (RESERVED.indexOf(ch) >= 0) {
            throw error("Reserved indicator '" + ch + "' cannot start a plain scalar", pos);
        } else {
            emitScalar(scanPlainBlock(ownerIndent), QuoteStyle.PLAIN, Layout.BLOCK, col);
        }
    }

    private int scanPlainBlock(int ownerIndent) {
        int end = scanPlainLine(pos);
        while (true) {
            int nl = src.indexOf('\n', end);
            if (nl < 0 || !src.substring(end, nl).isBlank()) {
                return end;
            }
            int next = nl + 1;
            int firstChar = -1;
            while (next < src.length()) {
                int eol = src.indexOf('\n', next);
                int lineEnd = eol < 0 ? src.length() : eol;
                int c = skipSpaces(next);
                if (c < lineEnd && src.charAt(c) != '\r') {
                    firstChar = c;
                    break;
                }
                if (eol < 0) {
                    break;
                }
                next = eol + 1;
            }
            if (firstChar < 0 || column(firstChar) <= ownerIndent || src.charAt(firstChar) == '#'
                    || isDocumentMarker(firstChar)) {
                return end;
            }
            checkIndentation(firstChar);
            int lineEnd = scanPlainLine(firstChar);
            if (lineEnd == firstChar) {
                return end;
            }
            end = lineEnd;
        }
    }

    private int scanPlainLine(int start) {
        int i = start;
        while (i < src.length()) {
            char c = src.charAt(i);
            if (c == '\n' || c == '\r') {
                break;
            }
            if (c == ':' && isBlankAt(i + 1)) {
                throw error("Mapping values are not allowed here", i);
            }
            if (c == '#' && i > start && isSpace(src.charAt(i - 1))) {
                break;
            }
            i++;
        }
        while (i > start && isSpace(src.charAt(i - 1))) {
            i--;
        }
        return i;
    }

    /**
     * End of the content on the line starting at {@code start}, before any comment.
     */
    private int lineContentEnd(int start, boolean keepComment) {
        int eol = src.indexOf('\n', start);
        int end = eol < 0 ? src.length() : eol;
        if (!keepComment) {
            for (int i = start + 1; i < end; i++) {
                if (src.charAt(i) == '#' && isSpace(src.charAt(i - 1))) {
                    end = i;
                    break;
                }
            }
        }
        while (end > start && (isSpace(src.charAt(end - 1)) || src.charAt(end - 1) == '\r')) {
            end--;
        }
        return end;
    }

    /**
     * Extends an unsupported construct over the following lines indented deeper than its owner.
     * Blank lines inside are kept, trailing blank lines are not.
     */
    private int indentedBlockEnd(int firstLineEnd, int ownerIndent) {
        int end = firstLineEnd;
        int lineStart = src.indexOf('\n', firstLineEnd);
        while (lineStart >= 0 && lineStart + 1 <= src.length()) {
            int start = lineStart + 1;
            int eol = src.indexOf('\n', start);
            int lineEnd = eol < 0 ? src.length() : eol;
            int c = skipSpaces(start);
            boolean blank = c >= lineEnd || src.charAt(c) == '\r';
            if (!blank) {
                if (column(c) <= ownerIndent || isDocumentMarker(c)) {
                    break;
                }
                end = lineContentEnd(start, true);
            }
            if (eol < 0) {
                break;
            }
            lineStart = eol;
        }
        return end;
    }

    // ---------------------------------------------------------------- flow context

    private void parseFlowCollection() {
        char open = src.charAt(pos);
        boolean mapping = open == '{';
        char close = mapping ? '}' : ']';
        NodeStyle style = NodeStyle.flow(column(pos));
        tokens.add(mapping ? Token.openMapping("{", pos, style) : Token.openSequence("[", pos, style));
        pos++;
        while (true) {
            int c = flowContent(pos);
            if (src.charAt(c) == close) {
                emitTriviaTo(c);
                tokens.add(Token.close(String.valueOf(close), c));
                pos = c + 1;
                return;
            }
            emitTriviaTo(c);
            if (mapping) {
                parseFlowEntry(close);
            } else {
                parseFlowNode();
            }
            int separator = flowContent(pos);
            char s = src.charAt(separator);
            if (s == ',') {
                emitTriviaTo(separator + 1);
            } else if (s == ':' && !mapping) {
                throw error("Key/value pairs inside flow sequences are not supported", separator);
            } else if (s != close) {
                throw error("Expected ',' or '" + close + "' in flow collection", separator);
            }
        }
    }

    private void parseFlowEntry(char close) {
        char ch = src.charAt(pos);
        int col = column(pos);
        if (ch == '"' || ch == '\'') {
            emitScalar(scanQuoted(pos), ch == '"' ? QuoteStyle.DOUBLE : QuoteStyle.SINGLE, Layout.FLOW, col);
        } else {
            int end = scanPlainFlow(pos);
            if (end == pos) {
                throw error("Expected a key in flow mapping", pos);
            }
            emitScalar(end, QuoteStyle.PLAIN, Layout.FLOW, col);
        }
        int colon = flowContent(pos);
        if (src.charAt(colon) != ':') {
            throw error("Expected ':' after flow mapping key", colon);
        }
        emitTriviaTo(colon + 1);
        int value = flowContent(pos);
        char v = src.charAt(value);
        if (v == ',' || v == close) {
            tokens.add(Token.scalar("", pos, NodeStyle.scalar(QuoteStyle.PLAIN, Layout.FLOW, col)));
            return;
        }
        emitTriviaTo(value);
        parseFlowNode();
    }

    private void parseFlowNode() {
        char ch = src.charAt(pos);
        int col = column(pos);
        if (ch == '[' || ch == '{') {
            parseFlowCollection();
        } else if (ch == '"' || ch == '\'') {
            emitScalar(scanQuoted(pos), ch == '"' ? QuoteStyle.DOUBLE : QuoteStyle.SINGLE, Layout.FLOW, col);
        } else if (ch == '&' || ch == '*' || ch == '!') {
            int end = pos;
            while (end < src.length() && ",[]{}\n\r".indexOf(src.charAt(end)) < 0) {
                end++;
            }
            while (end > pos && isSpace(src.charAt(end - 1))) {
                end--;
            }
            emitOpaque(end, col);
        } else if (RESERVED.indexOf(ch) >= 0) {
            throw error("Reserved indicator '" + ch + "' cannot start a plain scalar", pos);
        } else {
            int end = scanPlainFlow(pos);
            if (end == pos) {
                throw error("Empty entry in flow collection", pos);
            }
            emitScalar(end, QuoteStyle.PLAIN, Layout.FLOW, col);
        }
    }

    private int scanPlainFlow(int start) {
        int i = start;
        while (i < src.length()) {
            char c = src.charAt(i);
            if (c == '\n' || c == '\r' || ",[]{}".indexOf(c) >= 0) {
                break;
            }
            if (c == ':' && (isBlankAt(i + 1) || ",[]{}".indexOf(src.charAt(i + 1)) >= 0)) {
                break;
            }
            if (c == '#' && i > start && isSpace(src.charAt(i - 1))) {
                break;
            }
            i++;
        }
        while (i > start && isSpace(src.charAt(i - 1))) {
            i--;
        }
        return i;
    }

    private int flowContent(int from) {
        int i = from;
        while (i < src.length()) {
            char c = src.charAt(i);
            if (isSpace(c) || c == '\n' || c == '\r') {
                i++;
            } else if (c == '#' && (i == 0 || isWhitespace(src.charAt(i - 1)))) {
                int eol = src.indexOf('\n', i);
                i = eol < 0 ? src.length() : eol;
            } else {
                return i;
            }
        }
        throw error("Unterminated flow collection", src.length());
    }

    // ---------------------------------------------------------------- shared scanning

    private int scanQuoted(int start) {
        char quote = src.charAt(start);
        int i = start + 1;
        while (i < src.length()) {
            char c = src.charAt(i);
            if (quote == '"' && c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                if (quote == '\'' && i + 1 < src.length() && src.charAt(i + 1) == '\'') {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        throw error("Unterminated quoted scalar", start);
    }

    /**
     * Position of the next non-trivia character at or after {@code from}, or -1 at the end of input.
     */
    private int nextContent(int from, boolean preamble) {
        int i = from;
        while (i < src.length()) {
            char c = src.charAt(i);
            if (i == 0 && c == '\uFEFF') {
                i++;
            } else if (isSpace(c) || c == '\n' || c == '\r') {
                i++;
            } else if (c == '#' && (i == 0 || isWhitespace(src.charAt(i - 1)))) {
                int eol = src.indexOf('\n', i);
                i = eol < 0 ? src.length() : eol;
            } else if (isDocumentMarker(i)) {
                if (!preamble || documentStarted || src.startsWith("...", i)) {
                    throw error("Multi-document streams are not supported", i);
                }
                documentStarted = true;
                int end = lineContentEnd(i + 3, false);
                if (end > i + 3) {
                    throw error("Content on the document start line is not supported", i + 3);
                }
                i += 3;
            } else if (preamble && c == '%' && column(i) == 0) {
                throw error("Directives are not supported", i);
            } else {
                checkIndentation(i);
                return i;
            }
        }
        return -1;
    }

    private void expectLineEnd() {
        int i = skipSpaces(pos);
        if (i >= src.length() || src.charAt(i) == '\n' || src.charAt(i) == '\r') {
            return;
        }
        if (src.charAt(i) == '#' && i > pos) {
            return;
        }
        throw error("Unexpected content after value", i);
    }

    private boolean isMappingKeyAt(int start) {
        char ch = src.charAt(start);
        int i;
        if (ch == '"' || ch == '\'') {
            int end;
            try {
                end = scanQuoted(start);
            } catch (ParseException e) {
                return false;
            }
            i = skipSpaces(end);
            return i < src.length() && src.charAt(i) == ':' && isBlankAt(i + 1);
        }
        if ("[{&*!|>#?".indexOf(ch) >= 0 || RESERVED.indexOf(ch) >= 0) {
            return false;
        }
        for (i = start; i < src.length(); i++) {
            char c = src.charAt(i);
            if (c == '\n') {
                return false;
            }
            if (c == ':' && isBlankAt(i + 1)) {
                return true;
            }
            if (c == '#' && i > start && isSpace(src.charAt(i - 1))) {
                return false;
            }
        }
        return false;
    }

    private boolean isSequenceIndicator(int at) {
        return src.charAt(at) == '-' && isBlankAt(at + 1);
    }

    private boolean isDocumentMarker(int at) {
        return column(at) == 0 && (src.startsWith("---", at) || src.startsWith("...", at)) && isBlankAt(at + 3);
    }

    private void checkIndentation(int content) {
        int start = lineStart(content);
        for (int i = start; i < content; i++) {
            char c = src.charAt(i);
            if (c == '\t') {
                throw error("Tabs are not allowed in indentation", i);
            }
            if (c != ' ') {
                return;
            }
        }
    }

    /** True at end of input or when the character is a space, tab or line break. */
    private boolean isBlankAt(int at) {
        return at >= src.length() || isWhitespace(src.charAt(at));
    }

    private static boolean isSpace(char c) {
        return c == ' ' || c == '\t';
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r';
    }

    private int skipSpaces(int from) {
        int i = from;
        while (i < src.length() && isSpace(src.charAt(i))) {
            i++;
        }
        return i;
    }

    private boolean hasLineBreak(int from, int to) {
        int nl = src.indexOf('\n', from);
        return nl >= 0 && nl < to;
    }

    private int lineStart(int offset) {
        return src.lastIndexOf('\n', offset - 1) + 1;
    }

    private int column(int offset) {
        return offset - lineStart(offset);
    }

    private void emitTriviaTo(int end) {
        if (end > pos) {
            tokens.add(Token.trivia(src.substring(pos, end), pos));
            pos = end;
        }
    }

    private void emitScalar(int end, QuoteStyle quote, Layout layout, int col) {
        tokens.add(Token.scalar(src.substring(pos, end), pos, NodeStyle.scalar(quote, layout, col)));
        pos = end;
    }

    private void emitOpaque(int end, int col) {
        tokens.add(Token.opaque(src.substring(pos, end), pos, NodeStyle.block(col)));
        pos = end;
    }

    private ParseException error(String message, int offset) {
        int at = Math.min(offset, src.length());
        return new ParseException(message, new SourceLocation("$", lines.line(at), lines.column(at)),
                YamlGrammar.NAME);
    }
}
