package com.raditha.canon.format.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.raditha.canon.cst.Layout;
import com.raditha.canon.cst.LineMap;
import com.raditha.canon.cst.NodeStyle;
import com.raditha.canon.cst.QuoteStyle;
import com.raditha.canon.cst.Token;
import com.raditha.canon.exceptions.ParseException;
import com.raditha.canon.exceptions.SourceLocation;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Cuts a JSON document into CST tokens. Jackson's streaming parser validates the syntax and
 * drives the token sequence; the exact extent of each token is recovered from the source, since
 * everything between two JSON tokens is whitespace, a colon or a comma.
 */
final class JsonTokenizer {

    private static final JsonFactory FACTORY = new JsonFactory();

    private final String src;
    private final LineMap lines;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;

    JsonTokenizer(String src) {
        this.src = src;
        this.lines = LineMap.of(src);
    }

    List<Token> tokenize() {
        int depth = 0;
        boolean rootSeen = false;
        try (JsonParser parser = FACTORY.createParser(src)) {
            JsonToken token;
            while ((token = parser.nextToken()) != null) {
                int start = skipSeparators(pos);
                if (depth == 0 && rootSeen) {
                    throw error("Only one root value is allowed", start);
                }
                emitTriviaTo(start);
                int col = start - lineStart(start);
                switch (token) {
                    case START_OBJECT -> {
                        tokens.add(Token.openMapping("{", start, NodeStyle.flow(col)));
                        pos = start + 1;
                        depth++;
                    }
                    case START_ARRAY -> {
                        tokens.add(Token.openSequence("[", start, NodeStyle.flow(col)));
                        pos = start + 1;
                        depth++;
                    }
                    case END_OBJECT, END_ARRAY -> {
                        tokens.add(Token.close(src.substring(start, start + 1), start));
                        pos = start + 1;
                        depth--;
                    }
                    case FIELD_NAME, VALUE_STRING -> emitScalar(scanString(start), QuoteStyle.DOUBLE, col);
                    case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> emitScalar(scanNumber(start), QuoteStyle.PLAIN, col);
                    case VALUE_TRUE, VALUE_FALSE, VALUE_NULL ->
                            emitScalar(start + parser.getText().length(), QuoteStyle.PLAIN, col);
                    default -> throw error("Unsupported JSON token " + token, start);
                }
                if (depth == 0) {
                    rootSeen = true;
                }
            }
        } catch (JsonProcessingException e) {
            JsonLocation at = e.getLocation();
            SourceLocation location = at == null ? SourceLocation.UNKNOWN
                    : new SourceLocation("$", at.getLineNr(), at.getColumnNr());
            throw new ParseException(e.getOriginalMessage(), location, JsonGrammar.NAME, e);
        } catch (IOException e) {
            throw new ParseException("Could not read JSON source: " + e.getMessage(), SourceLocation.UNKNOWN,
                    JsonGrammar.NAME, e);
        }
        if (!rootSeen) {
            throw error("Empty JSON document", src.length());
        }
        emitTriviaTo(src.length());
        return tokens;
    }

    private int skipSeparators(int from) {
        int i = from;
        while (i < src.length() && " \t\r\n:,".indexOf(src.charAt(i)) >= 0) {
            i++;
        }
        return i;
    }

    private int scanString(int start) {
        if (src.charAt(start) != '"') {
            throw error("Expected a string", start);
        }
        int i = start + 1;
        while (i < src.length()) {
            char c = src.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == '"') {
                return i + 1;
            } else {
                i++;
            }
        }
        throw error("Unterminated string", start);
    }

    private int scanNumber(int start) {
        int i = start;
        while (i < src.length() && "+-0123456789.eE".indexOf(src.charAt(i)) >= 0) {
            i++;
        }
        return i;
    }

    private int lineStart(int offset) {
        return src.lastIndexOf('\n', offset - 1) + 1;
    }

    private void emitTriviaTo(int end) {
        if (end > pos) {
            tokens.add(Token.trivia(src.substring(pos, end), pos));
            pos = end;
        }
    }

    private void emitScalar(int end, QuoteStyle quote, int col) {
        tokens.add(Token.scalar(src.substring(pos, end), pos, NodeStyle.scalar(quote, Layout.FLOW, col)));
        pos = end;
    }

    private ParseException error(String message, int offset) {
        int at = Math.min(offset, src.length());
        return new ParseException(message, new SourceLocation("$", lines.line(at), lines.column(at)),
                JsonGrammar.NAME);
    }
}
