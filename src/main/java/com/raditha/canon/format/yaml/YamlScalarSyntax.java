package com.raditha.canon.format.yaml;

import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.raditha.canon.cst.Layout;
import com.raditha.canon.cst.QuoteStyle;
import com.raditha.canon.format.ScalarSyntax;

/**
 * Quoting and line folding rules of YAML flow scalars.
 */
public class YamlScalarSyntax implements ScalarSyntax {

    private static final String FLOW_INDICATORS = ",[]{}";
    private static final String LEADING_INDICATORS = ",[]{}#&*!|>'\"%@`";

    @Override
    public String decode(String literal, QuoteStyle quote) {
        return switch (quote) {
            case PLAIN -> fold(literal);
            case SINGLE -> fold(strip(literal, '\'')).replace("''", "'");
            case DOUBLE -> unescapeDouble(strip(literal, '"'));
        };
    }

    @Override
    public String encode(String text, QuoteStyle quote) {
        return switch (quote) {
            case PLAIN -> text;
            case SINGLE -> "'" + text.replace("'", "''") + "'";
            case DOUBLE -> '"' + new String(JsonStringEncoder.getInstance().quoteAsString(text)) + '"';
        };
    }

    @Override
    public boolean supports(QuoteStyle quote, String text) {
        return switch (quote) {
            case DOUBLE -> true;
            case SINGLE -> text.chars().noneMatch(c -> c < 0x20 || c == 0x7f);
            case PLAIN -> canBePlain(text, Layout.BLOCK);
        };
    }

    @Override
    public boolean canBePlain(String text, Layout context) {
        if (text.isEmpty() || Character.isWhitespace(text.charAt(0))
                || Character.isWhitespace(text.charAt(text.length() - 1))) {
            return false;
        }
        char first = text.charAt(0);
        if (LEADING_INDICATORS.indexOf(first) >= 0) {
            return false;
        }
        if ((first == '-' || first == '?' || first == ':')
                && (text.length() == 1 || Character.isWhitespace(text.charAt(1))
                || (context == Layout.FLOW && FLOW_INDICATORS.indexOf(text.charAt(1)) >= 0))) {
            return false;
        }
        if (text.startsWith("---") || text.startsWith("...")) {
            return false;
        }
        if (text.contains(": ") || text.contains(" #") || text.endsWith(":")) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < 0x20 || c == 0x7f || c == '\uFEFF') {
                return false;
            }
            if (context == Layout.FLOW && FLOW_INDICATORS.indexOf(c) >= 0) {
                return false;
            }
        }
        return !(context == Layout.FLOW && text.contains(":"));
    }

    private static String strip(String literal, char quote) {
        if (literal.length() < 2 || literal.charAt(0) != quote || literal.charAt(literal.length() - 1) != quote) {
            throw new IllegalArgumentException("Not a " + quote + "-quoted literal: " + literal);
        }
        return literal.substring(1, literal.length() - 1);
    }

    /**
     * Line folding of multi-line flow scalars: a single line break becomes a space, each
     * additional empty line becomes a line feed, and whitespace around breaks is dropped.
     */
    static String fold(String text) {
        if (text.indexOf('\n') < 0) {
            return text;
        }
        String[] lines = text.split("\n", -1);
        StringBuilder sb = new StringBuilder(stripTrailing(lines[0]));
        boolean afterEmpty = false;
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].strip();
            boolean last = i == lines.length - 1;
            if (line.isEmpty() && !last) {
                sb.append('\n');
                afterEmpty = true;
                continue;
            }
            if (!afterEmpty) {
                sb.append(' ');
            }
            sb.append(last ? stripLeading(lines[i]) : line);
            afterEmpty = false;
        }
        return sb.toString();
    }

    private static String unescapeDouble(String body) {
        StringBuilder sb = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c == '\\') {
                if (i + 1 >= body.length()) {
                    throw new IllegalArgumentException("Dangling escape in double-quoted scalar");
                }
                char e = body.charAt(i + 1);
                if (e == '\n' || (e == '\r' && i + 2 < body.length() && body.charAt(i + 2) == '\n')) {
                    i = skipLineStart(body, body.indexOf('\n', i) + 1);
                    continue;
                }
                i = appendEscape(body, i + 1, sb);
            } else if (c == '\n' || c == '\r') {
                int nl = body.indexOf('\n', i);
                trimTrailingSpaces(sb);
                int next = skipLineStart(body, nl + 1);
                int empty = 0;
                while (next < body.length() && (body.charAt(next) == '\n' || body.charAt(next) == '\r')) {
                    next = skipLineStart(body, body.indexOf('\n', next) + 1);
                    empty++;
                }
                sb.append(empty == 0 ? " " : "\n".repeat(empty));
                i = next;
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    private static int appendEscape(String body, int at, StringBuilder sb) {
        char e = body.charAt(at);
        switch (e) {
            case '0' -> sb.append('\0');
            case 'a' -> sb.append('\u0007');
            case 'b' -> sb.append('\b');
            case 't', '\t' -> sb.append('\t');
            case 'n' -> sb.append('\n');
            case 'v' -> sb.append('\u000B');
            case 'f' -> sb.append('\f');
            case 'r' -> sb.append('\r');
            case 'e' -> sb.append('\u001B');
            case ' ' -> sb.append(' ');
            case '"' -> sb.append('"');
            case '/' -> sb.append('/');
            case '\\' -> sb.append('\\');
            case 'N' -> sb.append('\u0085');
            case '_' -> sb.append('\u00A0');
            case 'L' -> sb.append('\u2028');
            case 'P' -> sb.append('\u2029');
            case 'x' -> {
                return appendCodePoint(body, at, 2, sb);
            }
            case 'u' -> {
                return appendCodePoint(body, at, 4, sb);
            }
            case 'U' -> {
                return appendCodePoint(body, at, 8, sb);
            }
            default -> throw new IllegalArgumentException("Unknown escape sequence \\" + e);
        }
        return at + 1;
    }

    private static int appendCodePoint(String body, int at, int digits, StringBuilder sb) {
        if (at + 1 + digits > body.length()) {
            throw new IllegalArgumentException("Truncated escape sequence \\" + body.substring(at));
        }
        String hex = body.substring(at + 1, at + 1 + digits);
        try {
            sb.appendCodePoint(Integer.parseInt(hex, 16));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid escape sequence \\" + body.charAt(at) + hex, e);
        }
        return at + 1 + digits;
    }

    private static int skipLineStart(String body, int from) {
        int i = from;
        while (i < body.length() && (body.charAt(i) == ' ' || body.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    private static void trimTrailingSpaces(StringBuilder sb) {
        while (!sb.isEmpty() && (sb.charAt(sb.length() - 1) == ' ' || sb.charAt(sb.length() - 1) == '\t')) {
            sb.setLength(sb.length() - 1);
        }
    }

    private static String stripTrailing(String s) {
        return s.stripTrailing();
    }

    private static String stripLeading(String s) {
        return s.stripLeading();
    }
}
