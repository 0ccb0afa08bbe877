package com.raditha.canon.format.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.canon.cst.Layout;
import com.raditha.canon.cst.QuoteStyle;
import com.raditha.canon.format.ScalarSyntax;

/**
 * JSON strings: always double-quoted, escaped and unescaped by Jackson.
 */
public class JsonScalarSyntax implements ScalarSyntax {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String decode(String literal, QuoteStyle quote) {
        return switch (quote) {
            case PLAIN -> literal;
            case DOUBLE -> {
                try {
                    yield MAPPER.readValue(literal, String.class);
                } catch (JsonProcessingException e) {
                    throw new IllegalArgumentException("Malformed JSON string " + literal, e);
                }
            }
            case SINGLE -> throw new IllegalArgumentException("JSON has no single-quoted strings: " + literal);
        };
    }

    @Override
    public String encode(String text, QuoteStyle quote) {
        if (quote == QuoteStyle.SINGLE) {
            throw new IllegalArgumentException("JSON has no single-quoted strings");
        }
        if (quote == QuoteStyle.PLAIN) {
            return text;
        }
        return '"' + new String(JsonStringEncoder.getInstance().quoteAsString(text)) + '"';
    }

    @Override
    public boolean supports(QuoteStyle quote, String text) {
        return quote == QuoteStyle.DOUBLE;
    }

    @Override
    public boolean canBePlain(String text, Layout context) {
        return false;
    }
}
