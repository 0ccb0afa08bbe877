package com.raditha.canon.format;

import com.raditha.canon.cst.Token;
import com.raditha.canon.exceptions.ParseException;

import java.util.List;

/**
 * A concrete syntax: turns source text into a contiguous stream of typed tokens and describes
 * how new text of the format is written.
 */
public interface FormatGrammar {

    String name();

    FormatProfile profile();

    /**
     * Tokenize a complete document.
     *
     * @throws ParseException on malformed input
     */
    List<Token> tokenize(String source);
}
