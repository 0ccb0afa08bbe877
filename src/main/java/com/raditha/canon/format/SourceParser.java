package com.raditha.canon.format;

import com.raditha.canon.cst.ConcreteSyntaxTree;
import com.raditha.canon.cst.CstBuilder;
import com.raditha.canon.cst.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Parses source text into a concrete syntax tree with a given grammar.
 */
public class SourceParser {

    private static final Logger logger = LoggerFactory.getLogger(SourceParser.class);

    /**
     * Parse a document.
     *
     * @param sourceText the complete text
     * @param grammar    the grammar of the text
     * @return a new tree in a fresh lineage
     * @throws com.raditha.canon.exceptions.ParseException on malformed input
     */
    public ConcreteSyntaxTree parse(String sourceText, FormatGrammar grammar) {
        List<Token> tokens = grammar.tokenize(sourceText);
        ConcreteSyntaxTree tree = new CstBuilder(grammar.name()).build(tokens, sourceText);
        logger.debug("Parsed {} characters of {} into {} nodes", sourceText.length(), grammar.name(), tree.size());
        return tree;
    }
}
