package com.raditha.canon.format.json;

import com.raditha.canon.cst.QuoteStyle;
import com.raditha.canon.cst.Token;
import com.raditha.canon.format.FormatGrammar;
import com.raditha.canon.format.FormatProfile;
import com.raditha.canon.format.OrphanCommentPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Grammar for JSON documents. JSON has no plain strings, so typed rules such as timestamps are
 * applied to quoted strings.
 */
public class JsonGrammar implements FormatGrammar {

    private static final Logger logger = LoggerFactory.getLogger(JsonGrammar.class);

    public static final String NAME = "json";

    private static final FormatProfile PROFILE = new FormatProfile(
            NAME, null, true, true,
            QuoteStyle.DOUBLE, QuoteStyle.DOUBLE,
            2, ": ", ", ",
            OrphanCommentPolicy.ATTACH_TO_PREVIOUS,
            new JsonScalarSyntax());

    private final FormatProfile profile;

    public JsonGrammar() {
        this(PROFILE);
    }

    public JsonGrammar(FormatProfile profile) {
        this.profile = profile;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public FormatProfile profile() {
        return profile;
    }

    @Override
    public List<Token> tokenize(String source) {
        List<Token> tokens = new JsonTokenizer(source).tokenize();
        logger.debug("Tokenized {} characters into {} tokens", source.length(), tokens.size());
        return tokens;
    }
}
