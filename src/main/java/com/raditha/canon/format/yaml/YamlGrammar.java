package com.raditha.canon.format.yaml;

import com.raditha.canon.cst.QuoteStyle;
import com.raditha.canon.cst.Token;
import com.raditha.canon.format.FormatGrammar;
import com.raditha.canon.format.FormatProfile;
import com.raditha.canon.format.OrphanCommentPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Grammar for the block-structured YAML subset: block and flow collections, plain and quoted
 * scalars, comments. Block scalars, anchors, aliases and tags are tokenized as opaque nodes
 * and passed through unchanged.
 */
public class YamlGrammar implements FormatGrammar {

    private static final Logger logger = LoggerFactory.getLogger(YamlGrammar.class);

    public static final String NAME = "yaml";

    private static final FormatProfile PROFILE = new FormatProfile(
            NAME, "#", false, false,
            QuoteStyle.PLAIN, QuoteStyle.SINGLE,
            2, ": ", ", ",
            OrphanCommentPolicy.ATTACH_TO_PREVIOUS,
            new YamlScalarSyntax());

    private final FormatProfile profile;

    public YamlGrammar() {
        this(PROFILE);
    }

    public YamlGrammar(FormatProfile profile) {
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
        List<Token> tokens = new YamlTokenizer(source).tokenize();
        logger.debug("Tokenized {} characters into {} tokens", source.length(), tokens.size());
        return tokens;
    }
}
