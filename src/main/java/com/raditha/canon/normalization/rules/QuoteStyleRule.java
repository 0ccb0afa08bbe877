package com.raditha.canon.normalization.rules;

import com.raditha.canon.cst.QuoteStyle;
import com.raditha.canon.format.FormatProfile;
import com.raditha.canon.format.ScalarSyntax;
import com.raditha.canon.normalization.NormalizationRule;
import com.raditha.canon.normalization.RenderContext;
import com.raditha.canon.normalization.RuleKind;
import com.raditha.canon.normalization.RuleTag;
import com.raditha.canon.normalization.ScalarInput;
import com.raditha.canon.normalization.ScalarReading;
import com.raditha.canon.semantic.SemanticKind;
import com.raditha.canon.semantic.SemanticNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Strings: the quoting of a literal is formatting, its decoded text is the value. Reads every
 * literal no earlier rule claimed.
 */
public class QuoteStyleRule implements NormalizationRule {

    private static final Logger logger = LoggerFactory.getLogger(QuoteStyleRule.class);

    @Override
    public RuleKind kind() {
        return RuleKind.QUOTE_STYLE;
    }

    @Override
    public Optional<ScalarReading> read(ScalarInput input) {
        RuleTag tag = RuleTag.of(RuleKind.QUOTE_STYLE, input.quote(), input.literal(), SemanticKind.STRING,
                input.text());
        return Optional.of(new ScalarReading(SemanticKind.STRING, input.text(), tag));
    }

    @Override
    public Optional<String> render(SemanticNode value, RuleTag tag, RenderContext context) {
        if (value.kind() != SemanticKind.STRING) {
            return Optional.empty();
        }
        QuoteStyle preferred = context.preferredQuote();
        if (preferred == null && tag != null && tag.valueKind() == SemanticKind.STRING) {
            preferred = tag.quote();
        }
        return Optional.of(quote((String) value.value(), context.withPreferredQuote(preferred)));
    }

    /**
     * Write {@code text} as a string literal, in the preferred quoting when it reads back as the
     * same string, otherwise in the first fallback that does.
     */
    public static String quote(String text, RenderContext context) {
        FormatProfile profile = context.profile();
        ScalarSyntax syntax = profile.syntax();
        List<QuoteStyle> candidates = new ArrayList<>();
        candidates.add(context.preferredQuote() == null ? QuoteStyle.PLAIN : context.preferredQuote());
        candidates.add(profile.fallbackQuote());
        candidates.add(QuoteStyle.DOUBLE);

        String lastResort = null;
        for (QuoteStyle quote : candidates) {
            boolean usable = quote == QuoteStyle.PLAIN
                    ? syntax.canBePlain(text, context.layout())
                    : syntax.supports(quote, text);
            if (!usable) {
                continue;
            }
            String literal = syntax.encode(text, quote);
            ScalarReading back = context.reader().read(literal, quote, context.key(), context.path());
            if (back.kind() == SemanticKind.STRING && text.equals(back.value())) {
                return literal;
            }
            lastResort = literal;
        }
        logger.warn("String '{}' at {} reads back as a different value in every quoting; writing {}",
                text, context.path(), lastResort);
        return lastResort != null ? lastResort : syntax.encode(text, QuoteStyle.DOUBLE);
    }
}
