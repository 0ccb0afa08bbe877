package com.raditha.canon.normalization.rules;

import com.raditha.canon.normalization.NormalizationRule;
import com.raditha.canon.normalization.RenderContext;
import com.raditha.canon.normalization.RuleKind;
import com.raditha.canon.normalization.RuleTag;
import com.raditha.canon.normalization.ScalarInput;
import com.raditha.canon.normalization.ScalarReading;
import com.raditha.canon.semantic.SemanticKind;
import com.raditha.canon.semantic.SemanticNode;

import java.util.List;
import java.util.Optional;

/**
 * Spellings that denote the same value under a given key, such as two API versions that are
 * interchangeable. The original spelling is written back while the value is unchanged.
 */
public class ValueAliasRule implements NormalizationRule {

    /**
     * {@code spelling} under {@code key} reads as {@code canonical}.
     */
    public record Alias(String key, String spelling, String canonical) {

        public Alias {
            if (key == null || spelling == null || canonical == null) {
                throw new IllegalArgumentException("Alias key, spelling and canonical value are required");
            }
        }
    }

    private final List<Alias> aliases;

    public ValueAliasRule(List<Alias> aliases) {
        this.aliases = List.copyOf(aliases);
    }

    public List<Alias> aliases() {
        return aliases;
    }

    @Override
    public RuleKind kind() {
        return RuleKind.VALUE_ALIAS;
    }

    @Override
    public Optional<ScalarReading> read(ScalarInput input) {
        if (input.key() == null) {
            return Optional.empty();
        }
        for (Alias alias : aliases) {
            if (alias.key().equals(input.key()) && alias.spelling().equals(input.text())) {
                return Optional.of(new ScalarReading(SemanticKind.STRING, alias.canonical(),
                        RuleTag.of(RuleKind.VALUE_ALIAS, input.quote(), input.literal(), SemanticKind.STRING,
                                alias.canonical())));
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> render(SemanticNode value, RuleTag tag, RenderContext context) {
        if (value.kind() != SemanticKind.STRING) {
            return Optional.empty();
        }
        RenderContext quoted = context.preferredQuote() == null && tag != null
                ? context.withPreferredQuote(tag.quote()) : context;
        return Optional.of(QuoteStyleRule.quote((String) value.value(), quoted));
    }
}
