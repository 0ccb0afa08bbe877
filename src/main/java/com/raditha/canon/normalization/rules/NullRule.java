package com.raditha.canon.normalization.rules;

import com.raditha.canon.normalization.NormalizationRule;
import com.raditha.canon.normalization.RenderContext;
import com.raditha.canon.normalization.RuleKind;
import com.raditha.canon.normalization.RuleTag;
import com.raditha.canon.normalization.ScalarInput;
import com.raditha.canon.normalization.ScalarReading;
import com.raditha.canon.semantic.SemanticKind;
import com.raditha.canon.semantic.SemanticNode;

import java.util.Optional;
import java.util.Set;

/**
 * Plain {@code null}, {@code Null}, {@code NULL}, {@code ~} and the empty scalar all denote null.
 */
public class NullRule implements NormalizationRule {

    private static final Set<String> SPELLINGS = Set.of("", "~", "null", "Null", "NULL");

    @Override
    public RuleKind kind() {
        return RuleKind.NULL_SPELLING;
    }

    @Override
    public Optional<ScalarReading> read(ScalarInput input) {
        if (!input.isPlain() || !SPELLINGS.contains(input.literal())) {
            return Optional.empty();
        }
        return Optional.of(new ScalarReading(SemanticKind.NULL, null,
                RuleTag.of(RuleKind.NULL_SPELLING, input.quote(), input.literal(), SemanticKind.NULL, null)));
    }

    @Override
    public Optional<String> render(SemanticNode value, RuleTag tag, RenderContext context) {
        if (value.kind() != SemanticKind.NULL) {
            return Optional.empty();
        }
        if (tag != null && tag.kind() == RuleKind.NULL_SPELLING && tag.original() != null) {
            return Optional.of(tag.original());
        }
        return Optional.of("null");
    }
}
