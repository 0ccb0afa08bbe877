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

/**
 * Plain {@code true}/{@code false} in lower, title or upper case. A changed value keeps the case
 * of the literal it replaces.
 */
public class BooleanRule implements NormalizationRule {

    @Override
    public RuleKind kind() {
        return RuleKind.BOOLEAN_SPELLING;
    }

    @Override
    public Optional<ScalarReading> read(ScalarInput input) {
        if (!input.isPlain()) {
            return Optional.empty();
        }
        Boolean value = switch (input.literal()) {
            case "true", "True", "TRUE" -> Boolean.TRUE;
            case "false", "False", "FALSE" -> Boolean.FALSE;
            default -> null;
        };
        if (value == null) {
            return Optional.empty();
        }
        return Optional.of(new ScalarReading(SemanticKind.BOOL, value,
                RuleTag.of(RuleKind.BOOLEAN_SPELLING, input.quote(), input.literal(), SemanticKind.BOOL, value)));
    }

    @Override
    public Optional<String> render(SemanticNode value, RuleTag tag, RenderContext context) {
        if (value.kind() != SemanticKind.BOOL) {
            return Optional.empty();
        }
        String text = value.value().toString();
        if (tag != null && tag.kind() == RuleKind.BOOLEAN_SPELLING && tag.original() != null) {
            String original = tag.original();
            if (original.equals(original.toUpperCase())) {
                return Optional.of(text.toUpperCase());
            }
            if (Character.isUpperCase(original.charAt(0))) {
                return Optional.of(Character.toUpperCase(text.charAt(0)) + text.substring(1));
            }
        }
        return Optional.of(text);
    }
}
