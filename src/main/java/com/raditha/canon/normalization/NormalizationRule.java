package com.raditha.canon.normalization;

import com.raditha.canon.semantic.SemanticNode;

import java.util.Optional;

/**
 * A scalar normalization rule. Owns both directions: reading a literal into a canonical value,
 * and writing a value back in the style recorded by its {@link RuleTag}.
 */
public interface NormalizationRule {

    RuleKind kind();

    /**
     * Read a literal, or return empty when this rule does not apply to it.
     */
    Optional<ScalarReading> read(ScalarInput input);

    /**
     * Write a value. The tag, when present, is the one recorded for the literal being replaced
     * and may come from another rule.
     *
     * @return the literal, or empty when this rule cannot write the value
     */
    Optional<String> render(SemanticNode value, RuleTag tag, RenderContext context);
}
