package com.raditha.canon.normalization;

import com.raditha.canon.semantic.SemanticKind;
import com.raditha.canon.semantic.SemanticNode;

import java.util.Optional;

/**
 * Writes a scalar value back as a literal: verbatim while the value is the one the recorded rule
 * read, otherwise through that rule's inverse, falling back to the default rule for the value's kind.
 * Containers are written only where the literal they replace was read as embedded JSON.
 */
public class ScalarRenderer {

    private final RuleSet rules;

    public ScalarRenderer(RuleSet rules) {
        this.rules = rules;
    }

    /**
     * @param value   the new value
     * @param tag     tag recorded for the literal being replaced, or null for new nodes
     * @param context where the literal goes
     */
    public String render(SemanticNode value, RuleTag tag, RenderContext context) {
        if (value.isContainer() && (tag == null || tag.kind() != RuleKind.EMBEDDED_JSON)) {
            throw new IllegalArgumentException("Containers are not scalars: " + value);
        }
        if (tag != null && tag.matches(value)) {
            return tag.original();
        }
        if (value.kind() == SemanticKind.OPAQUE) {
            return (String) value.value();
        }
        if (tag != null) {
            Optional<String> recorded = rules.rule(tag.kind()).flatMap(rule -> rule.render(value, tag, context));
            if (recorded.isPresent()) {
                return recorded.get();
            }
        }
        return rules.ruleFor(value.kind()).render(value, tag, context)
                .orElseThrow(() -> new IllegalStateException("No rule can write " + value));
    }
}
