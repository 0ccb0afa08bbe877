package com.raditha.canon.normalization;

import com.raditha.canon.cst.QuoteStyle;
import com.raditha.canon.semantic.SemanticKind;
import com.raditha.canon.semantic.SemanticNode;
import com.raditha.canon.semantic.SemanticValues;

import java.math.BigDecimal;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Record of the rule that produced a semantic value from a literal, with everything its inverse
 * needs to write the value back in the original style.
 *
 * @param kind      the rule
 * @param quote     quoting of the original literal
 * @param original  the original literal, written back verbatim while the value is unchanged
 * @param valueKind kind of the value the literal was read as
 * @param canonical the value the literal was read as
 * @param spelling  numeric spelling, for {@link RuleKind#NUMBER_SPELLING}
 * @param pattern   timestamp pattern, for {@link RuleKind#TIMESTAMP}
 * @param offset    UTC offset the timestamp was written in, null for local timestamps
 */
public record RuleTag(
        RuleKind kind,
        QuoteStyle quote,
        String original,
        SemanticKind valueKind,
        Object canonical,
        NumberSpelling spelling,
        String pattern,
        ZoneOffset offset) {

    public RuleTag {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (quote == null) {
            quote = QuoteStyle.PLAIN;
        }
    }

    public static RuleTag of(RuleKind kind, QuoteStyle quote, String original, SemanticKind valueKind, Object canonical) {
        return new RuleTag(kind, quote, original, valueKind, canonical, null, null, null);
    }

    public static RuleTag container(SemanticKind valueKind) {
        return new RuleTag(RuleKind.CONTAINER, QuoteStyle.PLAIN, null, valueKind, null, null, null, null);
    }

    public static RuleTag opaque(String literal) {
        return new RuleTag(RuleKind.OPAQUE, QuoteStyle.PLAIN, literal, SemanticKind.OPAQUE, literal, null, null, null);
    }

    public static RuleTag syntheticDefault(SemanticKind valueKind, Object canonical) {
        return new RuleTag(RuleKind.SYNTHETIC_DEFAULT, QuoteStyle.PLAIN, null, valueKind, canonical, null, null, null);
    }

    /**
     * Tag of a node inside a structured value read from a single string literal.
     */
    public static RuleTag embedded(SemanticKind valueKind) {
        return new RuleTag(RuleKind.EMBEDDED_JSON, QuoteStyle.PLAIN, null, valueKind, null, null, null, null);
    }

    /**
     * Whether {@code node} is the value this tag was recorded for, so the original literal can be
     * written back unchanged.
     */
    public boolean matches(SemanticNode node) {
        if (original == null || node.kind() != valueKind) {
            return false;
        }
        if (node.isContainer()) {
            return kind == RuleKind.EMBEDDED_JSON && SemanticValues.deterministic(node.id(), canonical).equals(node);
        }
        if (valueKind == SemanticKind.NULL) {
            return true;
        }
        if (valueKind == SemanticKind.FLOAT) {
            return canonical instanceof BigDecimal d && d.compareTo((BigDecimal) node.value()) == 0;
        }
        return Objects.equals(canonical, node.value());
    }
}
