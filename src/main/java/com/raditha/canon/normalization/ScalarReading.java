package com.raditha.canon.normalization;

import com.raditha.canon.semantic.SemanticKind;

/**
 * Result of reading a scalar literal: its canonical value and the rule that produced it.
 */
public record ScalarReading(SemanticKind kind, Object value, RuleTag tag) {
}
