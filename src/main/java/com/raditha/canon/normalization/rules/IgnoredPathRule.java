package com.raditha.canon.normalization.rules;

import com.raditha.canon.semantic.SemanticPath;

/**
 * Volatile entries left out of the semantic tree, such as server-assigned ids or timestamps.
 * Their text stays in the document and is never touched by patch-back.
 */
public record IgnoredPathRule(PathPattern pattern) {

    public static IgnoredPathRule of(String pattern) {
        return new IgnoredPathRule(PathPattern.compile(pattern));
    }

    public boolean ignores(SemanticPath path) {
        return pattern.matches(path);
    }
}
