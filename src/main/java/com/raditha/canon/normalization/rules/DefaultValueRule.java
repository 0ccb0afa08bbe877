package com.raditha.canon.normalization.rules;

import com.raditha.canon.semantic.SemanticPath;

/**
 * A key that has a default value in mappings at matching paths. When the key is absent the
 * normalizer materializes a synthetic node with the default; an explicit value equal to the
 * default therefore compares equal to an absent one.
 *
 * @param parent       mappings the default applies to
 * @param key          the defaulted key
 * @param defaultValue plain Java value ({@code Map}, {@code List}, scalar or null)
 */
public record DefaultValueRule(PathPattern parent, String key, Object defaultValue) {

    public DefaultValueRule {
        if (parent == null || key == null) {
            throw new IllegalArgumentException("Default value rules need a parent pattern and a key");
        }
    }

    public static DefaultValueRule of(String parentPattern, String key, Object defaultValue) {
        return new DefaultValueRule(PathPattern.compile(parentPattern), key, defaultValue);
    }

    public boolean appliesTo(SemanticPath mappingPath) {
        return parent.matches(mappingPath);
    }
}
