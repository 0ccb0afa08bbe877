package com.raditha.canon.normalization.rules;

import com.raditha.canon.semantic.SemanticPath;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PathPatternTest {

    private static boolean matches(String pattern, String path) {
        return PathPattern.compile(pattern).matches(SemanticPath.parse(path));
    }

    @Test
    void testLiteralKeys() {
        assertTrue(matches("metadata.name", "$.metadata.name"));
        assertTrue(matches("$.metadata.name", "metadata.name"));
        assertFalse(matches("metadata.name", "metadata"));
        assertFalse(matches("metadata.name", "metadata.name.first"));
    }

    @Test
    void testRootPattern() {
        assertTrue(matches("$", "$"));
        assertFalse(matches("$", "a"));
    }

    @Test
    void testWildcards() {
        assertTrue(matches("spec.*.name", "spec.task.name"));
        assertFalse(matches("spec.*.name", "spec[0].name"));
        assertTrue(matches("spec.params[*]", "spec.params[3]"));
        assertTrue(matches("spec.params[1]", "spec.params[1]"));
        assertFalse(matches("spec.params[1]", "spec.params[2]"));
    }

    @Test
    void testAnyDepth() {
        assertTrue(matches("**", "$"));
        assertTrue(matches("**", "a[0].b"));
        assertTrue(matches("**.name", "name"));
        assertTrue(matches("**.name", "spec.steps[2].name"));
        assertTrue(matches("spec.**.image", "spec.steps[0].image"));
        assertFalse(matches("spec.**.image", "metadata.image"));
    }

    @Test
    void testQuotedKeysMayContainDots() {
        assertTrue(matches("labels['app.kubernetes.io/name']", "labels['app.kubernetes.io/name']"));
        assertTrue(matches("labels[\"a.b\"]", "labels['a.b']"));
        assertFalse(matches("labels['a.b']", "labels.a"));
    }

    @Test
    void testUnterminatedIndex() {
        assertThrows(IllegalArgumentException.class, () -> PathPattern.compile("a[0"));
        assertThrows(IllegalArgumentException.class, () -> PathPattern.compile(null));
    }
}
