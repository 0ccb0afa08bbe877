package com.raditha.canon.document;

import com.raditha.canon.config.CanonConfig;
import com.raditha.canon.format.json.JsonGrammar;
import com.raditha.canon.format.yaml.YamlGrammar;
import com.raditha.canon.normalization.RuleSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CanonicalWriter.
 */
class CanonicalWriterTest {

    private final YamlGrammar yaml = new YamlGrammar();
    private final JsonGrammar json = new JsonGrammar();
    private final CanonicalWriter writer = new CanonicalWriter(RuleSet.defaults());

    @Test
    void testYamlKeysAreSorted() {
        Document doc = Document.parse("# comment\nzeta: 1\nalpha:\n  beta: [x, y]\n", yaml);

        String text = writer.write(doc.tree(), "yaml");

        assertFalse(text.contains("#"));
        assertTrue(text.indexOf("alpha") < text.indexOf("zeta"), text);
        assertTrue(text.endsWith("\n"));
        assertTrue(Document.parse(text, yaml).tree().semanticallyEquals(doc.tree()), text);
    }

    @Test
    void testJsonOutput() {
        Document doc = Document.parse("b: true\na: 1\n", yaml);

        String text = writer.write(doc.tree(), "json");

        assertTrue(text.contains("\"a\": 1"), text);
        assertTrue(text.indexOf("\"a\"") < text.indexOf("\"b\""), text);
        assertTrue(Document.parse(text, json).tree().semanticallyEquals(doc.tree()), text);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "a: 1\n",
            "{b: [1, 2.5, 'three'], a: {c: null}}\n",
            "list:\n  - x: 1\n  - y: 'true'\n",
            "when: 2024-03-04T10:00:00Z\n"
    })
    void testCanonicalViewIsStable(String source) {
        Document doc = Document.parse(source, yaml);

        String first = writer.write(doc.tree(), "yaml");
        String second = writer.write(Document.parse(first, yaml).tree(), "yaml");

        assertEquals(first, second);
    }

    @Test
    void testDefaultsAreOmitted() {
        CanonConfig tekton = CanonConfig.tekton();
        Document doc = Document.parse("kind: Task\nspec:\n  params:\n    - name: a\n      type: string\n", yaml, tekton);

        String text = CanonicalWriter.write(doc);

        assertFalse(text.contains("kind"), text);
        assertFalse(text.contains("type"), text);
        assertTrue(text.contains("name: a"), text);
    }

    @Test
    void testUnknownFormat() {
        Document doc = Document.parse("a: 1\n", yaml);
        assertThrows(IllegalArgumentException.class, () -> writer.write(doc.tree(), "toml"));
    }
}
