package com.raditha.canon.normalization;

import com.raditha.canon.config.CanonConfig;
import com.raditha.canon.correspondence.CorrespondenceEntry;
import com.raditha.canon.cst.ConcreteSyntaxTree;
import com.raditha.canon.exceptions.AmbiguousTimestampFormatException;
import com.raditha.canon.exceptions.ParseException;
import com.raditha.canon.format.FormatGrammar;
import com.raditha.canon.format.SourceParser;
import com.raditha.canon.format.json.JsonGrammar;
import com.raditha.canon.format.yaml.YamlGrammar;
import com.raditha.canon.semantic.SemanticKind;
import com.raditha.canon.semantic.SemanticNode;
import com.raditha.canon.semantic.SemanticTree;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Normalizer.
 */
class NormalizerTest {

    private final SourceParser parser = new SourceParser();

    private NormalizationResult normalize(String text, FormatGrammar grammar, RuleSet rules) {
        ConcreteSyntaxTree cst = parser.parse(text, grammar);
        return new Normalizer(rules).normalize(cst, grammar.profile());
    }

    private SemanticTree yaml(String text) {
        return yaml(text, RuleSet.defaults());
    }

    private SemanticTree yaml(String text, RuleSet rules) {
        return normalize(text, new YamlGrammar(), rules).tree();
    }

    private SemanticNode value(SemanticTree tree, String path) {
        return tree.find(path).orElseThrow(() -> new AssertionError("No node at " + path));
    }

    @Test
    void testScalarKinds() {
        SemanticTree tree = yaml("""
                s: hello
                q: '42'
                i: 42
                f: 4.20
                b: True
                n: ~
                e:
                t: 2024-01-02T03:04:05Z
                """);

        assertEquals(SemanticKind.STRING, value(tree, "s").kind());
        assertEquals("42", value(tree, "q").value());
        assertEquals(SemanticKind.STRING, value(tree, "q").kind());
        assertEquals(BigInteger.valueOf(42), value(tree, "i").value());
        assertEquals(0, new BigDecimal("4.2").compareTo((BigDecimal) value(tree, "f").value()));
        assertEquals(Boolean.TRUE, value(tree, "b").value());
        assertEquals(SemanticKind.NULL, value(tree, "n").kind());
        assertEquals(SemanticKind.NULL, value(tree, "e").kind());
        assertEquals(Instant.parse("2024-01-02T03:04:05Z"), value(tree, "t").value());
    }

    @Test
    void testFormattingDifferencesNormalizeAway() {
        SemanticTree block = yaml("""
                # a comment
                name:   demo
                ports:
                  - 0x50
                  - 443
                enabled: TRUE
                ratio: 0.50
                """);
        SemanticTree flow = yaml("{ratio: .5, enabled: true, ports: [80, +443], \"name\": 'demo'}\n");
        SemanticTree json = normalize("{\"name\": \"demo\", \"ports\": [80, 443], \"enabled\": true, \"ratio\": 5e-1}",
                new JsonGrammar(), RuleSet.defaults()).tree();

        assertTrue(block.semanticallyEquals(flow));
        assertTrue(block.semanticallyEquals(json));
    }

    @Test
    void testIntegerAndFloatStayDistinct() {
        SemanticTree tree = yaml("a: 1\nb: 1.0\nc: 1.00\n");

        assertNotEquals(value(tree, "a"), value(tree, "b"));
        assertEquals(value(tree, "b"), value(tree, "c"));
    }

    @Test
    void testTimestampsCompareAsInstants() {
        SemanticTree utc = yaml("at: 2024-01-02T03:04:05Z\n");
        SemanticTree offset = yaml("at: 2024-01-02T04:04:05+01:00\n");
        SemanticTree quoted = yaml("at: '2024-01-02T03:04:05Z'\n");

        assertTrue(utc.semanticallyEquals(offset));
        assertEquals(SemanticKind.STRING, value(quoted, "at").kind(), "Quoted YAML text is a string");
    }

    @Test
    void testAmbiguousTimestampIsRejected() {
        RuleSet rules = RuleSet.builder().timestampPatterns(List.of("dd/MM/yyyy", "MM/dd/yyyy")).build();

        AmbiguousTimestampFormatException e = assertThrows(AmbiguousTimestampFormatException.class,
                () -> yaml("day: 01/02/2024\n", rules));
        assertEquals(List.of("dd/MM/yyyy", "MM/dd/yyyy"), e.getPatterns());
        assertEquals("$.day", e.getLocation().path());

        // only one pattern accepts a day above twelve
        assertEquals(SemanticKind.TIMESTAMP, value(yaml("day: 13/02/2024\n", rules), "day").kind());
        // both patterns agree on the same day and month
        assertEquals(SemanticKind.TIMESTAMP, value(yaml("day: 02/02/2024\n", rules), "day").kind());
    }

    @Test
    void testDurationsUnderConfiguredKeys() {
        RuleSet rules = RuleSet.builder().durationKeys(Set.of("timeout")).build();

        SemanticTree tree = yaml("timeout: 1h0m0s\nother: 1h0m0s\n", rules);

        assertEquals("1h", value(tree, "timeout").value());
        assertEquals("1h0m0s", value(tree, "other").value());
        assertTrue(tree.semanticallyEquals(yaml("timeout: 60m\nother: 1h0m0s\n", rules)));
    }

    @Test
    void testValueAliases() {
        RuleSet rules = RuleSet.builder().alias("apiVersion", "tekton.dev/v1", "tekton.dev/v1beta1").build();

        SemanticTree v1 = yaml("apiVersion: tekton.dev/v1\n", rules);
        SemanticTree beta = yaml("apiVersion: tekton.dev/v1beta1\n", rules);

        assertTrue(v1.semanticallyEquals(beta));
    }

    @Test
    void testJsonStringsUnderConfiguredKeys() {
        RuleSet rules = RuleSet.builder().jsonStringKeys(Set.of("value")).build();

        NormalizationResult quoted = normalize("value: '[\"a\"]'\nother: '[\"a\"]'\n", new YamlGrammar(), rules);
        SemanticTree block = yaml("value:\n  - a\nother: '[\"a\"]'\n", rules);

        assertTrue(quoted.tree().semanticallyEquals(block));
        assertEquals(SemanticKind.STRING, value(quoted.tree(), "other").kind());
        assertEquals("text", value(yaml("value: 'text'\n", rules), "value").value());

        SemanticNode item = value(quoted.tree(), "value[0]");
        CorrespondenceEntry entry = quoted.map().lookupBySemanticId(item.id()).orElseThrow();
        CorrespondenceEntry literal = quoted.map().lookupBySemanticId(value(quoted.tree(), "value").id())
                .orElseThrow();
        assertTrue(entry.isEmbedded());
        assertEquals(literal.cstNodeId(), entry.parentCstId());
        assertEquals(RuleKind.EMBEDDED_JSON, literal.rule().kind());
    }

    @Test
    void testTektonDefaultsOnlyWhereTheClusterFillsThemIn() {
        RuleSet rules = CanonConfig.tekton().ruleSet();

        SemanticTree tree = yaml("""
                metadata:
                  name: t
                spec:
                  params:
                    - name: p
                  steps:
                    - image: x
                """, rules);

        assertTrue(value(tree, "kind").isSynthetic());
        assertTrue(value(tree, "spec.params[0].type").isSynthetic());
        assertTrue(value(tree, "spec.steps[0].computeResources").isSynthetic());
        assertEquals("", value(tree, "spec.steps[0].name").value());
        assertEquals(Map.of("name", "t"), value(tree, "metadata").toPlain());
        assertTrue(tree.find("spec.kind").isEmpty());
        assertTrue(tree.find("spec.metadata").isEmpty());
        assertTrue(tree.find("spec.params[0].computeResources").isEmpty());
        assertTrue(tree.find("spec.params[0].kind").isEmpty());
    }

    @Test
    void testDefaultsAreMaterialized() {
        RuleSet rules = RuleSet.builder()
                .defaultValue("spec.params[*]", "type", "string")
                .build();

        SemanticTree implicit = yaml("spec:\n  params:\n    - name: a\n", rules);
        SemanticTree explicit = yaml("spec:\n  params:\n    - name: a\n      type: string\n", rules);

        SemanticNode type = value(implicit, "spec.params[0].type");
        assertTrue(type.isSynthetic());
        assertEquals("string", type.value());
        assertFalse(value(explicit, "spec.params[0].type").isSynthetic());
        assertTrue(implicit.semanticallyEquals(explicit));
    }

    @Test
    void testSyntheticDefaultsClaimNoText() {
        RuleSet rules = RuleSet.builder().defaultValue("$", "labels", Map.of("tier", "web")).build();

        NormalizationResult result = normalize("name: a\n", new YamlGrammar(), rules);

        SemanticNode tier = value(result.tree(), "labels.tier");
        CorrespondenceEntry entry = result.map().lookupBySemanticId(tier.id()).orElseThrow();
        assertTrue(entry.isSynthetic());
        assertEquals(CorrespondenceEntry.NO_NODE, entry.cstNodeId());
        assertEquals("$.labels.tier", entry.path().toString());
    }

    @Test
    void testIgnoredPathsAreLeftOut() {
        RuleSet rules = RuleSet.builder().ignore("metadata.uid").ignore("metadata.labels['app.io/name']").build();

        SemanticTree tree = yaml("""
                metadata:
                  uid: 1234
                  name: demo
                  labels:
                    app.io/name: demo
                    tier: web
                """, rules);

        assertTrue(tree.find("metadata.uid").isEmpty());
        assertTrue(tree.find("metadata.labels['app.io/name']").isEmpty());
        assertTrue(tree.find("metadata.labels.tier").isPresent());
    }

    @Test
    void testDuplicateKeysAreRejected() {
        ParseException e = assertThrows(ParseException.class, () -> yaml("a: 1\n'a': 2\n"));
        assertTrue(e.getMessage().contains("Duplicate"));
    }

    @Test
    void testOpaqueContentComparesByText() {
        SemanticTree tree = yaml("script: |\n  echo hi\n");

        SemanticNode script = value(tree, "script");
        assertEquals(SemanticKind.OPAQUE, script.kind());
        assertEquals("|\n  echo hi", script.value());
    }

    @Test
    void testNormalizationIsDeterministic() {
        ConcreteSyntaxTree cst = parser.parse("a: [1, 2]\nb: {c: x}\n", new YamlGrammar());
        Normalizer normalizer = new Normalizer();

        NormalizationResult first = normalizer.normalize(cst);
        NormalizationResult second = normalizer.normalize(cst);

        assertEquals(first.tree().root().id(), second.tree().root().id());
        assertTrue(first.tree().semanticallyEquals(second.tree()));
        assertEquals(first.map().size(), second.map().size());
    }
}
