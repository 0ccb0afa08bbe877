package com.raditha.canon.normalization;

import com.raditha.canon.cst.Layout;
import com.raditha.canon.cst.QuoteStyle;
import com.raditha.canon.format.FormatProfile;
import com.raditha.canon.format.json.JsonGrammar;
import com.raditha.canon.format.yaml.YamlGrammar;
import com.raditha.canon.semantic.NodeId;
import com.raditha.canon.semantic.SemanticNode;
import com.raditha.canon.semantic.SemanticPath;
import com.raditha.canon.semantic.SemanticValues;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ScalarRendererTest {

    private static final FormatProfile YAML = new YamlGrammar().profile();
    private static final FormatProfile JSON = new JsonGrammar().profile();
    private static final NodeId ID = new NodeId("test", "v");

    private RuleSet rules;
    private ScalarRenderer renderer;

    @BeforeEach
    void setUp() {
        rules = RuleSet.builder().durationKeys(Set.of("timeout")).build();
        renderer = new ScalarRenderer(rules);
    }

    private RenderContext context(FormatProfile profile, String key) {
        SemanticPath path = SemanticPath.ROOT.child(key);
        return new RenderContext(profile, Layout.BLOCK, key, path, null, rules.readerFor(profile));
    }

    private RuleTag tag(String literal, QuoteStyle quote, String key) {
        return rules.read(literal, quote, key, SemanticPath.ROOT.child(key), YAML, null).tag();
    }

    private String render(Object value, RuleTag tag, String key) {
        return renderer.render(SemanticValues.scalar(ID, value), tag, context(YAML, key));
    }

    @Test
    void testUnchangedValueKeepsOriginalLiteral() {
        assertEquals("0x1F", render(31, tag("0x1F", QuoteStyle.PLAIN, "n"), "n"));
        assertEquals("~", render(null, tag("~", QuoteStyle.PLAIN, "n"), "n"));
        assertEquals("1.50", render(new BigDecimal("1.5"), tag("1.50", QuoteStyle.PLAIN, "n"), "n"));
        assertEquals("1h0m0s", render("1h", tag("1h0m0s", QuoteStyle.PLAIN, "timeout"), "timeout"));
    }

    @Test
    void testChangedValueFollowsRecordedStyle() {
        assertEquals("0x20", render(32, tag("0x1F", QuoteStyle.PLAIN, "n"), "n"));
        assertEquals("False", render(false, tag("True", QuoteStyle.PLAIN, "b"), "b"));
        assertEquals("'bye'", render("bye", tag("'hi'", QuoteStyle.SINGLE, "s"), "s"));
        assertEquals("\"bye\"", render("bye", tag("\"hi\"", QuoteStyle.DOUBLE, "s"), "s"));
        assertEquals("2h", render("2h", tag("1h0m0s", QuoteStyle.PLAIN, "timeout"), "timeout"));
    }

    @Test
    void testKindChangeUsesTheNewKindsRule() {
        assertEquals("12", render(12, tag("hello", QuoteStyle.PLAIN, "s"), "s"));
        assertEquals("true", render(true, tag("3", QuoteStyle.PLAIN, "s"), "s"));
        assertEquals("null", render(null, tag("x", QuoteStyle.PLAIN, "s"), "s"));
    }

    @Test
    void testStringsThatWouldReadAsOtherKindsAreQuoted() {
        assertEquals("'true'", render("true", null, "s"));
        assertEquals("'42'", render("42", null, "s"));
        assertEquals("''", render("", null, "s"));
        assertEquals("'a: b'", render("a: b", null, "s"));
        assertEquals("plain text", render("plain text", null, "s"));
    }

    @Test
    void testJsonStringsAreAlwaysQuoted() {
        RenderContext json = context(JSON, "s");

        assertEquals("\"hello\"", renderer.render(SemanticValues.scalar(ID, "hello"), null, json));
        assertEquals("\"say \\\"hi\\\"\"", renderer.render(SemanticValues.scalar(ID, "say \"hi\""), null, json));
        assertEquals("7", renderer.render(SemanticValues.scalar(ID, 7), null, json));
    }

    @Test
    void testContainersAreRejected() {
        SemanticNode list = SemanticValues.deterministic(ID, java.util.List.of(1));

        assertThrows(IllegalArgumentException.class, () -> renderer.render(list, null, context(YAML, "s")));
    }
}
