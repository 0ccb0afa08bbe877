package com.raditha.canon.normalization.rules;

import com.raditha.canon.cst.Layout;
import com.raditha.canon.cst.QuoteStyle;
import com.raditha.canon.exceptions.InvalidEditException;
import com.raditha.canon.exceptions.SourceLocation;
import com.raditha.canon.format.FormatProfile;
import com.raditha.canon.format.yaml.YamlGrammar;
import com.raditha.canon.normalization.RenderContext;
import com.raditha.canon.normalization.RuleSet;
import com.raditha.canon.normalization.ScalarInput;
import com.raditha.canon.normalization.ScalarReading;
import com.raditha.canon.semantic.NodeId;
import com.raditha.canon.semantic.SemanticKind;
import com.raditha.canon.semantic.SemanticNode;
import com.raditha.canon.semantic.SemanticPath;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TimestampRuleTest {

    private static final FormatProfile YAML = new YamlGrammar().profile();
    private static final SemanticPath PATH = SemanticPath.parse("at");

    private final TimestampRule rule = new TimestampRule();

    private ScalarReading read(TimestampRule timestamps, String literal) {
        return timestamps.read(new ScalarInput(literal, QuoteStyle.PLAIN, literal, "at", PATH, YAML,
                SourceLocation.of("$.at"))).orElseThrow();
    }

    private RenderContext context() {
        return new RenderContext(YAML, Layout.BLOCK, "at", PATH, null, RuleSet.defaults().readerFor(YAML));
    }

    private static SemanticNode timestamp(String instant) {
        return SemanticNode.scalar(new NodeId("test", "t"), SemanticKind.TIMESTAMP, Instant.parse(instant));
    }

    @Test
    void testOffsetIsRecorded() {
        ScalarReading reading = read(rule, "2024-01-02T04:04:05+01:00");

        assertEquals(Instant.parse("2024-01-02T03:04:05Z"), reading.value());
        assertEquals("yyyy-MM-dd'T'HH:mm:ssXXX", reading.tag().pattern());
        assertEquals(ZoneOffset.ofHours(1), reading.tag().offset());
    }

    @Test
    void testLocalTimestampsAreUtc() {
        assertEquals(Instant.parse("2024-01-02T03:04:05Z"), read(rule, "2024-01-02 03:04:05").value());
        assertEquals(Instant.parse("2024-01-02T00:00:00Z"), read(rule, "2024-01-02").value());
    }

    @Test
    void testInvalidDatesAreNotTimestamps() {
        ScalarInput input = new ScalarInput("2024-02-30", QuoteStyle.PLAIN, "2024-02-30", "at", PATH, YAML,
                SourceLocation.of("$.at"));

        assertTrue(rule.read(input).isEmpty());
    }

    @Test
    void testChangedValueKeepsPatternAndOffset() {
        ScalarReading reading = read(rule, "2024-01-02T04:04:05+01:00");

        String text = rule.render(timestamp("2024-06-01T00:00:00Z"), reading.tag(), context()).orElseThrow();

        assertEquals("2024-06-01T01:00:00+01:00", text);
    }

    @Test
    void testDateOnlyPatternFallsBackWhenTimeIsNeeded() {
        ScalarReading reading = read(rule, "2024-01-02");

        assertEquals("2024-03-04", rule.render(timestamp("2024-03-04T00:00:00Z"), reading.tag(), context())
                .orElseThrow());
        assertEquals("2024-03-04T10:00:00Z", rule.render(timestamp("2024-03-04T10:00:00Z"), reading.tag(), context())
                .orElseThrow());
    }

    @Test
    void testUnrepresentableInstant() {
        TimestampRule dates = new TimestampRule(List.of("yyyy-MM-dd"));

        assertThrows(InvalidEditException.class,
                () -> dates.render(timestamp("2024-03-04T10:00:00Z"), null, context()));
    }

    @Test
    void testInvalidPattern() {
        assertThrows(IllegalArgumentException.class, () -> new TimestampRule(List.of("yyyy-bb")));
    }
}
