package com.raditha.canon.normalization.rules;

import com.raditha.canon.cst.QuoteStyle;
import com.raditha.canon.exceptions.SourceLocation;
import com.raditha.canon.format.yaml.YamlGrammar;
import com.raditha.canon.normalization.NumberSpelling;
import com.raditha.canon.normalization.ScalarInput;
import com.raditha.canon.normalization.ScalarReading;
import com.raditha.canon.semantic.SemanticKind;
import com.raditha.canon.semantic.SemanticPath;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class NumberRuleTest {

    private final NumberRule rule = new NumberRule();

    private Optional<ScalarReading> read(String literal, QuoteStyle quote) {
        ScalarInput input = new ScalarInput(literal, quote, literal, "n", SemanticPath.parse("n"),
                new YamlGrammar().profile(), SourceLocation.of("$.n"));
        return rule.read(input);
    }

    @ParameterizedTest
    @CsvSource({
            "42, 42",
            "-7, -7",
            "+7, 7",
            "007, 7",
            "0x1F, 31",
            "0x1f, 31",
            "0o17, 15",
            "0b101, 5"
    })
    void testIntegers(String literal, long expected) {
        ScalarReading reading = read(literal, QuoteStyle.PLAIN).orElseThrow();

        assertEquals(SemanticKind.INT, reading.kind());
        assertEquals(BigInteger.valueOf(expected), reading.value());
    }

    @ParameterizedTest
    @CsvSource({
            "1.5, 1.5",
            "1.50, 1.5",
            ".5, 0.5",
            "5., 5",
            "1e3, 1000",
            "-2.5E-2, -0.025"
    })
    void testFloats(String literal, String expected) {
        ScalarReading reading = read(literal, QuoteStyle.PLAIN).orElseThrow();

        assertEquals(SemanticKind.FLOAT, reading.kind());
        assertEquals(0, new BigDecimal(expected).compareTo((BigDecimal) reading.value()));
    }

    @Test
    void testNonNumbers() {
        assertTrue(read("12abc", QuoteStyle.PLAIN).isEmpty());
        assertTrue(read("0xZZ", QuoteStyle.PLAIN).isEmpty());
        assertTrue(read(".inf", QuoteStyle.PLAIN).isEmpty());
        assertTrue(read("42", QuoteStyle.SINGLE).isEmpty(), "Quoted numbers are strings");
    }

    @Test
    void testSpellingIsRecorded() {
        NumberSpelling hex = read("0x00FF", QuoteStyle.PLAIN).orElseThrow().tag().spelling();

        assertEquals(16, hex.radix());
        assertTrue(hex.upperCase());
        assertEquals(4, hex.width());
    }

    @Test
    void testIntegerRenderingKeepsSpelling() {
        NumberSpelling hex = read("0x00FF", QuoteStyle.PLAIN).orElseThrow().tag().spelling();
        NumberSpelling padded = read("007", QuoteStyle.PLAIN).orElseThrow().tag().spelling();

        assertEquals("0x0100", NumberRule.renderInteger(BigInteger.valueOf(256), hex));
        assertEquals("-0x00FF", NumberRule.renderInteger(BigInteger.valueOf(-255), hex));
        assertEquals("012", NumberRule.renderInteger(BigInteger.valueOf(12), padded));
        assertEquals("1234", NumberRule.renderInteger(BigInteger.valueOf(1234), padded));
    }

    @Test
    void testFloatRenderingKeepsSpelling() {
        NumberSpelling twoDigits = read("1.50", QuoteStyle.PLAIN).orElseThrow().tag().spelling();
        NumberSpelling exponent = read("1.5e3", QuoteStyle.PLAIN).orElseThrow().tag().spelling();

        assertEquals("2.50", NumberRule.renderFloat(new BigDecimal("2.5"), twoDigits));
        assertEquals("2.125", NumberRule.renderFloat(new BigDecimal("2.125"), twoDigits));
        assertEquals("2.5e3", NumberRule.renderFloat(new BigDecimal("2500"), exponent));
        assertEquals("3.0", NumberRule.renderFloat(new BigDecimal("3"), NumberSpelling.DECIMAL));
    }
}
