package com.raditha.canon.normalization.rules;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DurationRuleTest {

    @ParameterizedTest
    @CsvSource({
            "1h0m0s, 1h",
            "60m, 1h",
            "90s, 1m30s",
            "1h30m, 1h30m",
            "0s, 0s",
            "0h0m, 0s",
            "1.5s, 1.5s",
            "3600s, 1h",
            "2h60m, 3h"
    })
    void testCanonicalSpelling(String text, String canonical) {
        assertEquals(Optional.of(canonical), DurationRule.canonicalize(text));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "1d", "h", "10", "1m1h", "abc"})
    void testNotDurations(String text) {
        assertTrue(DurationRule.canonicalize(text).isEmpty());
    }
}
