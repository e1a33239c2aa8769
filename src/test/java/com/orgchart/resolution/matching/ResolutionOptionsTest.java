package com.orgchart.resolution.matching;

import com.orgchart.resolution.similarity.FuzzyMatchOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionOptionsTest {

    @Test
    @DisplayName("Should expose default values")
    void testDefaults() {
        ResolutionOptions options = ResolutionOptions.defaults();

        assertEquals(0.8, options.getExactNameScore());
        assertEquals(0.7, options.getFuzzyCap());
        assertEquals(0.3, options.getMinimumScore());
        assertEquals(0.3, options.getFuzzyThreshold());
        assertTrue(options.isUsePhonetic());
        assertTrue(options.isPreferExact());
    }

    @Test
    @DisplayName("Strict options should raise the minimum and disable phonetics")
    void testStrict() {
        ResolutionOptions strict = ResolutionOptions.strict();

        assertEquals(0.5, strict.getMinimumScore());
        assertEquals(0.6, strict.getFuzzyCap());
        assertFalse(strict.isUsePhonetic());
        assertNotEquals(ResolutionOptions.defaults(), strict);
    }

    @Test
    @DisplayName("Should keep the fuzzy cap below the exact-name score")
    void testCapBelowExactScore() {
        assertThrows(IllegalArgumentException.class,
                () -> ResolutionOptions.builder().fuzzyCap(0.8).build());
        assertThrows(IllegalArgumentException.class,
                () -> ResolutionOptions.builder().exactNameScore(0.6).build());
        assertDoesNotThrow(() -> ResolutionOptions.builder().exactNameScore(0.9).fuzzyCap(0.85).build());
    }

    @Test
    @DisplayName("Should reject out-of-range values")
    void testRangeValidation() {
        assertThrows(IllegalArgumentException.class, () -> ResolutionOptions.builder().minimumScore(1.5));
        assertThrows(IllegalArgumentException.class, () -> ResolutionOptions.builder().fuzzyThreshold(-0.1));
        assertThrows(IllegalArgumentException.class,
                () -> ResolutionOptions.builder().minimumScore(0.9).build());
    }

    @Test
    @DisplayName("Should translate to fuzzy matcher options")
    void testToFuzzyMatchOptions() {
        FuzzyMatchOptions fuzzy = ResolutionOptions.builder()
                .fuzzyThreshold(0.4)
                .usePhonetic(false)
                .build()
                .toFuzzyMatchOptions();

        assertEquals(0.4, fuzzy.getThreshold());
        assertFalse(fuzzy.isUsePhonetic());
        assertTrue(fuzzy.isPreferExact());
    }

    @Test
    @DisplayName("Equal options should be usable as cache keys")
    void testEquality() {
        assertEquals(ResolutionOptions.defaults(), ResolutionOptions.builder().build());
        assertEquals(ResolutionOptions.defaults().hashCode(), ResolutionOptions.builder().build().hashCode());
        assertTrue(ResolutionOptions.defaults().toString().contains("fuzzyCap=0.7"));
    }
}
