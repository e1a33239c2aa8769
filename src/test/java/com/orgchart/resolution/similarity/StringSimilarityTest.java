package com.orgchart.resolution.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class StringSimilarityTest {

    @Nested
    @DisplayName("Levenshtein")
    class LevenshteinTests {
        private final LevenshteinSimilarity levenshtein = new LevenshteinSimilarity();

        @Test
        @DisplayName("Should compute classic edit distances")
        void testDistance() {
            assertEquals(3, levenshtein.distance("kitten", "sitting"));
            assertEquals(0, levenshtein.distance("finance", "finance"));
            assertEquals(3, levenshtein.distance("", "abc"));
            assertEquals(3, levenshtein.distance(null, "abc"));
        }

        @ParameterizedTest
        @DisplayName("Distance should be symmetric")
        @CsvSource({
                "kitten,sitting",
                "air resources board,carb",
                "dept a,deptt a",
                "a,''",
                "department of finance,finance department"
        })
        void testSymmetry(String a, String b) {
            assertEquals(levenshtein.distance(a, b), levenshtein.distance(b, a));
        }

        @Test
        @DisplayName("Should normalize similarity by the longer length")
        void testCompute() {
            assertEquals(1.0, levenshtein.compute("abc", "abc"));
            assertEquals(0.0, levenshtein.compute("", "abc"));
            assertEquals(0.0, levenshtein.compute(null, "abc"));
            assertEquals(1.0 - 3.0 / 7.0, levenshtein.compute("kitten", "sitting"), 1e-9);
        }
    }

    @Nested
    @DisplayName("Jaro and Jaro-Winkler")
    class JaroWinklerTests {
        private final JaroSimilarity jaro = new JaroSimilarity();
        private final JaroWinklerSimilarity jaroWinkler = new JaroWinklerSimilarity();

        @Test
        @DisplayName("Should match reference Jaro values")
        void testJaro() {
            assertEquals(0.9444, jaro.compute("MARTHA", "MARHTA"), 1e-4);
            assertEquals(0.8222, jaro.compute("DWAYNE", "DUANE"), 1e-4);
            assertEquals(0.0, jaro.compute("", "abc"));
            assertEquals(0.0, jaro.compute("abc", "xyz"));
        }

        @Test
        @DisplayName("Should match reference Jaro-Winkler values")
        void testJaroWinkler() {
            assertEquals(0.9611, jaroWinkler.compute("MARTHA", "MARHTA"), 1e-4);
            assertEquals(0.8400, jaroWinkler.compute("DWAYNE", "DUANE"), 1e-4);
            assertEquals(0.8133, jaroWinkler.compute("DIXON", "DICKSONX"), 1e-4);
        }

        @Test
        @DisplayName("Should not boost below the boost threshold")
        void testNoBoostBelowThreshold() {
            assertEquals(jaro.compute("lloyd", "ladd"), jaroWinkler.compute("lloyd", "ladd"), 1e-12);
        }

        @ParameterizedTest
        @DisplayName("Should score identical strings 1.0 and stay within bounds")
        @CsvSource({
                "air resources board,air resources bored",
                "department of finance,finance",
                "x,y",
                "carb,california air resources board"
        })
        void testBoundsAndIdentity(String a, String b) {
            assertEquals(1.0, jaroWinkler.compute(a, a));
            double score = jaroWinkler.compute(a, b);
            assertTrue(score >= 0.0 && score <= 1.0, "score out of bounds: " + score);
        }

        @Test
        @DisplayName("Should reject scaling factors above 0.25")
        void testInvalidScalingFactor() {
            assertThrows(IllegalArgumentException.class, () -> new JaroWinklerSimilarity(0.3, 0.7));
        }
    }

    @Nested
    @DisplayName("Soundex")
    class SoundexTests {
        private final Soundex soundex = new Soundex();

        @ParameterizedTest
        @DisplayName("Should encode Soundex")
        @CsvSource({
                "Robert,R163",
                "Rupert,R163",
                "Smith,S530",
                "Smyth,S530",
                "Ashcraft,A226",
                "Tymczak,T522",
                "Pfister,P236",
                "Lee,L000",
                "Lloyd,L300"
        })
        void testEncode(String input, String expected) {
            assertEquals(expected, soundex.encode(input));
        }

        @Test
        @DisplayName("Smith and Smyth should sound alike")
        void testSmithSmyth() {
            assertEquals(soundex.encode("Smith"), soundex.encode("Smyth"));
            assertTrue(soundex.sounds("Smith", "Smyth"));
            assertEquals(1.0, soundex.compute("Smith", "Smyth"));
        }

        @Test
        @DisplayName("Input without letters should encode to 0000 and sound alike")
        void testNoLetters() {
            assertEquals("0000", soundex.encode(""));
            assertEquals("0000", soundex.encode("123"));
            assertEquals("0000", soundex.encode(null));
            assertTrue(soundex.sounds("123", "456"));
            assertFalse(soundex.sounds("123", "Lee"));
        }
    }

    @Nested
    @DisplayName("Token overlap")
    class TokenOverlapTests {
        private final TokenOverlapSimilarity overlap = new TokenOverlapSimilarity();

        @Test
        @DisplayName("Should score equal strings 1.0 and blank strings 0.0")
        void testEdges() {
            assertEquals(1.0, overlap.compute("motor vehicles", "motor vehicles"));
            assertEquals(0.0, overlap.compute("", "motor vehicles"));
            assertEquals(0.0, overlap.compute(null, "motor vehicles"));
        }

        @Test
        @DisplayName("Should weigh earlier words more")
        void testPositionWeight() {
            // weights 4/3, 7/6, 1; only the last two words match
            assertEquals((7.0 / 6.0 + 1.0) / 3.5,
                    overlap.compute("department motor vehicles", "motor vehicles"), 1e-9);
            assertEquals(1.0, overlap.compute("motor vehicles", "department motor vehicles"), 1e-9);
        }

        @Test
        @DisplayName("Should give partial credit to shared prefixes")
        void testPartialCredit() {
            // weights 1.25 and 1; "admin" earns 0.8 of its weight
            assertEquals((1.25 * 0.8 + 1.0) / 2.25,
                    overlap.compute("admin services", "administration services"), 1e-9);
        }

        @Test
        @DisplayName("Should boost strings sharing many words")
        void testBoost() {
            double score = overlap.compute("state water resources control", "state water resources board");
            assertTrue(score >= 0.8, "expected boost, got " + score);
        }

        @Test
        @DisplayName("Should score disjoint strings 0.0")
        void testDisjoint() {
            assertEquals(0.0, overlap.compute("finance", "justice"));
        }
    }
}
