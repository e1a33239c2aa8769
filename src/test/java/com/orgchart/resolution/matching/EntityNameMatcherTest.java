package com.orgchart.resolution.matching;

import com.orgchart.resolution.core.model.EntityRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EntityNameMatcherTest {

    private static final List<EntityRecord> RECORDS = List.of(
            EntityRecord.builder()
                    .name("Department of Motor Vehicles")
                    .alias("DMV")
                    .orgLevel(2)
                    .budgetCode("2740")
                    .build(),
            EntityRecord.builder().name("Department of Finance").orgLevel(1).budgetCode("8860").build(),
            EntityRecord.builder()
                    .name("Air Resources Board")
                    .canonicalName("California Air Resources Board")
                    .orgLevel(2)
                    .build());

    private EntityNameMatcher matcher;

    @BeforeEach
    void setUp() {
        matcher = new EntityNameMatcher();
    }

    @Test
    @DisplayName("Should return an empty report for blank names")
    void testBlankName() {
        assertTrue(matcher.findMatches("  ", "2740", RECORDS).best().isEmpty());
        assertTrue(matcher.findMatches(null, null, RECORDS).potentialMatches().isEmpty());
    }

    @Test
    @DisplayName("Should prefer an organization code match")
    void testCodeMatch() {
        EntityMatchReport report = matcher.findMatches("Anything", "8860", RECORDS);

        ScoredEntity best = report.best().orElseThrow();
        assertEquals("Department of Finance", best.record().name());
        assertEquals(EntityMatchType.ENTITY_CODE, best.matchType());
        assertEquals(1.0, best.score());
        assertEquals(1, report.potentialMatches().size());
    }

    @Test
    @DisplayName("Should report how an exact match was found")
    void testExactMatchTypes() {
        assertEquals(EntityMatchType.EXACT_NAME,
                matcher.findMatches("department of finance", null, RECORDS).bestMatch().matchType());
        assertEquals(EntityMatchType.CANONICAL_NAME,
                matcher.findMatches("California Air Resources Board", null, RECORDS).bestMatch().matchType());
        assertEquals(EntityMatchType.ALIAS,
                matcher.findMatches("dmv", null, RECORDS).bestMatch().matchType());
    }

    @Test
    @DisplayName("Should match name variations without the type word")
    void testPartialMatch() {
        EntityMatchReport report = matcher.findMatches("Motor Vehicles", null, RECORDS);

        ScoredEntity best = report.best().orElseThrow();
        assertEquals("Department of Motor Vehicles", best.record().name());
        assertTrue(best.isPartialMatch());
        assertEquals(1.0, best.score());
    }

    @Test
    @DisplayName("Should penalize candidates whose code disagrees")
    void testCodeMismatchPenalty() {
        EntityMatchReport report = matcher.findMatches("Motor Vehicles", "9999", RECORDS);

        assertTrue(report.best().isEmpty());
        assertEquals(0.5, report.potentialMatches().get(0).score(), 1e-9);
    }

    @Test
    @DisplayName("Should list weak candidates best first without picking one")
    void testWeakCandidates() {
        EntityMatchReport report = matcher.findMatches("Department of Finance Services", null, RECORDS);

        assertTrue(report.best().isEmpty());
        assertEquals(2, report.potentialMatches().size());
        assertEquals("Department of Finance", report.potentialMatches().get(0).record().name());
        assertTrue(report.potentialMatches().get(0).score() > report.potentialMatches().get(1).score());
    }

    @Test
    @DisplayName("Should return no candidates for unrelated names")
    void testUnrelated() {
        EntityMatchReport report = matcher.findMatches("Lottery", null, RECORDS);

        assertTrue(report.best().isEmpty());
        assertTrue(report.potentialMatches().isEmpty());
    }
}
