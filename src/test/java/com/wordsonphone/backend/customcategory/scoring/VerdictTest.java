package com.wordsonphone.backend.customcategory.scoring;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class VerdictTest {

    @Test
    void thresholds_are_inclusive() {
        assertEquals(Verdict.EXCELLENT, Verdict.of(45));
        assertEquals(Verdict.GOOD, Verdict.of(44.99));
        assertEquals(Verdict.GOOD, Verdict.of(35));
        assertEquals(Verdict.FAIR, Verdict.of(25));
        assertEquals(Verdict.POOR, Verdict.of(15));
        assertEquals(Verdict.REJECT, Verdict.of(14.99));
        assertEquals(Verdict.REJECT, Verdict.of(0));
    }

    @Test
    void fallback_score_is_fair() {
        PhraseScore s = PhraseScore.fallback("x", "y", null);
        assertEquals(30.0, s.total());
        assertEquals(Verdict.FAIR, s.verdict());
        assertEquals("Scoring failed", s.breakdown().error());
    }
}
