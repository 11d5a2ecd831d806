package com.wordsonphone.backend.customcategory.dto;

import com.wordsonphone.backend.customcategory.scoring.PhraseScore;
import com.wordsonphone.backend.customcategory.scoring.ScoreBreakdown;

public record ScoreResponse(
        String text,
        String category,
        double total,
        double maxScore,
        String verdict,
        String verdictLabel,
        ScoreBreakdown breakdown,
        boolean boostersUsed
) {
    public static ScoreResponse from(PhraseScore s, double maxScore) {
        return new ScoreResponse(
                s.text(),
                s.category(),
                s.total(),
                maxScore,
                s.verdict().name(),
                s.verdict().label(),
                s.breakdown(),
                s.boostersUsed()
        );
    }
}
