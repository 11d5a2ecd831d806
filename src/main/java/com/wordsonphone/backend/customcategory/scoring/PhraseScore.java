package com.wordsonphone.backend.customcategory.scoring;

public record PhraseScore(
        String text,
        String category,
        double total,
        ScoreBreakdown breakdown,
        Verdict verdict,
        boolean boostersUsed
) {
    /** 評分本身炸掉時的保守分數 */
    public static final double FALLBACK_SCORE = 30;

    public static PhraseScore fallback(String text, String category, String reason) {
        return new PhraseScore(
                text,
                category,
                FALLBACK_SCORE,
                new ScoreBreakdown(FALLBACK_SCORE, 0, null, null, reason == null ? "Scoring failed" : reason),
                Verdict.of(FALLBACK_SCORE),
                false
        );
    }
}
