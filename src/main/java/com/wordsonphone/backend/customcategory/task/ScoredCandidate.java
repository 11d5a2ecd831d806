package com.wordsonphone.backend.customcategory.task;

import com.wordsonphone.backend.customcategory.model.Difficulty;
import com.wordsonphone.backend.customcategory.scoring.PhraseScore;

/** 一個已評分、還沒去重的候選 */
public record ScoredCandidate(
        String id,
        String text,
        String topic,
        Difficulty difficulty,
        String provider,
        PhraseScore score
) {
    public double total() {
        return score.total();
    }
}
