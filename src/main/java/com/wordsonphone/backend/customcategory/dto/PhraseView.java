package com.wordsonphone.backend.customcategory.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.wordsonphone.backend.customcategory.entity.GeneratedPhraseEntity;
import com.wordsonphone.backend.customcategory.scoring.Verdict;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PhraseView(
        String id,
        String text,
        String customCategory,
        String provider,
        double qualityScore,
        String verdict,
        String difficulty
) {
    public static PhraseView from(GeneratedPhraseEntity e) {
        return new PhraseView(
                e.getId(),
                e.getText(),
                e.getCustomCategory(),
                e.getProvider(),
                e.getQualityScore(),
                Verdict.of(e.getQualityScore()).name(),
                e.getDifficulty() == null ? null : e.getDifficulty().name()
        );
    }
}
