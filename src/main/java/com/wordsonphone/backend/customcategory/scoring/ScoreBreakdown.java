package com.wordsonphone.backend.customcategory.scoring;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 各子分數；encyclopedia / engagement 沒跑 booster 時是 null（不是 0）。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScoreBreakdown(
        double lexical,
        double categoryBoost,
        Double encyclopedia,
        Double engagement,
        String error
) {
    public static ScoreBreakdown localOnly(double lexical, double categoryBoost) {
        return new ScoreBreakdown(lexical, categoryBoost, null, null, null);
    }
}
