package com.wordsonphone.backend.customcategory.task;

/**
 * 兩層重試的規則表：
 * - orchestration：fan-in 後數量不夠，且 attempts 還沒到上限，就再補「一個」順序 batch（只補一次）
 * - nested：只有 prompt-based provider；高品質比例太低、還有額度、還沒超過時間預算，就整批重打
 */
public final class BatchRetryPolicy {

    private BatchRetryPolicy() {}

    public static boolean shouldRetryOrchestration(int uniqueAccepted, int targetCount, int attemptsSoFar, int maxAttempts) {
        return uniqueAccepted < targetCount && attemptsSoFar < maxAttempts;
    }

    public static boolean shouldRetryNested(
            boolean structuredOutput,
            int extraAttemptsUsed,
            int maxExtraAttempts,
            long elapsedMs,
            long timeBudgetMs,
            double highQualityRatio,
            double minHighQualityRatio
    ) {
        if (structuredOutput) return false;
        if (extraAttemptsUsed >= maxExtraAttempts) return false;
        if (elapsedMs >= timeBudgetMs) return false;
        return highQualityRatio < minHighQualityRatio;
    }
}
