package com.wordsonphone.backend.customcategory.task;

import com.wordsonphone.backend.customcategory.entity.GeneratedPhraseEntity;

import java.util.List;

/**
 * 比 targetCount 少不是錯誤；由呼叫端告知使用者（partial）。
 */
public record GenerationResult(
        String categoryName,
        String requestId,
        List<GeneratedPhraseEntity> phrases,
        int targetCount,
        int attempts,
        int successfulBatches,
        int failedBatches
) {
    public boolean partial() {
        return phrases.size() < targetCount;
    }
}
