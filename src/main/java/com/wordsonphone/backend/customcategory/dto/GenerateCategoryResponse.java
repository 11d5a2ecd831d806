package com.wordsonphone.backend.customcategory.dto;

import java.util.List;

/** partial=true：數量比 targetCount 少，但不是錯誤 */
public record GenerateCategoryResponse(
        String requestId,
        String categoryName,
        int generatedCount,
        int targetCount,
        boolean partial,
        int attempts,
        int successfulBatches,
        int failedBatches,
        List<PhraseView> phrases
) {}
