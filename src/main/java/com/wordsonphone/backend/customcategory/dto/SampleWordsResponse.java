package com.wordsonphone.backend.customcategory.dto;

import java.util.List;

public record SampleWordsResponse(
        String requestId,
        String categoryName,
        List<String> sampleWords,
        int remainingToday
) {}
