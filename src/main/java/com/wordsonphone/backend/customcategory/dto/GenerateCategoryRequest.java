package com.wordsonphone.backend.customcategory.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * sampleWords / description / tags 沒帶就沿用 preview 時存下來的；targetCount 沒帶用設定值。
 */
public record GenerateCategoryRequest(
        @NotBlank @Size(max = 100) String categoryName,
        @Size(max = 10) List<@NotBlank @Size(max = 100) String> sampleWords,
        @Size(max = 500) String description,
        @Size(max = 20) List<@NotBlank @Size(max = 64) String> tags,
        @Min(1) @Max(200) Integer targetCount
) {}
