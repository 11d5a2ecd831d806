package com.wordsonphone.backend.customcategory.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SampleWordsRequest(
        @NotBlank @Size(max = 100) String categoryName
) {}
