package com.wordsonphone.backend.customcategory.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ScoreRequest(
        @NotBlank @Size(max = 100) String text,
        @NotBlank @Size(max = 100) String category,
        Boolean useBoosters
) {}
