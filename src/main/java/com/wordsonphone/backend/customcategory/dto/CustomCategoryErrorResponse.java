package com.wordsonphone.backend.customcategory.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CustomCategoryErrorResponse(
        String errorCode,
        String message,
        String requestId,
        String clientAction,
        Integer retryAfterSec
) {}
