package com.wordsonphone.backend.customcategory.dto;

public record QuotaResponse(
        boolean allowed,
        int remaining,
        int dailyLimit,
        int secondsUntilReset
) {}
