package com.wordsonphone.backend.customcategory.model;

public enum ProviderErrorCode {
    PROVIDER_AUTH_FAILED,
    PROVIDER_RATE_LIMITED,
    PROVIDER_MALFORMED_RESPONSE,
    PROVIDER_TIMEOUT,
    PROVIDER_ERROR
}
