package com.wordsonphone.backend.customcategory.provider;

import com.wordsonphone.backend.customcategory.model.ProviderErrorCode;

public class GenerationClientException extends RuntimeException {

    private final ProviderErrorCode code;
    private final Integer retryAfterSec;

    public GenerationClientException(ProviderErrorCode code, String message) {
        this(code, message, null, null);
    }

    public GenerationClientException(ProviderErrorCode code, String message, Integer retryAfterSec, Throwable cause) {
        super(message == null ? code.name() : message, cause);
        this.code = code;
        this.retryAfterSec = retryAfterSec;
    }

    public ProviderErrorCode code() { return code; }
    public Integer retryAfterSec() { return retryAfterSec; }
}
