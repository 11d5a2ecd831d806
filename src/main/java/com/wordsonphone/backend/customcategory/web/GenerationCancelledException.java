package com.wordsonphone.backend.customcategory.web;

/** 呼叫端 thread 被 interrupt：所有進行中的 batch 都已 cancel */
public class GenerationCancelledException extends RuntimeException {

    public GenerationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
