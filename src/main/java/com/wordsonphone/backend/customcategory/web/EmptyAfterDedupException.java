package com.wordsonphone.backend.customcategory.web;

public class EmptyAfterDedupException extends RuntimeException {

    public static final String MESSAGE = "No new phrases generated after deduplication. Please try a different category.";

    public EmptyAfterDedupException() {
        super(MESSAGE);
    }
}
