package com.wordsonphone.backend.customcategory.web;

public class InsufficientSampleWordsException extends RuntimeException {

    public static final String MESSAGE = "Could not generate enough sample words. Please try a different category.";

    private final int received;

    public InsufficientSampleWordsException(int received) {
        super(MESSAGE);
        this.received = received;
    }

    public int received() { return received; }
}
