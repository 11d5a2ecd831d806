package com.wordsonphone.backend.customcategory.web;

public class AllBatchesFailedException extends RuntimeException {

    public static final String MESSAGE = "All batch requests failed. Please try again.";

    private final int failedBatches;

    public AllBatchesFailedException(int failedBatches) {
        super(MESSAGE);
        this.failedBatches = failedBatches;
    }

    public int failedBatches() { return failedBatches; }
}
