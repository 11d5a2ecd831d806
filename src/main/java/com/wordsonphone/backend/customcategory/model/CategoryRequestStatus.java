package com.wordsonphone.backend.customcategory.model;

/**
 * PENDING -> CONFIRMED -> GENERATED
 * PENDING / CONFIRMED -> FAILED
 * GENERATED、FAILED 是終態，不能再轉出去。
 */
public enum CategoryRequestStatus {
    PENDING,
    CONFIRMED,
    GENERATED,
    FAILED;

    public boolean isTerminal() {
        return this == GENERATED || this == FAILED;
    }

    public boolean canTransitionTo(CategoryRequestStatus next) {
        if (next == null || isTerminal()) return false;
        return switch (this) {
            case PENDING -> next == CONFIRMED || next == FAILED;
            case CONFIRMED -> next == GENERATED || next == FAILED;
            default -> false;
        };
    }
}
