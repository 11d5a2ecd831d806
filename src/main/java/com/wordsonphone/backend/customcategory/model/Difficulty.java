package com.wordsonphone.backend.customcategory.model;

import java.util.Locale;

public enum Difficulty {
    EASY,
    MEDIUM,
    HARD;

    /** provider 給的字串很亂（"Easy"、" hard "），不認得就回 null，不擋整批 */
    public static Difficulty fromNullable(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return Difficulty.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ignored) {
            return null;
        }
    }
}
