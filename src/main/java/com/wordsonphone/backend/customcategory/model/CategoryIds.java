package com.wordsonphone.backend.customcategory.model;

import java.util.Locale;

public final class CategoryIds {

    private CategoryIds() {}

    /** 同一個類別名稱永遠對到同一筆 request（"Kitchen Items" -> req_kitchen_items） */
    public static String requestIdFor(String categoryName) {
        return "req_" + slug(categoryName);
    }

    /** provider 沒給可用 id 時的備援：custom_{category}_{text}_{epochMillis} */
    public static String fallbackPhraseId(String text, String categoryName, long epochMillis) {
        return "custom_" + slug(categoryName) + "_" + slug(text) + "_" + epochMillis;
    }

    public static String slug(String s) {
        if (s == null) return "";
        return s.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "_");
    }
}
