package com.wordsonphone.backend.customcategory.web;

public class CategoryNotFoundException extends RuntimeException {

    private final String categoryName;

    public CategoryNotFoundException(String categoryName) {
        super("CATEGORY_REQUEST_NOT_FOUND: " + categoryName);
        this.categoryName = categoryName;
    }

    public String categoryName() { return categoryName; }
}
