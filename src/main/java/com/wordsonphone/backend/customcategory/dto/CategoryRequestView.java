package com.wordsonphone.backend.customcategory.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.wordsonphone.backend.customcategory.entity.CategoryRequestEntity;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CategoryRequestView(
        String id,
        String categoryName,
        String status,
        List<String> sampleWords,
        int generatedCount,
        String error,
        String description,
        List<String> tags,
        String requestedAtUtc
) {
    public static CategoryRequestView from(CategoryRequestEntity e) {
        return new CategoryRequestView(
                e.getId(),
                e.getCategoryName(),
                e.getStatus() == null ? null : e.getStatus().name(),
                List.copyOf(e.getSampleWords()),
                e.getGeneratedCount(),
                e.getError(),
                e.getDescription(),
                List.copyOf(e.getTags()),
                e.getRequestedAtUtc() == null ? null : e.getRequestedAtUtc().toString()
        );
    }
}
