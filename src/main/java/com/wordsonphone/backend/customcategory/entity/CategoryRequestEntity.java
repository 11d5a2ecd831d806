package com.wordsonphone.backend.customcategory.entity;

import com.wordsonphone.backend.customcategory.model.CategoryRequestStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Entity
@Table(name = "category_requests",
        indexes = @Index(name = "idx_category_requests_name", columnList = "category_name")
)
public class CategoryRequestEntity {

    /** req_{slug}：由類別名稱推導，同名類別共用一筆 */
    @Id
    @Column(length = 160, nullable = false)
    private String id;

    @Column(name = "category_name", length = 100, nullable = false)
    private String categoryName;

    @Column(name = "requested_at_utc", nullable = false)
    private Instant requestedAtUtc;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "category_request_sample_words", joinColumns = @JoinColumn(name = "request_id"))
    @OrderColumn(name = "sort_order")
    @Column(name = "word", length = 100, nullable = false)
    private List<String> sampleWords = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "category_request_tags", joinColumns = @JoinColumn(name = "request_id"))
    @OrderColumn(name = "sort_order")
    @Column(name = "tag", length = 64, nullable = false)
    private List<String> tags = new ArrayList<>();

    @Column(name = "generated_count", nullable = false)
    private int generatedCount = 0;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 16, nullable = false)
    private CategoryRequestStatus status;

    /** 最後一次致命錯誤（給人看的） */
    @Column(name = "error_message", length = 500)
    private String error;

    @Column(length = 500)
    private String description;

    @Column(name = "updated_at_utc", nullable = false)
    private Instant updatedAtUtc;

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (requestedAtUtc == null) requestedAtUtc = now;
        if (updatedAtUtc == null) updatedAtUtc = now;
        if (status == null) status = CategoryRequestStatus.PENDING;
    }

    @PreUpdate
    void preUpdate() {
        updatedAtUtc = Instant.now();
    }

    /**
     * 狀態只能照 FSM 走；非法轉換直接炸，不默默覆蓋。
     */
    public void transitionTo(CategoryRequestStatus next) {
        if (status == null) {
            status = next;
            return;
        }
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("REQUEST_STATUS_TRANSITION_INVALID: " + status + " -> " + next);
        }
        status = next;
    }

    public void markFailed(String message) {
        transitionTo(CategoryRequestStatus.FAILED);
        this.error = truncate(message, 500);
    }

    public void markGenerated(int count) {
        transitionTo(CategoryRequestStatus.GENERATED);
        this.generatedCount = count;
        this.error = null;
    }

    private static String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max);
    }
}
