package com.wordsonphone.backend.customcategory.entity;

import com.wordsonphone.backend.customcategory.model.Difficulty;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.Locale;

@Getter
@Setter
@Entity
@Table(name = "generated_phrases",
        uniqueConstraints = @UniqueConstraint(name = "uk_generated_phrases_text_key", columnNames = "text_key"),
        indexes = @Index(name = "idx_generated_phrases_category", columnList = "custom_category")
)
public class GeneratedPhraseEntity {

    @Id
    @Column(length = 255, nullable = false)
    private String id;

    @Column(name = "phrase_text", length = 100, nullable = false, updatable = false)
    private String text;

    /** 小寫後的 text，全域唯一（跨類別、跨內建題庫） */
    @Column(name = "text_key", length = 100, nullable = false, updatable = false)
    private String textKey;

    @Column(name = "custom_category", length = 100, nullable = false, updatable = false)
    private String customCategory;

    /** OPENAI / GEMINI / STUB */
    @Column(length = 16, nullable = false, updatable = false)
    private String provider;

    @Column(name = "quality_score", nullable = false, updatable = false)
    private double qualityScore;

    @Column(name = "lexical_score", nullable = false, updatable = false)
    private double lexicalScore;

    @Column(name = "category_boost", nullable = false, updatable = false)
    private double categoryBoost;

    @Column(name = "encyclopedia_score", updatable = false)
    private Double encyclopediaScore;

    @Column(name = "engagement_score", updatable = false)
    private Double engagementScore;

    @Column(name = "scoring_error", length = 255, updatable = false)
    private String scoringError;

    @Enumerated(EnumType.STRING)
    @Column(length = 8, updatable = false)
    private Difficulty difficulty;

    @Column(name = "created_at_utc", nullable = false, updatable = false)
    private Instant createdAtUtc;

    @PrePersist
    void prePersist() {
        if (textKey == null && text != null) textKey = text.toLowerCase(Locale.ROOT);
        if (createdAtUtc == null) createdAtUtc = Instant.now();
    }
}
