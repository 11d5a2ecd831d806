package com.wordsonphone.backend.customcategory.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

/**
 * 一天一筆；日期換了就是新的一筆（舊的留著當紀錄）。
 */
@Getter
@Setter
@Entity
@Table(name = "quota_ledger",
        uniqueConstraints = @UniqueConstraint(name = "uk_quota_ledger_date", columnNames = "ledger_date")
)
public class QuotaLedgerEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "ledger_date", nullable = false)
    private LocalDate ledgerDate;

    @Column(name = "used_count", nullable = false)
    private int usedCount = 0;

    @Column(name = "updated_at_utc", nullable = false)
    private Instant updatedAtUtc;

    @PrePersist
    void prePersist() {
        if (updatedAtUtc == null) updatedAtUtc = Instant.now();
    }

    @PreUpdate
    void preUpdate() {
        updatedAtUtc = Instant.now();
    }
}
