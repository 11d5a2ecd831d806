package com.wordsonphone.backend.customcategory.repo;

import com.wordsonphone.backend.customcategory.entity.QuotaLedgerEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;

public interface QuotaLedgerRepository extends JpaRepository<QuotaLedgerEntity, Long> {

    /** 原子 +1；row 不存在就是 0 rows（呼叫端再補 insert） */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
        UPDATE QuotaLedgerEntity q
        SET q.usedCount = q.usedCount + 1,
            q.updatedAtUtc = :now
        WHERE q.ledgerDate = :ledgerDate
        """)
    int increment(@Param("ledgerDate") LocalDate ledgerDate, @Param("now") Instant now);

    @Query("SELECT q.usedCount FROM QuotaLedgerEntity q WHERE q.ledgerDate = :ledgerDate")
    Integer findUsedCount(@Param("ledgerDate") LocalDate ledgerDate);
}
