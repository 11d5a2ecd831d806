package com.wordsonphone.backend.customcategory.quota;

import com.wordsonphone.backend.customcategory.config.CustomCategoryProperties;
import com.wordsonphone.backend.customcategory.entity.QuotaLedgerEntity;
import com.wordsonphone.backend.customcategory.repo.QuotaLedgerRepository;
import com.wordsonphone.backend.customcategory.web.QuotaExceededException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;

class QuotaLedgerTest {

    private static final Instant NOW = Instant.parse("2026-03-10T22:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);

    private QuotaLedgerRepository repo;
    private CustomCategoryProperties props;
    private QuotaLedger ledger;

    @BeforeEach
    void setUp() {
        repo = Mockito.mock(QuotaLedgerRepository.class);
        props = new CustomCategoryProperties();
        props.getQuota().setDailyLimit(5);
        ledger = new QuotaLedger(repo, props, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void no_row_today_means_full_quota() {
        Mockito.when(repo.findUsedCount(TODAY)).thenReturn(null);

        QuotaStatus st = ledger.canMakeRequest();

        assertTrue(st.allowed());
        assertEquals(5, st.remaining());
        assertEquals(5, st.dailyLimit());
    }

    @Test
    void remaining_is_floored_at_zero_and_blocks() {
        Mockito.when(repo.findUsedCount(TODAY)).thenReturn(9);

        QuotaStatus st = ledger.canMakeRequest();

        assertFalse(st.allowed());
        assertEquals(0, st.remaining());
    }

    @Test
    void read_failure_is_permissive_by_default() {
        Mockito.when(repo.findUsedCount(any())).thenThrow(new DataAccessResourceFailureException("db down"));

        QuotaStatus st = ledger.canMakeRequest();

        assertTrue(st.allowed());
        assertEquals(5, st.remaining());
    }

    @Test
    void read_failure_blocks_when_fail_closed() {
        props.getQuota().setFailOpenOnReadError(false);
        Mockito.when(repo.findUsedCount(any())).thenThrow(new DataAccessResourceFailureException("db down"));

        QuotaStatus st = ledger.canMakeRequest();

        assertFalse(st.allowed());
        assertEquals(0, st.remaining());
    }

    @Test
    void require_available_throws_with_seconds_until_midnight() {
        Mockito.when(repo.findUsedCount(TODAY)).thenReturn(5);

        QuotaExceededException ex = assertThrows(QuotaExceededException.class, () -> ledger.requireAvailable());

        assertEquals(QuotaLedger.MSG_DAILY_LIMIT, ex.getMessage());
        assertEquals("WAIT_TOMORROW", ex.clientAction());
        assertEquals(2 * 3600, ex.retryAfterSec());
    }

    @Test
    void record_attempt_updates_existing_row() {
        Mockito.when(repo.increment(TODAY, NOW)).thenReturn(1);

        ledger.recordAttempt();

        Mockito.verify(repo, Mockito.never()).saveAndFlush(any());
    }

    @Test
    void record_attempt_inserts_first_row_of_the_day() {
        Mockito.when(repo.increment(TODAY, NOW)).thenReturn(0);

        ledger.recordAttempt();

        ArgumentCaptor<QuotaLedgerEntity> cap = ArgumentCaptor.forClass(QuotaLedgerEntity.class);
        Mockito.verify(repo).saveAndFlush(cap.capture());
        assertEquals(TODAY, cap.getValue().getLedgerDate());
        assertEquals(1, cap.getValue().getUsedCount());
    }

    @Test
    void record_attempt_falls_back_to_increment_on_insert_race() {
        Mockito.when(repo.increment(TODAY, NOW)).thenReturn(0).thenReturn(1);
        Mockito.when(repo.saveAndFlush(any())).thenThrow(new DataIntegrityViolationException("uk_quota_ledger_date"));

        ledger.recordAttempt();

        Mockito.verify(repo, Mockito.times(2)).increment(eq(TODAY), eq(NOW));
    }

    @Test
    void zone_decides_which_day_is_today() {
        props.getQuota().setZone("Asia/Taipei");
        // 22:00Z = 隔天 06:00 台北
        Mockito.when(repo.findUsedCount(TODAY.plusDays(1))).thenReturn(2);

        assertEquals(3, ledger.canMakeRequest().remaining());
    }
}
