package com.wordsonphone.backend.customcategory.quota;

import com.wordsonphone.backend.customcategory.config.CustomCategoryProperties;
import com.wordsonphone.backend.customcategory.repo.QuotaLedgerRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@ActiveProfiles("test")
@DataJpaTest
class QuotaLedgerJpaTest {

    @Autowired QuotaLedgerRepository repo;

    private QuotaLedger ledgerAt(Instant now, int limit) {
        CustomCategoryProperties props = new CustomCategoryProperties();
        props.getQuota().setDailyLimit(limit);
        return new QuotaLedger(repo, props, Clock.fixed(now, ZoneOffset.UTC));
    }

    @Test
    void remaining_equals_limit_minus_attempts_floored_at_zero() {
        QuotaLedger ledger = ledgerAt(Instant.parse("2026-05-01T08:00:00Z"), 4);

        for (int n = 1; n <= 6; n++) {
            ledger.recordAttempt();
            QuotaStatus st = ledger.canMakeRequest();

            int expected = Math.max(0, 4 - n);
            assertThat(st.remaining()).isEqualTo(expected);
            assertThat(st.allowed()).isEqualTo(expected > 0);
        }
        assertThat(repo.findUsedCount(LocalDate.of(2026, 5, 1))).isEqualTo(6);
    }

    @Test
    void new_day_starts_from_full_quota() {
        QuotaLedger yesterday = ledgerAt(Instant.parse("2026-05-01T23:59:00Z"), 3);
        yesterday.recordAttempt();
        yesterday.recordAttempt();
        assertThat(yesterday.canMakeRequest().remaining()).isEqualTo(1);

        QuotaLedger today = ledgerAt(Instant.parse("2026-05-02T00:01:00Z"), 3);
        assertThat(today.canMakeRequest().remaining()).isEqualTo(3);

        today.recordAttempt();
        assertThat(today.canMakeRequest().remaining()).isEqualTo(2);
        assertThat(repo.findUsedCount(LocalDate.of(2026, 5, 1))).isEqualTo(2);
    }
}
