package com.wordsonphone.backend.customcategory.quota;

import com.wordsonphone.backend.customcategory.config.CustomCategoryProperties;
import com.wordsonphone.backend.customcategory.entity.QuotaLedgerEntity;
import com.wordsonphone.backend.customcategory.repo.QuotaLedgerRepository;
import com.wordsonphone.backend.customcategory.web.QuotaExceededException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * 每日生成次數帳本。
 * - canMakeRequest：讀今天的 used_count；今天還沒有 row 就是整份額度（reset 是 lazy 的）
 * - recordAttempt：今天 +1，沒有 row 就建一筆 used_count=1
 * 每個 batch 各自呼叫 recordAttempt，靠 DB 的 UPDATE ... + 1 保證不會互蓋。
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class QuotaLedger {

    public static final String MSG_DAILY_LIMIT = "Daily limit reached. Try again tomorrow.";

    private final QuotaLedgerRepository repo;
    private final CustomCategoryProperties props;
    private final Clock clock;

    public QuotaStatus canMakeRequest() {
        int limit = Math.max(0, props.getQuota().getDailyLimit());
        LocalDate today = today();

        Integer used;
        try {
            used = repo.findUsedCount(today);
        } catch (RuntimeException e) {
            // ✅ 帳本讀不到：照設定決定放行或擋下，但一定要留 log
            if (props.getQuota().isFailOpenOnReadError()) {
                log.warn("quota_ledger_read_failed policy=FAIL_OPEN day={} err={}", today, e.toString());
                return new QuotaStatus(true, limit, limit);
            }
            log.warn("quota_ledger_read_failed policy=FAIL_CLOSED day={} err={}", today, e.toString());
            return new QuotaStatus(false, 0, limit);
        }

        int count = (used == null) ? 0 : Math.max(0, used);
        int remaining = Math.max(0, limit - count);
        return new QuotaStatus(remaining > 0, remaining, limit);
    }

    /** admission check：不夠就丟 QuotaExceededException（還沒打任何 provider） */
    public QuotaStatus requireAvailable() {
        QuotaStatus st = canMakeRequest();
        if (!st.allowed()) {
            throw new QuotaExceededException(MSG_DAILY_LIMIT, secondsUntilReset(), "WAIT_TOMORROW");
        }
        return st;
    }

    /**
     * 只要 call 有送出去就要記，不管成功失敗；這裡不做 limit 判斷（判斷在 admission）。
     */
    public void recordAttempt() {
        LocalDate today = today();
        Instant now = clock.instant();

        int updated = repo.increment(today, now);
        if (updated == 1) return;

        QuotaLedgerEntity row = new QuotaLedgerEntity();
        row.setLedgerDate(today);
        row.setUsedCount(1);
        row.setUpdatedAtUtc(now);
        try {
            repo.saveAndFlush(row);
        } catch (DataIntegrityViolationException race) {
            // 同一天另一個 batch 先建好 row 了：改走 +1
            log.debug("quota_ledger_insert_race day={}", today);
            repo.increment(today, now);
        }
    }

    public int secondsUntilReset() {
        return QuotaDayKey.secondsUntilNextLocalDay(clock.instant(), zone());
    }

    private LocalDate today() {
        return QuotaDayKey.todayLocalDate(clock.instant(), zone());
    }

    private ZoneId zone() {
        String z = props.getQuota().getZone();
        return (z == null || z.isBlank()) ? ZoneId.of("UTC") : ZoneId.of(z.trim());
    }
}
