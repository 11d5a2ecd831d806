package com.wordsonphone.backend.customcategory.quota;

import java.time.*;

public final class QuotaDayKey {

    private QuotaDayKey() {}

    public static LocalDate todayLocalDate(Instant nowUtc, ZoneId zone) {
        return ZonedDateTime.ofInstant(nowUtc, zone).toLocalDate();
    }

    public static int secondsUntilNextLocalDay(Instant nowUtc, ZoneId zone) {
        ZonedDateTime now = ZonedDateTime.ofInstant(nowUtc, zone);
        ZonedDateTime next = now.toLocalDate().plusDays(1).atStartOfDay(zone);
        long sec = Duration.between(now, next).getSeconds();
        if (sec < 0) sec = 0;
        if (sec > Integer.MAX_VALUE) sec = Integer.MAX_VALUE;
        return (int) sec;
    }
}
