package com.bbthechange.tutoring.testutil;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Fixed calendar used across tests. All times are UTC, the default scheduling zone.
 * 2026-03-01 is a Sunday.
 */
public final class TestTimes {

    public static final LocalDate SUNDAY = LocalDate.of(2026, 3, 1);
    public static final LocalDate MONDAY = SUNDAY.plusDays(1);
    public static final LocalDate TUESDAY = SUNDAY.plusDays(2);

    public static final int SUNDAY_INDEX = 0;
    public static final int MONDAY_INDEX = 1;
    public static final int TUESDAY_INDEX = 2;

    private TestTimes() {
    }

    public static long at(LocalDate date, int hour, int minute) {
        return ZonedDateTime.of(date.getYear(), date.getMonthValue(), date.getDayOfMonth(),
            hour, minute, 0, 0, ZoneOffset.UTC).toInstant().toEpochMilli();
    }

    public static Clock clockAt(long epochMillis) {
        return Clock.fixed(Instant.ofEpochMilli(epochMillis), ZoneOffset.UTC);
    }

    public static long hours(long h) {
        return h * 3_600_000L;
    }
}
