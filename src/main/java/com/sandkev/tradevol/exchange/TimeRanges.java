package com.sandkev.tradevol.exchange;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/** UTC day boundaries in epoch millis. */
public final class TimeRanges {

    private TimeRanges() {}

    public static long startMs(LocalDate day) {
        return day.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
    }

    /** Last millisecond of {@code day}. */
    public static long endMsInclusive(LocalDate day) {
        return startMs(day.plusDays(1)) - 1;
    }

    public static LocalDate utcDay(long epochMs) {
        return LocalDate.ofInstant(Instant.ofEpochMilli(epochMs), ZoneOffset.UTC);
    }
}
