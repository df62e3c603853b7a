package com.healthtech.glucose.domain;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Fetch window covering one calendar day: [midnight(date), midnight(date + 1)) in a zone.
 * Days crossing a DST transition are 23 or 25 hours long.
 *
 * @param date Calendar day
 * @param zone Zone in which midnight is evaluated
 */
public record DailyWindow(
    LocalDate date,
    ZoneId zone
) {

    public DailyWindow {
        Objects.requireNonNull(date, "Date cannot be null");
        Objects.requireNonNull(zone, "Zone cannot be null");
    }

    /** Returns the inclusive window start in epoch millis. */
    public long startMillis() {
        return date.atStartOfDay(zone).toInstant().toEpochMilli();
    }

    /** Returns the exclusive window end in epoch millis. */
    public long endMillis() {
        return date.plusDays(1).atStartOfDay(zone).toInstant().toEpochMilli();
    }

    /** Returns true if the timestamp falls within [start, end). */
    public boolean contains(long timestampMillis) {
        return timestampMillis >= startMillis() && timestampMillis < endMillis();
    }
}
