package com.healthtech.glucose.domain;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Average glucose value for one minute of one calendar day.
 * Keyed by (date, minuteOfDay); the row (date, 0, 0) marks a fetched day without readings.
 *
 * @param date Calendar day
 * @param minuteOfDay Minute bucket, 0..1439
 * @param average Rounded arithmetic mean of the readings in the bucket
 */
public record MinuteAverage(
    LocalDate date,
    int minuteOfDay,
    int average
) {

    public static final int MINUTES_PER_DAY = 1440;

    public MinuteAverage {
        Objects.requireNonNull(date, "Date cannot be null");
        if (minuteOfDay < 0 || minuteOfDay >= MINUTES_PER_DAY) {
            throw new IllegalArgumentException(
                "Minute of day (" + minuteOfDay + ") must be between 0 and " + (MINUTES_PER_DAY - 1)
            );
        }
    }

    /** Creates the placeholder row recorded for a day that yielded no usable readings. */
    public static MinuteAverage placeholder(LocalDate date) {
        return new MinuteAverage(date, 0, 0);
    }

    /** Returns true if this is the empty-day placeholder row. */
    public boolean isPlaceholder() {
        return minuteOfDay == 0 && average == 0;
    }
}
