package com.healthtech.glucose.domain;

import java.time.LocalDate;

/**
 * Result of processing one day.
 *
 * @param date Processed day
 * @param samplesFetched Raw samples returned by the source
 * @param minutesWritten Minute averages upserted (0 for an empty day)
 * @param markedEmpty True if the day was recorded with the placeholder row
 */
public record DayOutcome(
    LocalDate date,
    int samplesFetched,
    int minutesWritten,
    boolean markedEmpty
) {

    public static DayOutcome written(LocalDate date, int samplesFetched, int minutesWritten) {
        return new DayOutcome(date, samplesFetched, minutesWritten, false);
    }

    public static DayOutcome empty(LocalDate date, int samplesFetched) {
        return new DayOutcome(date, samplesFetched, 0, true);
    }
}
