package com.healthtech.glucose.util;

import com.healthtech.glucose.domain.DailyWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Calendar arithmetic for the backfill engine.
 * Decides which day is due next and derives fetch windows for a day.
 *
 * Stateless apart from the clock; the scheduling decision itself is a pure function.
 */
public class BackfillCalendar {

    private static final Logger log = LoggerFactory.getLogger(BackfillCalendar.class);

    private final Clock clock;
    private final int initialBackfillDays;

    public BackfillCalendar(Clock clock, int initialBackfillDays) {
        if (initialBackfillDays < 1) {
            throw new IllegalArgumentException("Initial backfill days must be at least 1, got " + initialBackfillDays);
        }
        this.clock = clock;
        this.initialBackfillDays = initialBackfillDays;
    }

    /**
     * Determines the next day to aggregate.
     * Today is never eligible because it is not yet complete.
     *
     * @param today Current date
     * @param watermark Most recent aggregated day, empty if nothing is stored
     * @param initialBackfillDays How far back to start when nothing is stored
     * @return The day to process next, or empty if caught up to yesterday
     */
    public static Optional<LocalDate> nextDueDay(LocalDate today, Optional<LocalDate> watermark, int initialBackfillDays) {
        LocalDate lastCompletableDay = lastCompletableDay(today);
        LocalDate nextDay = watermark
            .map(day -> day.plusDays(1))
            .orElseGet(() -> today.minusDays(initialBackfillDays));

        return nextDay.isAfter(lastCompletableDay) ? Optional.empty() : Optional.of(nextDay);
    }

    /** Returns the most recent day that is complete relative to {@code today}. */
    public static LocalDate lastCompletableDay(LocalDate today) {
        return today.minusDays(1);
    }

    /** Next due day relative to the clock's current date. */
    public Optional<LocalDate> nextDueDay(Optional<LocalDate> watermark) {
        LocalDate today = today();
        Optional<LocalDate> next = nextDueDay(today, watermark, initialBackfillDays);
        if (watermark.isEmpty() && next.isPresent()) {
            log.info("Aggregate store is empty; starting backfill {} days back at {}", initialBackfillDays, next.get());
        }
        return next;
    }

    /** Current date in the calendar's zone. */
    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public LocalDate lastCompletableDay() {
        return lastCompletableDay(today());
    }

    public ZoneId zone() {
        return clock.getZone();
    }

    /** Fetch window for a day in the calendar's zone. */
    public DailyWindow windowFor(LocalDate date) {
        return new DailyWindow(date, zone());
    }
}
