package com.healthtech.glucose.storage;

import com.healthtech.glucose.domain.MinuteAverage;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable table of per-minute averages keyed by (date, minute of day).
 * The stored data is also the backfill progress: the latest stored date is the watermark.
 */
public interface AggregateStore {

    /**
     * Creates the table and the minute-of-day index if they do not exist.
     * Safe to call on an existing store.
     */
    void initialize();

    /**
     * Returns the most recent date with at least one row.
     * Reflects all writes made earlier in the same process.
     *
     * @return Latest stored date, empty if the store holds no rows
     */
    Optional<LocalDate> latestDate();

    /**
     * Writes the given minute averages for a date, replacing rows at the same keys.
     * Minute keys of that date that are not in {@code averagesByMinute} are left untouched.
     * All rows are written in one transaction.
     *
     * @param date Calendar day
     * @param averagesByMinute Average per minute of day
     * @return Number of rows written
     * @throws StorageException if the write fails
     */
    int upsertMinuteAverages(LocalDate date, Map<Integer, Integer> averagesByMinute);

    /**
     * Records a placeholder row (date, 0, 0) if and only if no row exists for the date yet.
     *
     * @param date Calendar day that yielded no usable readings
     * @return true if the placeholder was written, false if the date already had rows
     * @throws StorageException if the write fails
     */
    boolean markDayEmpty(LocalDate date);

    /**
     * Returns all rows for a date ordered by minute of day.
     *
     * @param date Calendar day
     * @return Rows for the date, empty if none
     */
    List<MinuteAverage> findByDate(LocalDate date);

    /**
     * Returns the total number of stored rows.
     */
    long count();

    /**
     * Checks if the store is reachable.
     */
    boolean isHealthy();
}
