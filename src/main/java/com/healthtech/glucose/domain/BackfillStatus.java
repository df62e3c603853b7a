package com.healthtech.glucose.domain;

import java.time.LocalDate;

/**
 * Snapshot of backfill progress.
 *
 * @param watermark Most recent aggregated day, null if the store is empty
 * @param nextDueDay Day the next run would process, null if caught up
 * @param lastCompletableDay Yesterday in the configured zone
 * @param zoneId Zone used for day windows
 * @param storedRows Total minute-average rows
 * @param healthy Whether the store answered
 */
public record BackfillStatus(
    LocalDate watermark,
    LocalDate nextDueDay,
    LocalDate lastCompletableDay,
    String zoneId,
    long storedRows,
    boolean healthy
) {}
