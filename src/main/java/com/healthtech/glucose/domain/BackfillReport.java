package com.healthtech.glucose.domain;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Summary of a catch-up or single-step run.
 *
 * @param status How the run ended
 * @param days Days processed successfully, in order
 * @param failedDay Day whose processing failed, if any
 * @param failureMessage Failure description, if any
 * @param watermark Watermark after the run
 */
public record BackfillReport(
    Status status,
    List<DayOutcome> days,
    LocalDate failedDay,
    String failureMessage,
    LocalDate watermark
) {

    public enum Status {
        /** No day was due when the run ended. */
        CAUGHT_UP,
        /** Single step processed its one day; more days may still be due. */
        STEPPED,
        /** The remote source failed; nothing was written for the failed day. */
        FETCH_FAILED,
        /** Writing to the aggregate store failed. */
        STORAGE_FAILED,
        /** A day was processed but the watermark did not move past it. */
        STALLED
    }

    public BackfillReport {
        days = List.copyOf(days);
    }

    public static BackfillReport completed(Status status, List<DayOutcome> days, Optional<LocalDate> watermark) {
        return new BackfillReport(status, days, null, null, watermark.orElse(null));
    }

    public static BackfillReport failed(Status status, List<DayOutcome> days, LocalDate failedDay,
                                        String failureMessage, Optional<LocalDate> watermark) {
        return new BackfillReport(status, days, failedDay, failureMessage, watermark.orElse(null));
    }

    public int daysProcessed() {
        return days.size();
    }

    public boolean isFailure() {
        return status == Status.FETCH_FAILED || status == Status.STORAGE_FAILED || status == Status.STALLED;
    }
}
