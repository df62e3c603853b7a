package com.healthtech.glucose.domain;

/**
 * How the backfill engine is driven by the application.
 */
public enum BackfillMode {

    /** Single steps on a fixed in-process cadence; the API keeps serving. */
    SCHEDULED(false),

    /** Process every overdue day once at startup, then exit. */
    CATCH_UP(true),

    /** Process at most one overdue day at startup, then exit (for cron). */
    SINGLE_STEP(true),

    /** No backfill; serve the read API only. */
    DISABLED(false);

    private final boolean oneShot;

    BackfillMode(boolean oneShot) {
        this.oneShot = oneShot;
    }

    /** Returns true if the application should exit after the startup run. */
    public boolean isOneShot() {
        return oneShot;
    }
}
