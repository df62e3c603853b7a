package com.healthtech.glucose.domain;

/**
 * A single glucose reading as returned by the remote source.
 * Either field may be missing in source data; such samples are skipped during reduction.
 *
 * @param timestampMillis Reading time (Unix epoch millis, UTC), nullable
 * @param value Sensor glucose value, nullable
 */
public record RawSample(
    Long timestampMillis,
    Integer value
) {

    public static RawSample of(long timestampMillis, int value) {
        return new RawSample(timestampMillis, value);
    }

    /** Returns true if both timestamp and value are present. */
    public boolean isValid() {
        return timestampMillis != null && value != null;
    }
}
