package com.healthtech.glucose.aggregation;

import com.healthtech.glucose.domain.RawSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Collection;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Reduces the raw readings of one day to one average per local minute of day.
 *
 * Means are rounded half-up using exact integer arithmetic, so 110.5 becomes 111
 * and the result does not depend on the order of the input.
 *
 * Pure and thread-safe.
 */
public class MinuteReducer {

    private static final Logger log = LoggerFactory.getLogger(MinuteReducer.class);

    private final ZoneId zone;

    public MinuteReducer(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * Groups valid samples by local minute of day and averages each group.
     *
     * @param samples Raw samples, possibly containing malformed entries
     * @return Average per minute of day (0..1439), ascending; empty if no sample is valid
     */
    public SortedMap<Integer, Integer> reduce(Collection<RawSample> samples) {
        if (samples == null || samples.isEmpty()) {
            return Collections.emptySortedMap();
        }

        SortedMap<Integer, Accumulator> buckets = new TreeMap<>();
        int skipped = 0;

        for (RawSample sample : samples) {
            if (sample == null || !sample.isValid()) {
                skipped++;
                continue;
            }
            int minute = minuteOfDay(sample.timestampMillis());
            buckets.computeIfAbsent(minute, m -> new Accumulator()).add(sample.value());
        }

        if (skipped > 0) {
            log.debug("Skipped {} malformed samples out of {}", skipped, samples.size());
        }

        SortedMap<Integer, Integer> averages = new TreeMap<>();
        buckets.forEach((minute, acc) -> averages.put(minute, acc.roundedMean()));
        return averages;
    }

    /** Local wall-clock minute of day for an epoch timestamp: hour * 60 + minute. */
    public int minuteOfDay(long timestampMillis) {
        LocalTime time = Instant.ofEpochMilli(timestampMillis).atZone(zone).toLocalTime();
        return time.getHour() * 60 + time.getMinute();
    }

    /**
     * Running sum and count for one minute bucket.
     */
    private static final class Accumulator {
        long sum;
        long count;

        void add(int value) {
            sum += value;
            count++;
        }

        /** Mean rounded half-up: floor((2 * sum + count) / (2 * count)). */
        int roundedMean() {
            return (int) Math.floorDiv(2 * sum + count, 2 * count);
        }
    }
}
