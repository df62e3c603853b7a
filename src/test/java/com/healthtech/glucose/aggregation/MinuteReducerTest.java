package com.healthtech.glucose.aggregation;

import com.healthtech.glucose.domain.RawSample;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.SortedMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

@DisplayName("MinuteReducer Tests")
class MinuteReducerTest {

    private MinuteReducer reducer;

    @BeforeEach
    void setUp() {
        reducer = new MinuteReducer(ZoneOffset.UTC);
    }

    private static long at(String isoInstant) {
        return Instant.parse(isoInstant).toEpochMilli();
    }

    @Test
    @DisplayName("Should average readings within the same minute")
    void testAveragesWithinMinute() {
        // Given
        List<RawSample> samples = List.of(
            RawSample.of(at("2024-03-19T12:00:10Z"), 100),
            RawSample.of(at("2024-03-19T12:00:50Z"), 120)
        );

        // When
        SortedMap<Integer, Integer> averages = reducer.reduce(samples);

        // Then
        assertThat(averages).containsExactly(entry(720, 110));
    }

    @Test
    @DisplayName("Should place readings just after midnight in minute zero")
    void testMinuteZero() {
        List<RawSample> samples = List.of(
            RawSample.of(at("2024-03-19T00:00:10Z"), 100),
            RawSample.of(at("2024-03-19T00:00:40Z"), 120)
        );

        assertThat(reducer.reduce(samples)).containsExactly(entry(0, 110));
    }

    @Test
    @DisplayName("Should keep separate minutes separate and ordered")
    void testSeparateMinutes() {
        List<RawSample> samples = List.of(
            RawSample.of(at("2024-03-19T23:59:30Z"), 140),
            RawSample.of(at("2024-03-19T00:00:00Z"), 90),
            RawSample.of(at("2024-03-19T00:05:00Z"), 95)
        );

        SortedMap<Integer, Integer> averages = reducer.reduce(samples);

        assertThat(averages).containsExactly(entry(0, 90), entry(5, 95), entry(1439, 140));
    }

    @Test
    @DisplayName("Should skip samples missing a timestamp or value")
    void testSkipsMalformedSamples() {
        List<RawSample> samples = Arrays.asList(
            new RawSample(null, 200),
            new RawSample(at("2024-03-19T08:00:00Z"), null),
            null,
            RawSample.of(at("2024-03-19T08:00:20Z"), 105)
        );

        SortedMap<Integer, Integer> averages = reducer.reduce(samples);

        assertThat(averages).containsExactly(entry(480, 105));
    }

    @Test
    @DisplayName("Should return empty result when no sample is usable")
    void testAllMalformed() {
        List<RawSample> samples = List.of(new RawSample(null, null), new RawSample(null, 100));

        assertThat(reducer.reduce(samples)).isEmpty();
        assertThat(reducer.reduce(Collections.emptyList())).isEmpty();
        assertThat(reducer.reduce(null)).isEmpty();
    }

    @ParameterizedTest(name = "{0} and {1} -> {2}")
    @CsvSource({
        "100, 101, 101",
        "100, 102, 101",
        "110, 111, 111",
        "99, 100, 100",
        "0, 1, 1"
    })
    @DisplayName("Should round exact halves up")
    void testRoundsHalfUp(int first, int second, int expected) {
        List<RawSample> samples = List.of(
            RawSample.of(at("2024-03-19T10:00:00Z"), first),
            RawSample.of(at("2024-03-19T10:00:30Z"), second)
        );

        assertThat(reducer.reduce(samples)).containsEntry(600, expected);
    }

    @Test
    @DisplayName("Should round thirds to the nearest integer")
    void testRoundsThirds() {
        // 301 / 3 = 100.33 -> 100, 302 / 3 = 100.67 -> 101
        List<RawSample> low = List.of(
            RawSample.of(at("2024-03-19T10:00:00Z"), 100),
            RawSample.of(at("2024-03-19T10:00:10Z"), 100),
            RawSample.of(at("2024-03-19T10:00:20Z"), 101)
        );
        List<RawSample> high = List.of(
            RawSample.of(at("2024-03-19T10:00:00Z"), 100),
            RawSample.of(at("2024-03-19T10:00:10Z"), 101),
            RawSample.of(at("2024-03-19T10:00:20Z"), 101)
        );

        assertThat(reducer.reduce(low)).containsEntry(600, 100);
        assertThat(reducer.reduce(high)).containsEntry(600, 101);
    }

    @Test
    @DisplayName("Should not depend on input order")
    void testOrderIndependent() {
        List<RawSample> samples = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            samples.add(RawSample.of(at("2024-03-19T06:00:00Z") + i * 17_000L, 80 + (i * 7) % 60));
        }
        SortedMap<Integer, Integer> expected = reducer.reduce(samples);

        List<RawSample> reversed = new ArrayList<>(samples);
        Collections.reverse(reversed);
        List<RawSample> shuffled = new ArrayList<>(samples);
        Collections.shuffle(shuffled, new Random(42));

        assertThat(reducer.reduce(reversed)).isEqualTo(expected);
        assertThat(reducer.reduce(shuffled)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should bucket by local wall-clock minute in the configured zone")
    void testBucketsInZone() {
        MinuteReducer berlin = new MinuteReducer(ZoneId.of("Europe/Berlin"));

        // 07:15Z is 08:15 in Berlin during winter time
        SortedMap<Integer, Integer> averages = berlin.reduce(
            List.of(RawSample.of(at("2024-03-19T07:15:40Z"), 123)));

        assertThat(averages).containsExactly(entry(8 * 60 + 15, 123));
        assertThat(berlin.minuteOfDay(at("2024-03-18T23:00:00Z"))).isZero();
    }
}
