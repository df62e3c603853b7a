package com.healthtech.glucose.service;

import com.healthtech.glucose.aggregation.MinuteReducer;
import com.healthtech.glucose.domain.BackfillReport;
import com.healthtech.glucose.domain.BackfillReport.Status;
import com.healthtech.glucose.domain.BackfillStatus;
import com.healthtech.glucose.domain.DailyWindow;
import com.healthtech.glucose.domain.DayOutcome;
import com.healthtech.glucose.domain.RawSample;
import com.healthtech.glucose.source.ReadingSource;
import com.healthtech.glucose.source.ReadingSourceException;
import com.healthtech.glucose.storage.AggregateStore;
import com.healthtech.glucose.storage.StorageException;
import com.healthtech.glucose.util.BackfillCalendar;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives fetch, reduce and store for overdue days.
 *
 * The store's latest date is the only progress state: every decision re-reads it, so a
 * failed or interrupted run resumes from the last day that was fully written.
 * Processing is sequential; each day depends on the watermark left by the previous one.
 */
@Service
public class BackfillScheduler {

    private static final Logger log = LoggerFactory.getLogger(BackfillScheduler.class);

    static final String SOURCE_CIRCUIT_BREAKER = "reading-source";

    private final ReadingSource source;
    private final AggregateStore store;
    private final MinuteReducer reducer;
    private final BackfillCalendar calendar;
    private final CircuitBreaker circuitBreaker;
    private final MeterRegistry meterRegistry;

    private final AtomicLong daysProcessed = new AtomicLong(0);
    private final AtomicLong emptyDays = new AtomicLong(0);
    private final AtomicLong fetchFailures = new AtomicLong(0);
    private final AtomicLong storageFailures = new AtomicLong(0);

    public BackfillScheduler(
            ReadingSource source,
            AggregateStore store,
            MinuteReducer reducer,
            BackfillCalendar calendar,
            CircuitBreakerRegistry circuitBreakerRegistry,
            MeterRegistry meterRegistry) {
        this.source = source;
        this.store = store;
        this.reducer = reducer;
        this.calendar = calendar;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(SOURCE_CIRCUIT_BREAKER);
        this.meterRegistry = meterRegistry;

        meterRegistry.gauge("glucose.backfill.days.processed", daysProcessed);
        meterRegistry.gauge("glucose.backfill.days.empty", emptyDays);
        meterRegistry.gauge("glucose.backfill.fetch.failures", fetchFailures);
        meterRegistry.gauge("glucose.backfill.storage.failures", storageFailures);

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                log.warn("Reading source circuit breaker state changed: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState())
            );
    }

    /**
     * Returns the day the next run would process, or empty if caught up to yesterday.
     */
    public Optional<LocalDate> nextDueDay() {
        return calendar.nextDueDay(store.latestDate());
    }

    /**
     * Fetches one day, reduces it and writes the result.
     * A day without usable readings is recorded with the placeholder row.
     *
     * @throws ReadingSourceException if the fetch fails; nothing is written
     * @throws StorageException if the write fails
     */
    public DayOutcome processDay(LocalDate date) {
        DailyWindow window = calendar.windowFor(date);
        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            log.info("Fetching readings for {} [{}, {})", date, window.startMillis(), window.endMillis());
            List<RawSample> samples = fetch(window);

            SortedMap<Integer, Integer> averages = reducer.reduce(samples);
            DayOutcome outcome;
            if (averages.isEmpty()) {
                store.markDayEmpty(date);
                emptyDays.incrementAndGet();
                outcome = DayOutcome.empty(date, samples.size());
                log.info("No usable readings for {} ({} fetched); day marked as checked", date, samples.size());
            } else {
                int written = store.upsertMinuteAverages(date, averages);
                outcome = DayOutcome.written(date, samples.size(), written);
                log.info("Stored {} minute averages for {} from {} readings", written, date, samples.size());
            }

            daysProcessed.incrementAndGet();
            return outcome;

        } finally {
            sample.stop(meterRegistry.timer("glucose.backfill.day.duration"));
        }
    }

    /**
     * Processes overdue days one after another until caught up to yesterday.
     * Stops at the first failure; the watermark stays at the last fully written day.
     */
    public BackfillReport runCatchUp() {
        List<DayOutcome> processed = new ArrayList<>();
        LocalDate previous = null;

        while (true) {
            Optional<LocalDate> watermark;
            Optional<LocalDate> due;
            try {
                watermark = store.latestDate();
                due = calendar.nextDueDay(watermark);
            } catch (StorageException e) {
                storageFailures.incrementAndGet();
                log.error("Catch-up stopped: watermark lookup failed: {}", e.getMessage(), e);
                return BackfillReport.failed(Status.STORAGE_FAILED, processed, null, e.getMessage(), Optional.empty());
            }

            if (due.isEmpty()) {
                log.info("History is current up to {}; catch-up finished after {} days",
                         calendar.lastCompletableDay(), processed.size());
                return BackfillReport.completed(Status.CAUGHT_UP, processed, watermark);
            }

            LocalDate day = due.get();
            if (day.equals(previous)) {
                log.error("Catch-up stopped: {} was processed but the watermark is still {}", day, watermark.orElse(null));
                return BackfillReport.failed(Status.STALLED, processed, day,
                    "Watermark did not advance past " + day, watermark);
            }

            Optional<BackfillReport> failure = processOrReport(day, processed, watermark);
            if (failure.isPresent()) {
                return failure.get();
            }
            previous = day;
        }
    }

    /**
     * Processes at most one overdue day. Failures are logged and reported, never thrown;
     * the next scheduled invocation retries the same day.
     */
    public BackfillReport runSingleStep() {
        Optional<LocalDate> watermark;
        Optional<LocalDate> due;
        try {
            watermark = store.latestDate();
            due = calendar.nextDueDay(watermark);
        } catch (StorageException e) {
            storageFailures.incrementAndGet();
            log.error("Backfill step skipped: watermark lookup failed: {}", e.getMessage(), e);
            return BackfillReport.failed(Status.STORAGE_FAILED, List.of(), null, e.getMessage(), Optional.empty());
        }

        if (due.isEmpty()) {
            log.debug("Backfill step: history is current up to {}", calendar.lastCompletableDay());
            return BackfillReport.completed(Status.CAUGHT_UP, List.of(), watermark);
        }

        List<DayOutcome> processed = new ArrayList<>(1);
        return processOrReport(due.get(), processed, watermark)
            .orElseGet(() -> BackfillReport.completed(Status.STEPPED, processed, Optional.of(due.get())));
    }

    /**
     * Current progress for monitoring.
     */
    public BackfillStatus status() {
        Optional<LocalDate> watermark = store.latestDate();
        return new BackfillStatus(
            watermark.orElse(null),
            calendar.nextDueDay(watermark).orElse(null),
            calendar.lastCompletableDay(),
            calendar.zone().getId(),
            store.count(),
            store.isHealthy()
        );
    }

    /**
     * Processes a day, appending its outcome; returns a failure report if it did not complete.
     * The watermark read before the day is still current after a failure since nothing was committed.
     */
    private Optional<BackfillReport> processOrReport(LocalDate day, List<DayOutcome> processed,
                                                     Optional<LocalDate> watermark) {
        try {
            processed.add(processDay(day));
            return Optional.empty();

        } catch (ReadingSourceException e) {
            fetchFailures.incrementAndGet();
            log.error("Fetching readings for {} failed; backfill stops here and resumes on the next run: {}",
                      day, e.getMessage());
            return Optional.of(BackfillReport.failed(Status.FETCH_FAILED, processed, day, e.getMessage(), watermark));

        } catch (StorageException e) {
            storageFailures.incrementAndGet();
            log.error("Storing aggregates for {} failed: {}", day, e.getMessage(), e);
            return Optional.of(BackfillReport.failed(Status.STORAGE_FAILED, processed, day, e.getMessage(), watermark));
        }
    }

    private List<RawSample> fetch(DailyWindow window) {
        try {
            return circuitBreaker.executeSupplier(() -> source.fetch(window));
        } catch (CallNotPermittedException e) {
            throw new ReadingSourceException("Reading source circuit breaker is open; skipping " + window.date(), e);
        }
    }

    // Metrics accessors
    public long getDaysProcessed() {
        return daysProcessed.get();
    }

    public long getEmptyDays() {
        return emptyDays.get();
    }

    public long getFetchFailures() {
        return fetchFailures.get();
    }
}
