package com.healthtech.glucose.service;

import com.healthtech.glucose.domain.MinuteAverage;
import com.healthtech.glucose.storage.AggregateStore;
import com.healthtech.glucose.util.BackfillCalendar;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Read access to stored minute averages for the display layer.
 *
 * Store reads run behind the "database" circuit breaker so a failing database
 * answers quickly with a service error instead of tying up request threads.
 */
@Service
public class AverageQueryService {

    private static final Logger log = LoggerFactory.getLogger(AverageQueryService.class);

    private final AggregateStore store;
    private final BackfillCalendar calendar;
    private final CircuitBreaker circuitBreaker;

    private final AtomicLong validationErrors = new AtomicLong(0);
    private final AtomicLong serviceErrors = new AtomicLong(0);

    public AverageQueryService(
            AggregateStore store,
            BackfillCalendar calendar,
            CircuitBreakerRegistry circuitBreakerRegistry,
            MeterRegistry meterRegistry) {
        this.store = store;
        this.calendar = calendar;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker("database");

        meterRegistry.gauge("glucose.query.validation.errors", validationErrors);
        meterRegistry.gauge("glucose.query.errors", serviceErrors);

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                log.warn("Database circuit breaker state changed: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState())
            );
    }

    /**
     * Returns the stored rows for a completed day, ordered by minute.
     *
     * @throws ValidationException if the date is missing or not yet complete
     * @throws ServiceException if the store cannot be read
     */
    public List<MinuteAverage> findAveragesForDate(LocalDate date) {
        if (date == null) {
            validationErrors.incrementAndGet();
            throw new ValidationException("Date cannot be null");
        }

        LocalDate lastCompletableDay = calendar.lastCompletableDay();
        if (date.isAfter(lastCompletableDay)) {
            validationErrors.incrementAndGet();
            throw new ValidationException(
                String.format("Date %s is not complete yet; latest available day is %s", date, lastCompletableDay));
        }

        try {
            return circuitBreaker.executeSupplier(() -> store.findByDate(date));

        } catch (CallNotPermittedException e) {
            log.error("Circuit breaker OPEN - rejecting read for date={}", date);
            throw new ServiceException("Database circuit breaker is open. System is recovering from errors.", e);

        } catch (Exception e) {
            serviceErrors.incrementAndGet();
            log.error("Failed to read minute averages for date={}", date, e);
            throw new ServiceException("Failed to retrieve minute averages", e);
        }
    }

    /**
     * Get circuit breaker state for monitoring.
     */
    public String getCircuitBreakerState() {
        return circuitBreaker.getState().name();
    }

    /**
     * Request validation exception.
     */
    public static class ValidationException extends RuntimeException {
        public ValidationException(String message) {
            super(message);
        }
    }

    /**
     * Service layer exception (wraps store failures).
     */
    public static class ServiceException extends RuntimeException {
        public ServiceException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
