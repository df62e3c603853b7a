package com.healthtech.glucose.service;

import com.healthtech.glucose.domain.MinuteAverage;
import com.healthtech.glucose.storage.AggregateStore;
import com.healthtech.glucose.storage.StorageException;
import com.healthtech.glucose.util.BackfillCalendar;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("AverageQueryService Tests")
class AverageQueryServiceTest {

    private static final LocalDate YESTERDAY = LocalDate.of(2024, 3, 19);

    private AggregateStore store;
    private CircuitBreakerRegistry circuitBreakerRegistry;
    private AverageQueryService service;

    @BeforeEach
    void setUp() {
        store = mock(AggregateStore.class);
        circuitBreakerRegistry = CircuitBreakerRegistry.ofDefaults();
        BackfillCalendar calendar = new BackfillCalendar(
            Clock.fixed(Instant.parse("2024-03-20T10:00:00Z"), ZoneOffset.UTC), 14);
        service = new AverageQueryService(store, calendar, circuitBreakerRegistry, new SimpleMeterRegistry());
    }

    @Test
    @DisplayName("Should return stored rows for a completed day")
    void testReturnsRows() {
        // Given
        List<MinuteAverage> rows = List.of(new MinuteAverage(YESTERDAY, 0, 90), new MinuteAverage(YESTERDAY, 5, 95));
        when(store.findByDate(YESTERDAY)).thenReturn(rows);

        // When
        List<MinuteAverage> result = service.findAveragesForDate(YESTERDAY);

        // Then
        assertThat(result).isEqualTo(rows);
    }

    @Test
    @DisplayName("Should reject today and future dates")
    void testRejectsIncompleteDays() {
        assertThatThrownBy(() -> service.findAveragesForDate(LocalDate.of(2024, 3, 20)))
            .isInstanceOf(AverageQueryService.ValidationException.class)
            .hasMessageContaining("2024-03-19");
        assertThatThrownBy(() -> service.findAveragesForDate(LocalDate.of(2025, 1, 1)))
            .isInstanceOf(AverageQueryService.ValidationException.class);

        verify(store, never()).findByDate(any());
    }

    @Test
    @DisplayName("Should reject a missing date")
    void testRejectsNull() {
        assertThatThrownBy(() -> service.findAveragesForDate(null))
            .isInstanceOf(AverageQueryService.ValidationException.class);
    }

    @Test
    @DisplayName("Should wrap store failures in ServiceException")
    void testWrapsStoreFailure() {
        when(store.findByDate(YESTERDAY)).thenThrow(new StorageException("boom", new RuntimeException()));

        assertThatThrownBy(() -> service.findAveragesForDate(YESTERDAY))
            .isInstanceOf(AverageQueryService.ServiceException.class)
            .hasCauseInstanceOf(StorageException.class);
    }

    @Test
    @DisplayName("Should fail fast when the database circuit breaker is open")
    void testOpenCircuitBreaker() {
        circuitBreakerRegistry.circuitBreaker("database").transitionToForcedOpenState();

        assertThatThrownBy(() -> service.findAveragesForDate(YESTERDAY))
            .isInstanceOf(AverageQueryService.ServiceException.class)
            .hasMessageContaining("circuit breaker is open");
        assertThat(service.getCircuitBreakerState()).isEqualTo("FORCED_OPEN");
        verify(store, never()).findByDate(any());
    }
}
