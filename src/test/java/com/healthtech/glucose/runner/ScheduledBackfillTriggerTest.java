package com.healthtech.glucose.runner;

import com.healthtech.glucose.domain.BackfillReport;
import com.healthtech.glucose.domain.BackfillReport.Status;
import com.healthtech.glucose.service.BackfillScheduler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("ScheduledBackfillTrigger Tests")
class ScheduledBackfillTriggerTest {

    @Test
    @DisplayName("Should run one step per invocation and survive failures")
    void testStepsAndSurvivesFailure() {
        // Given
        BackfillScheduler scheduler = mock(BackfillScheduler.class);
        LocalDate day = LocalDate.of(2024, 3, 19);
        when(scheduler.runSingleStep()).thenReturn(
            BackfillReport.failed(Status.FETCH_FAILED, List.of(), day, "timeout", Optional.empty()),
            BackfillReport.completed(Status.STEPPED, List.of(), Optional.of(day))
        );
        ScheduledBackfillTrigger trigger = new ScheduledBackfillTrigger(scheduler);

        // When / Then
        assertThatCode(trigger::step).doesNotThrowAnyException();
        assertThatCode(trigger::step).doesNotThrowAnyException();
        verify(scheduler, times(2)).runSingleStep();
    }
}
