package com.healthtech.glucose.runner;

import com.healthtech.glucose.domain.BackfillReport;
import com.healthtech.glucose.service.BackfillScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Invokes a single backfill step on a fixed cadence.
 * Failed steps are retried by the next invocation.
 */
@Component
@ConditionalOnProperty(name = "glucose.backfill.mode", havingValue = "scheduled", matchIfMissing = true)
public class ScheduledBackfillTrigger {

    private static final Logger log = LoggerFactory.getLogger(ScheduledBackfillTrigger.class);

    private final BackfillScheduler scheduler;

    public ScheduledBackfillTrigger(BackfillScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Scheduled(
        fixedDelayString = "${glucose.backfill.step-interval-ms:300000}",
        initialDelayString = "${glucose.backfill.initial-delay-ms:10000}")
    public void step() {
        BackfillReport report = scheduler.runSingleStep();
        if (report.isFailure()) {
            log.warn("Scheduled backfill step ended with {} for {}; retrying next interval",
                     report.status(), report.failedDay());
        } else if (report.status() == BackfillReport.Status.STEPPED) {
            log.info("Scheduled backfill step stored {}", report.watermark());
        }
    }
}
