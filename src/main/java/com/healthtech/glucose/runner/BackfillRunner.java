package com.healthtech.glucose.runner;

import com.healthtech.glucose.config.GlucoseProperties;
import com.healthtech.glucose.domain.BackfillMode;
import com.healthtech.glucose.domain.BackfillReport;
import com.healthtech.glucose.service.BackfillScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Runs the one-shot backfill modes at startup.
 *
 * catch-up processes every overdue day; single-step processes at most one.
 * A storage failure yields exit code 1. A fetch failure is retryable and exits with 0.
 */
@Component
public class BackfillRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(BackfillRunner.class);

    private final BackfillScheduler scheduler;
    private final BackfillMode mode;

    private volatile int exitCode = 0;

    public BackfillRunner(BackfillScheduler scheduler, GlucoseProperties properties) {
        this.scheduler = scheduler;
        this.mode = properties.getBackfill().getMode();
    }

    @Override
    public void run(ApplicationArguments args) {
        BackfillReport report;
        switch (mode) {
            case CATCH_UP -> {
                log.info("Starting full catch-up backfill");
                report = scheduler.runCatchUp();
            }
            case SINGLE_STEP -> {
                log.info("Starting single backfill step");
                report = scheduler.runSingleStep();
            }
            default -> {
                return;
            }
        }

        log.info("Backfill finished: status={}, daysProcessed={}, watermark={}",
                 report.status(), report.daysProcessed(), report.watermark());
        exitCode = exitCodeFor(report);
    }

    static int exitCodeFor(BackfillReport report) {
        return switch (report.status()) {
            case STORAGE_FAILED, STALLED -> 1;
            default -> 0;
        };
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
