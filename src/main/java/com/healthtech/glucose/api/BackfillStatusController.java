package com.healthtech.glucose.api;

import com.healthtech.glucose.domain.BackfillStatus;
import com.healthtech.glucose.service.BackfillScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for monitoring backfill progress.
 */
@RestController
@RequestMapping("/api/v1/backfill")
@Tag(name = "Monitoring")
public class BackfillStatusController {

    private final BackfillScheduler scheduler;

    public BackfillStatusController(BackfillScheduler scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Example response:
     * {
     *   "watermark": "2024-03-18",
     *   "nextDueDay": "2024-03-19",
     *   "lastCompletableDay": "2024-03-19",
     *   "zoneId": "Europe/Berlin",
     *   "storedRows": 18230,
     *   "healthy": true
     * }
     */
    @Operation(summary = "Get backfill progress", tags = {"Monitoring"})
    @GetMapping("/status")
    public ResponseEntity<BackfillStatus> getStatus() {
        return ResponseEntity.ok(scheduler.status());
    }
}
