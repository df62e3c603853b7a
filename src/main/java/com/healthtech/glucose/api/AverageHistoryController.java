package com.healthtech.glucose.api;

import com.healthtech.glucose.domain.MinuteAverage;
import com.healthtech.glucose.service.AverageQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

/**
 * REST API for reading stored per-minute glucose averages.
 */
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Glucose Averages", description = "Per-minute glucose averages by day")
public class AverageHistoryController {

    private static final Logger log = LoggerFactory.getLogger(AverageHistoryController.class);

    private final AverageQueryService queryService;

    public AverageHistoryController(AverageQueryService queryService) {
        this.queryService = queryService;
    }

    /**
     * GET /api/v1/averages?date=2024-03-19
     */
    @Operation(
        summary = "Get per-minute averages for a day",
        description = """
            Returns the stored minute averages of one completed day in columnar form.
            Days fetched without readings report status "checked_empty"; days not
            processed yet report "no_data".
            """,
        tags = {"Glucose Averages"}
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Averages for the day",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = DayAveragesResponse.class),
                examples = @ExampleObject(
                    name = "Sample Response",
                    value = """
                        {
                          "date": "2024-03-19",
                          "status": "ok",
                          "m": [0, 5, 10],
                          "v": [112, 115, 118]
                        }
                        """
                )
            )
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Missing, malformed or incomplete date",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = ErrorResponse.class)
            )
        )
    })
    @GetMapping("/averages")
    public ResponseEntity<DayAveragesResponse> getAverages(
            @Parameter(description = "Calendar day (ISO-8601)", example = "2024-03-19", required = true)
            @RequestParam
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
            LocalDate date) {

        List<MinuteAverage> rows = queryService.findAveragesForDate(date);
        log.debug("Averages query: date={}, rows={}", date, rows.size());
        return ResponseEntity.ok(DayAveragesResponse.fromAverages(date, rows));
    }
}
