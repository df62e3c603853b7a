package com.healthtech.glucose.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.healthtech.glucose.domain.MinuteAverage;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Minute averages of one day in columnar form.
 *
 * Example response:
 * {
 *   "date": "2024-03-19",
 *   "status": "ok",
 *   "m": [0, 5, 10],
 *   "v": [112, 115, 118]
 * }
 *
 * status is "ok" with data, "checked_empty" for a day fetched without readings,
 * and "no_data" for a day not processed yet.
 */
@Schema(description = "Per-minute glucose averages for one day")
public record DayAveragesResponse(
    @Schema(description = "Calendar day", example = "2024-03-19")
    LocalDate date,

    @Schema(description = "ok, checked_empty or no_data", example = "ok")
    String status,

    @Schema(description = "Minute of day (0-1439) for each value")
    @JsonProperty("m") List<Integer> minutes,

    @Schema(description = "Average glucose value for each minute")
    @JsonProperty("v") List<Integer> values
) {

    public static final String STATUS_OK = "ok";
    public static final String STATUS_CHECKED_EMPTY = "checked_empty";
    public static final String STATUS_NO_DATA = "no_data";

    /**
     * Builds the response from stored rows. A lone placeholder row is reported as checked_empty.
     */
    public static DayAveragesResponse fromAverages(LocalDate date, List<MinuteAverage> rows) {
        if (rows.isEmpty()) {
            return new DayAveragesResponse(date, STATUS_NO_DATA, List.of(), List.of());
        }
        if (rows.size() == 1 && rows.get(0).isPlaceholder()) {
            return new DayAveragesResponse(date, STATUS_CHECKED_EMPTY, List.of(), List.of());
        }

        List<Integer> minutes = new ArrayList<>(rows.size());
        List<Integer> values = new ArrayList<>(rows.size());
        for (MinuteAverage row : rows) {
            // A placeholder left over from an earlier empty run is not a reading
            if (row.isPlaceholder()) {
                continue;
            }
            minutes.add(row.minuteOfDay());
            values.add(row.average());
        }
        return new DayAveragesResponse(date, STATUS_OK, minutes, values);
    }
}
