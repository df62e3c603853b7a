package com.healthtech.glucose.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.healthtech.glucose.domain.RawSample;

/**
 * Subset of a Nightscout /api/v1/entries record.
 *
 * @param id Nightscout document id, used to drop entries repeated across pages
 * @param date Reading time in epoch millis
 * @param sgv Sensor glucose value; absent for calibration and meter entries
 * @param type Entry type (e.g. "sgv", "mbg", "cal")
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NightscoutEntry(
    @JsonProperty("_id") String id,
    Long date,
    Integer sgv,
    String type
) {

    static final String SENSOR_GLUCOSE_TYPE = "sgv";

    public RawSample toSample() {
        return new RawSample(date, sgv);
    }

    /** Entries without a type are treated as sensor readings. */
    public boolean isSensorReading() {
        return type == null || SENSOR_GLUCOSE_TYPE.equals(type);
    }

    /**
     * Key identifying this entry across pages. Falls back to timestamp and value when the
     * server sends no id, so two id-less entries with equal timestamp and value count once.
     */
    String pagingKey() {
        return id != null ? id : date + "/" + sgv + "/" + type;
    }
}
