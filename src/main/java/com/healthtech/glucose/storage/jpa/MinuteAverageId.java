package com.healthtech.glucose.storage.jpa;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDate;

/**
 * Composite primary key: (reading_date, minute_of_day).
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MinuteAverageId implements Serializable {

    @Column(name = "reading_date", nullable = false)
    private LocalDate readingDate;

    @Column(name = "minute_of_day", nullable = false)
    private Integer minuteOfDay;
}
