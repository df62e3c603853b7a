package com.healthtech.glucose.storage.jpa;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JPA entity for a stored minute average.
 *
 * The table is created by {@link JpaAggregateStore#initialize()}; the mapping here
 * mirrors that DDL.
 */
@Entity
@Table(
    name = "minute_averages",
    indexes = {
        @Index(name = "idx_minute_averages_minute_of_day", columnList = "minute_of_day")
    }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MinuteAverageEntity {

    @EmbeddedId
    private MinuteAverageId id;

    /**
     * Rounded mean glucose value for the minute (0 for the empty-day placeholder)
     */
    @Column(name = "avg_value", nullable = false)
    private Integer average;
}
