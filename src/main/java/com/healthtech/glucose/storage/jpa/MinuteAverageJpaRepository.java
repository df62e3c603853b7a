package com.healthtech.glucose.storage.jpa;

import com.healthtech.glucose.domain.MinuteAverage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for minute averages.
 *
 * Reads project straight into {@link MinuteAverage} so results never come from a
 * stale persistence context after native writes.
 */
@Repository
public interface MinuteAverageJpaRepository extends JpaRepository<MinuteAverageEntity, MinuteAverageId> {

    /**
     * Latest stored date (the backfill watermark). Served by the primary key index.
     */
    @Query("SELECT MAX(m.id.readingDate) FROM MinuteAverageEntity m")
    Optional<LocalDate> findLatestDate();

    /**
     * All rows for a date, ordered by minute.
     */
    @Query("SELECT new com.healthtech.glucose.domain.MinuteAverage(m.id.readingDate, m.id.minuteOfDay, m.average) " +
           "FROM MinuteAverageEntity m " +
           "WHERE m.id.readingDate = :date " +
           "ORDER BY m.id.minuteOfDay ASC")
    List<MinuteAverage> findByDate(@Param("date") LocalDate date);

    long countByIdReadingDate(LocalDate readingDate);

    /**
     * Inserts the (date, 0, 0) placeholder only when the date has no rows at all.
     * ON CONFLICT covers a concurrent writer that inserted minute 0 first.
     *
     * @return 1 if the placeholder was inserted, 0 otherwise
     */
    @Modifying
    @Query(
        value = """
            INSERT INTO minute_averages (reading_date, minute_of_day, avg_value)
            SELECT CAST(:date AS date), 0, 0
            WHERE NOT EXISTS (SELECT 1 FROM minute_averages WHERE reading_date = CAST(:date AS date))
            ON CONFLICT (reading_date, minute_of_day) DO NOTHING
            """,
        nativeQuery = true)
    int insertPlaceholderIfAbsent(@Param("date") LocalDate date);
}
