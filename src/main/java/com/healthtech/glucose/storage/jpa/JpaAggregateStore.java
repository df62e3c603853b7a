package com.healthtech.glucose.storage.jpa;

import com.healthtech.glucose.domain.MinuteAverage;
import com.healthtech.glucose.storage.AggregateStore;
import com.healthtech.glucose.storage.StorageException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Date;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * PostgreSQL implementation of AggregateStore.
 *
 * Conflict handling is left to the database (ON CONFLICT DO UPDATE / DO NOTHING),
 * so overlapping runs writing the same day cannot corrupt rows.
 *
 * Transactions are opened inside each method with a TransactionTemplate, so a database
 * that cannot hand out a connection surfaces as StorageException like any other failure.
 */
@Repository
public class JpaAggregateStore implements AggregateStore {

    private static final Logger log = LoggerFactory.getLogger(JpaAggregateStore.class);

    static final String CREATE_TABLE_SQL = """
        CREATE TABLE IF NOT EXISTS minute_averages (
            reading_date  DATE    NOT NULL,
            minute_of_day INTEGER NOT NULL CHECK (minute_of_day BETWEEN 0 AND 1439),
            avg_value     INTEGER NOT NULL,
            PRIMARY KEY (reading_date, minute_of_day)
        )
        """;

    static final String CREATE_INDEX_SQL = """
        CREATE INDEX IF NOT EXISTS idx_minute_averages_minute_of_day
            ON minute_averages (minute_of_day)
        """;

    static final String UPSERT_SQL = """
        INSERT INTO minute_averages (reading_date, minute_of_day, avg_value)
        VALUES (?, ?, ?)
        ON CONFLICT (reading_date, minute_of_day)
        DO UPDATE SET avg_value = EXCLUDED.avg_value
        """;

    private final MinuteAverageJpaRepository jpaRepository;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate writeTransaction;
    private final TransactionTemplate readTransaction;

    private final AtomicLong rowsWritten = new AtomicLong(0);
    private final AtomicLong placeholdersWritten = new AtomicLong(0);
    private final AtomicLong writeErrors = new AtomicLong(0);
    private final Timer writeTimer;
    private final Timer readTimer;

    public JpaAggregateStore(
            MinuteAverageJpaRepository jpaRepository,
            JdbcTemplate jdbcTemplate,
            PlatformTransactionManager transactionManager,
            MeterRegistry meterRegistry) {
        this.jpaRepository = jpaRepository;
        this.jdbcTemplate = jdbcTemplate;
        this.writeTransaction = new TransactionTemplate(transactionManager);
        this.readTransaction = new TransactionTemplate(transactionManager);
        this.readTransaction.setReadOnly(true);

        meterRegistry.gauge("glucose.store.rows.written", rowsWritten);
        meterRegistry.gauge("glucose.store.placeholders.written", placeholdersWritten);
        meterRegistry.gauge("glucose.store.write.errors", writeErrors);

        this.writeTimer = meterRegistry.timer("glucose.store.write.latency");
        this.readTimer = meterRegistry.timer("glucose.store.read.latency");
    }

    @Override
    @PostConstruct
    public void initialize() {
        try {
            jdbcTemplate.execute(CREATE_TABLE_SQL);
            jdbcTemplate.execute(CREATE_INDEX_SQL);
            log.info("Aggregate store initialized: table=minute_averages");
        } catch (DataAccessException e) {
            log.error("Failed to initialize aggregate store schema", e);
            throw new StorageException("Aggregate store initialization failed", e);
        }
    }

    @Override
    public Optional<LocalDate> latestDate() {
        return readTimer.record(() -> {
            try {
                return readTransaction.execute(status -> jpaRepository.findLatestDate());
            } catch (DataAccessException | TransactionException e) {
                log.error("Failed to read latest aggregated date", e);
                throw new StorageException("Watermark lookup failed", e);
            }
        });
    }

    @Override
    public int upsertMinuteAverages(LocalDate date, Map<Integer, Integer> averagesByMinute) {
        if (averagesByMinute.isEmpty()) {
            return 0;
        }

        List<Object[]> batch = new ArrayList<>(averagesByMinute.size());
        Date sqlDate = Date.valueOf(date);
        averagesByMinute.forEach((minute, average) -> {
            // Validates the minute range before anything reaches the database
            MinuteAverage row = new MinuteAverage(date, minute, average);
            batch.add(new Object[] {sqlDate, row.minuteOfDay(), row.average()});
        });

        return writeTimer.record(() -> {
            try {
                writeTransaction.executeWithoutResult(status -> jdbcTemplate.batchUpdate(UPSERT_SQL, batch));
                rowsWritten.addAndGet(batch.size());

                if (log.isDebugEnabled()) {
                    log.debug("Upserted {} minute averages for {}", batch.size(), date);
                }
                return batch.size();
            } catch (DataAccessException | TransactionException e) {
                writeErrors.incrementAndGet();
                log.error("Failed to upsert minute averages: date={}, rows={}", date, batch.size(), e);
                throw new StorageException("Upsert of minute averages for " + date + " failed", e);
            }
        });
    }

    @Override
    public boolean markDayEmpty(LocalDate date) {
        return writeTimer.record(() -> {
            try {
                Integer insertedRows = writeTransaction.execute(status -> jpaRepository.insertPlaceholderIfAbsent(date));
                boolean inserted = insertedRows != null && insertedRows > 0;
                if (inserted) {
                    placeholdersWritten.incrementAndGet();
                    log.info("Marked {} as checked with no readings", date);
                } else {
                    log.debug("Placeholder for {} skipped; the day already has rows", date);
                }
                return inserted;
            } catch (DataAccessException | TransactionException e) {
                writeErrors.incrementAndGet();
                log.error("Failed to mark day empty: date={}", date, e);
                throw new StorageException("Placeholder insert for " + date + " failed", e);
            }
        });
    }

    @Override
    public List<MinuteAverage> findByDate(LocalDate date) {
        return readTimer.record(() -> {
            try {
                return readTransaction.execute(status -> jpaRepository.findByDate(date));
            } catch (DataAccessException | TransactionException e) {
                log.error("Failed to read minute averages: date={}", date, e);
                throw new StorageException("Read of minute averages for " + date + " failed", e);
            }
        });
    }

    @Override
    public long count() {
        try {
            return jpaRepository.count();
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to count stored minute averages", e);
            throw new StorageException("Row count failed", e);
        }
    }

    @Override
    public boolean isHealthy() {
        try {
            jpaRepository.findLatestDate();
            return true;
        } catch (Exception e) {
            log.error("Aggregate store health check failed", e);
            return false;
        }
    }

    /**
     * Row count for a single date, for monitoring.
     */
    public long count(LocalDate date) {
        return jpaRepository.countByIdReadingDate(date);
    }
}
