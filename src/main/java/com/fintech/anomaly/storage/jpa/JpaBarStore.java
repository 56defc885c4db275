package com.fintech.anomaly.storage.jpa;

import com.fintech.anomaly.config.AnomalyProperties;
import com.fintech.anomaly.domain.Bar;
import com.fintech.anomaly.domain.BarKey;
import com.fintech.anomaly.domain.Interval;
import com.fintech.anomaly.domain.UpsertResult;
import com.fintech.anomaly.storage.BarStore;
import com.fintech.anomaly.storage.StoreException;
import com.fintech.anomaly.storage.StoreWriteFailedException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Relational implementation of {@link BarStore} on Spring Data JPA.
 *
 * Each write runs in its own transaction through a {@link TransactionTemplate}, so a
 * lost race on the primary key or the version column rolls back cleanly and is retried
 * once against the committed row. Reads are single statements bounded by a
 * transaction timeout.
 */
@Repository
public class JpaBarStore implements BarStore {

    private static final Logger log = LoggerFactory.getLogger(JpaBarStore.class);

    static final int WRITE_TIMEOUT_SECONDS = 5;
    static final int READ_TIMEOUT_SECONDS = 10;

    private final BarJpaRepository jpaRepository;
    private final TransactionTemplate writeTemplate;
    private final BatchDeleter batchDeleter;
    private final long averageRowBytes;
    private final MeterRegistry meterRegistry;

    private final AtomicLong writeCounter = new AtomicLong(0);
    private final AtomicLong rejectedFinalCounter = new AtomicLong(0);
    private final AtomicLong writeErrorCounter = new AtomicLong(0);
    private final AtomicLong evictedCounter = new AtomicLong(0);
    private final Timer writeTimer;
    private final Timer readTimer;

    public JpaBarStore(
            BarJpaRepository jpaRepository,
            PlatformTransactionManager transactionManager,
            AnomalyProperties properties,
            MeterRegistry meterRegistry) {
        this.jpaRepository = jpaRepository;
        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.writeTemplate.setTimeout(WRITE_TIMEOUT_SECONDS);
        this.batchDeleter = new BatchDeleter(writeTemplate, properties.getRetention().getDeleteBatchSize());
        this.averageRowBytes = properties.getRetention().getAverageRowBytes();
        this.meterRegistry = meterRegistry;

        meterRegistry.gauge("bar.store.writes.total", writeCounter);
        meterRegistry.gauge("bar.store.writes.rejected.final", rejectedFinalCounter);
        meterRegistry.gauge("bar.store.write.errors", writeErrorCounter);
        meterRegistry.gauge("bar.store.evicted.total", evictedCounter);

        this.writeTimer = meterRegistry.timer("bar.store.write.latency");
        this.readTimer = meterRegistry.timer("bar.store.read.latency");

        log.info("JPA bar store initialized: averageRowBytes={}", averageRowBytes);
    }

    @Override
    public UpsertResult upsert(Bar bar) {
        return write(bar, () -> writeTemplate.execute(status -> doUpsert(bar)));
    }

    @Override
    public UpsertResult insertIfAbsent(Bar bar) {
        return write(bar, () -> writeTemplate.execute(status -> doInsertIfAbsent(bar)));
    }

    private UpsertResult doUpsert(Bar bar) {
        Optional<BarEntity> existing = jpaRepository.findById(bar.key().toStorageId());
        if (existing.isEmpty()) {
            jpaRepository.saveAndFlush(BarEntity.fromBar(bar));
            return bar.isFinal() ? UpsertResult.INSERTED_FINAL : UpsertResult.INSERTED;
        }

        BarEntity entity = existing.get();
        if (Boolean.TRUE.equals(entity.getFinalBar())) {
            return UpsertResult.REJECTED_FINAL;
        }

        // Managed entity: flushed on commit, version checked against concurrent writers
        entity.apply(bar);
        jpaRepository.flush();
        return bar.isFinal() ? UpsertResult.FINALIZED : UpsertResult.UPDATED;
    }

    private UpsertResult doInsertIfAbsent(Bar bar) {
        if (jpaRepository.existsById(bar.key().toStorageId())) {
            return UpsertResult.SKIPPED_EXISTING;
        }
        jpaRepository.saveAndFlush(BarEntity.fromBar(bar));
        return bar.isFinal() ? UpsertResult.INSERTED_FINAL : UpsertResult.INSERTED;
    }

    /**
     * Runs a write transaction. A concurrent writer on the same key surfaces as a
     * constraint or optimistic lock failure; the write is then retried once so it sees
     * the committed row.
     */
    private UpsertResult write(Bar bar, Supplier<UpsertResult> transaction) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            UpsertResult result;
            try {
                result = transaction.get();
            } catch (DataAccessException e) {
                log.debug("Write conflict, retrying: key={}, cause={}", bar.key(), e.getMessage());
                result = transaction.get();
            }
            record(result);
            if (log.isTraceEnabled()) {
                log.trace("Bar write: key={}, final={}, result={}", bar.key(), bar.isFinal(), result);
            }
            return result;
        } catch (DataAccessException | TransactionException e) {
            writeErrorCounter.incrementAndGet();
            log.error("Failed to write bar: key={}, final={}", bar.key(), bar.isFinal(), e);
            throw new StoreWriteFailedException("Bar write failed for " + bar.key().toStorageId(), e);
        } finally {
            sample.stop(writeTimer);
        }
    }

    private void record(UpsertResult result) {
        if (result == null) {
            return;
        }
        if (result == UpsertResult.REJECTED_FINAL) {
            rejectedFinalCounter.incrementAndGet();
        } else if (result.applied()) {
            writeCounter.incrementAndGet();
        }
    }

    @Override
    @Transactional(readOnly = true, timeout = READ_TIMEOUT_SECONDS)
    public Optional<Bar> find(BarKey key) {
        return read(() -> jpaRepository.findById(key.toStorageId()).map(BarEntity::toBar));
    }

    @Override
    @Transactional(readOnly = true, timeout = READ_TIMEOUT_SECONDS)
    public List<Bar> queryWindow(String instrument, Interval interval, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return read(() -> oldestFirst(jpaRepository.findClosedNewestFirst(
            instrument, interval.code(), PageRequest.of(0, limit))));
    }

    @Override
    @Transactional(readOnly = true, timeout = READ_TIMEOUT_SECONDS)
    public List<Bar> queryWindowBefore(String instrument, Interval interval, long beforeOpenTime, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return read(() -> oldestFirst(jpaRepository.findClosedBeforeNewestFirst(
            instrument, interval.code(), beforeOpenTime, PageRequest.of(0, limit))));
    }

    @Override
    @Transactional(readOnly = true, timeout = READ_TIMEOUT_SECONDS)
    public List<Bar> queryRecent(String instrument, Interval interval, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return read(() -> oldestFirst(jpaRepository.findNewestFirst(
            instrument, interval.code(), PageRequest.of(0, limit))));
    }

    @Override
    @Transactional(readOnly = true, timeout = READ_TIMEOUT_SECONDS)
    public long countClosed(String instrument, Interval interval) {
        return read(() -> jpaRepository.countByInstrumentAndIntervalTypeAndFinalBarTrue(instrument, interval.code()));
    }

    @Override
    public long deleteOlderThan(long cutoffOpenTime) {
        long deleted = delete("age", () -> batchDeleter.deleteAll(
            page -> jpaRepository.findIdsOpenedBefore(cutoffOpenTime, page),
            jpaRepository::deleteAllByIdInBatch));
        if (deleted > 0) {
            log.info("Deleted {} bars opened before {}", deleted, cutoffOpenTime);
        }
        return deleted;
    }

    @Override
    public long deleteExcessPerSeries(int maxRowsPerSeries) {
        return delete("per-series cap", () -> {
            long total = 0;
            for (Object[] row : jpaRepository.findSeriesExceeding(maxRowsPerSeries)) {
                String instrument = (String) row[0];
                String intervalType = (String) row[1];

                // Newest bar beyond the cap; it and everything older goes
                List<Long> boundary = jpaRepository.findOpenTimesNewestFirst(
                    instrument, intervalType, PageRequest.of(maxRowsPerSeries, 1));
                if (boundary.isEmpty()) {
                    continue;
                }
                long threshold = boundary.get(0);
                long deleted = batchDeleter.deleteAll(
                    page -> jpaRepository.findSeriesIdsOpenedAtOrBefore(instrument, intervalType, threshold, page),
                    jpaRepository::deleteAllByIdInBatch);
                log.info("Trimmed series to cap: instrument={}, interval={}, deleted={}, maxRows={}",
                    instrument, intervalType, deleted, maxRowsPerSeries);
                total += deleted;
            }
            return total;
        });
    }

    @Override
    public long deleteOldestUntilWithinCap(long maxRows, long maxBytes) {
        long cap = Math.min(maxRows, maxBytes / averageRowBytes);
        return delete("global cap", () -> {
            long excess = jpaRepository.count() - cap;
            if (excess <= 0) {
                return 0L;
            }
            long deleted = batchDeleter.deleteUpTo(excess,
                jpaRepository::findOldestIds,
                jpaRepository::deleteAllByIdInBatch);
            log.info("Evicted oldest bars to stay within cap: deleted={}, cap={}, maxRows={}, maxBytes={}",
                deleted, cap, maxRows, maxBytes);
            return deleted;
        });
    }

    @Override
    public long count() {
        return jpaRepository.count();
    }

    @Override
    public long estimatedSizeBytes() {
        return count() * averageRowBytes;
    }

    @Override
    public Optional<Long> oldestOpenTime() {
        return jpaRepository.findOldestOpenTime();
    }

    @Override
    public boolean isHealthy() {
        try {
            jpaRepository.count();
            return true;
        } catch (Exception e) {
            log.error("Bar store health check failed", e);
            return false;
        }
    }

    private long delete(String reason, Supplier<Long> deletion) {
        try {
            long deleted = deletion.get();
            evictedCounter.addAndGet(deleted);
            return deleted;
        } catch (DataAccessException | TransactionException e) {
            throw new StoreException("Bar eviction failed: " + reason, e);
        }
    }

    private <T> T read(Supplier<T> query) {
        return readTimer.record(query);
    }

    private static List<Bar> oldestFirst(List<BarEntity> newestFirst) {
        List<Bar> bars = new ArrayList<>(newestFirst.size());
        for (BarEntity entity : newestFirst) {
            bars.add(entity.toBar());
        }
        Collections.reverse(bars);
        return bars;
    }
}
