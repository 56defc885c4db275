package com.fintech.anomaly.storage.jpa;

import com.fintech.anomaly.config.AnomalyProperties;
import com.fintech.anomaly.domain.AnomalyRecord;
import com.fintech.anomaly.storage.AnomalyQuery;
import com.fintech.anomaly.storage.AnomalySink;
import com.fintech.anomaly.storage.StoreException;
import com.fintech.anomaly.storage.StoreWriteFailedException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Relational implementation of {@link AnomalySink}. Inserts are keyed on the scored
 * bar's identity, so re-scoring a bar is a no-op.
 */
@Repository
public class JpaAnomalySink implements AnomalySink {

    private static final Logger log = LoggerFactory.getLogger(JpaAnomalySink.class);

    private final AnomalyJpaRepository jpaRepository;
    private final TransactionTemplate writeTemplate;
    private final BatchDeleter batchDeleter;

    private final AtomicLong insertedCounter = new AtomicLong(0);
    private final AtomicLong duplicateCounter = new AtomicLong(0);

    public JpaAnomalySink(
            AnomalyJpaRepository jpaRepository,
            PlatformTransactionManager transactionManager,
            AnomalyProperties properties,
            MeterRegistry meterRegistry) {
        this.jpaRepository = jpaRepository;
        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.writeTemplate.setTimeout(JpaBarStore.WRITE_TIMEOUT_SECONDS);
        this.batchDeleter = new BatchDeleter(writeTemplate, properties.getRetention().getDeleteBatchSize());

        meterRegistry.gauge("anomaly.sink.inserted.total", insertedCounter);
        meterRegistry.gauge("anomaly.sink.duplicates.total", duplicateCounter);
    }

    @Override
    public boolean upsert(AnomalyRecord record) {
        String id = record.key().toStorageId();
        try {
            Boolean inserted = writeTemplate.execute(status -> {
                if (jpaRepository.existsById(id)) {
                    return false;
                }
                jpaRepository.saveAndFlush(AnomalyEntity.fromRecord(record));
                return true;
            });
            if (Boolean.TRUE.equals(inserted)) {
                insertedCounter.incrementAndGet();
                log.info("Anomaly recorded: instrument={}, interval={}, time={}, score={}, reasons={}",
                    record.instrument(), record.interval(), record.timestamp(),
                    String.format("%.3f", record.compositeScore()), record.reasons());
                return true;
            }
            duplicateCounter.incrementAndGet();
            return false;

        } catch (DataIntegrityViolationException e) {
            // Concurrent insert of the same key won
            duplicateCounter.incrementAndGet();
            log.debug("Anomaly already recorded concurrently: id={}", id);
            return false;

        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to record anomaly: id={}", id, e);
            throw new StoreWriteFailedException("Anomaly write failed for " + id, e);
        }
    }

    @Override
    @Transactional(readOnly = true, timeout = JpaBarStore.READ_TIMEOUT_SECONDS)
    public List<AnomalyRecord> query(AnomalyQuery query) {
        PageRequest page = PageRequest.of(0, query.limit());
        List<AnomalyEntity> entities = query.instrument() == null
            ? jpaRepository.findRecent(query.minScore(), query.anomalyOnly(), query.sinceTimestamp(), page)
            : jpaRepository.findRecentForInstrument(
                query.instrument(), query.minScore(), query.anomalyOnly(), query.sinceTimestamp(), page);
        return entities.stream().map(AnomalyEntity::toRecord).toList();
    }

    @Override
    @Transactional(readOnly = true, timeout = JpaBarStore.READ_TIMEOUT_SECONDS)
    public List<AnomalyRecord> top(long sinceTimestamp, int limit) {
        return jpaRepository.findTopSince(sinceTimestamp, PageRequest.of(0, limit)).stream()
            .map(AnomalyEntity::toRecord)
            .toList();
    }

    @Override
    public long deleteOlderThan(long cutoffTimestamp) {
        try {
            long deleted = batchDeleter.deleteAll(
                page -> jpaRepository.findIdsBefore(cutoffTimestamp, page),
                jpaRepository::deleteAllByIdInBatch);
            if (deleted > 0) {
                log.info("Deleted {} anomaly records older than {}", deleted, cutoffTimestamp);
            }
            return deleted;
        } catch (DataAccessException | TransactionException e) {
            throw new StoreException("Anomaly eviction by age failed", e);
        }
    }

    @Override
    public long deleteOldestUntilWithinCap(long maxRows) {
        try {
            long excess = jpaRepository.count() - maxRows;
            if (excess <= 0) {
                return 0;
            }
            long deleted = batchDeleter.deleteUpTo(excess,
                jpaRepository::findOldestIds,
                jpaRepository::deleteAllByIdInBatch);
            log.info("Evicted {} oldest anomaly records to stay within cap {}", deleted, maxRows);
            return deleted;
        } catch (DataAccessException | TransactionException e) {
            throw new StoreException("Anomaly eviction by cap failed", e);
        }
    }

    @Override
    public long count() {
        return jpaRepository.count();
    }
}
