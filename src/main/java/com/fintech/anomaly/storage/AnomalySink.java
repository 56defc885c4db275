package com.fintech.anomaly.storage;

import com.fintech.anomaly.domain.AnomalyRecord;

import java.util.List;

/**
 * Durable store of anomaly records keyed by (instrument, interval, timestamp).
 */
public interface AnomalySink {

    /**
     * Inserts the record if no record exists for its key.
     *
     * @return true if inserted, false if the key was already present (no-op)
     * @throws StoreWriteFailedException if the write could not be applied
     */
    boolean upsert(AnomalyRecord record);

    /**
     * Returns matching records ordered by timestamp descending.
     */
    List<AnomalyRecord> query(AnomalyQuery query);

    /**
     * Returns anomalies (composite score above zero) at or after {@code sinceTimestamp},
     * highest composite score first.
     */
    List<AnomalyRecord> top(long sinceTimestamp, int limit);

    long deleteOlderThan(long cutoffTimestamp);

    long deleteOldestUntilWithinCap(long maxRows);

    long count();
}
