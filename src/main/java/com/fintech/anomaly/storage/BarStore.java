package com.fintech.anomaly.storage;

import com.fintech.anomaly.domain.Bar;
import com.fintech.anomaly.domain.BarKey;
import com.fintech.anomaly.domain.Interval;
import com.fintech.anomaly.domain.UpsertResult;

import java.util.List;
import java.util.Optional;

/**
 * Bounded time-series store of bars, keyed by (instrument, interval, openTime).
 * Abstracts the underlying storage mechanism so ingestion, scoring and retention
 * do not depend on it.
 *
 * Implementations must keep at most one bar per key, never replace a final bar,
 * and apply each write atomically with respect to concurrent readers.
 */
public interface BarStore {

    /**
     * Inserts the bar, or replaces the stored bar for the same key if that bar is not final.
     *
     * @return what happened; {@link UpsertResult#REJECTED_FINAL} leaves the stored row unchanged
     * @throws StoreWriteFailedException if the write could not be applied
     */
    UpsertResult upsert(Bar bar);

    /**
     * Inserts the bar only if no bar exists for its key. Used by backfill so that
     * historical data never overwrites live rows.
     *
     * @return {@link UpsertResult#INSERTED}/{@link UpsertResult#INSERTED_FINAL} or
     *         {@link UpsertResult#SKIPPED_EXISTING}
     * @throws StoreWriteFailedException if the write could not be applied
     */
    UpsertResult insertIfAbsent(Bar bar);

    Optional<Bar> find(BarKey key);

    /**
     * Returns up to {@code limit} most recent closed bars, ordered oldest first.
     */
    List<Bar> queryWindow(String instrument, Interval interval, int limit);

    /**
     * Returns up to {@code limit} closed bars opened strictly before {@code beforeOpenTime},
     * ordered oldest first.
     */
    List<Bar> queryWindowBefore(String instrument, Interval interval, long beforeOpenTime, int limit);

    /**
     * Returns up to {@code limit} most recent bars (closed or not), ordered oldest first.
     */
    List<Bar> queryRecent(String instrument, Interval interval, int limit);

    long countClosed(String instrument, Interval interval);

    /**
     * Deletes bars opened before {@code cutoffOpenTime}.
     *
     * @return number of bars deleted
     */
    long deleteOlderThan(long cutoffOpenTime);

    /**
     * Trims every (instrument, interval) series to its {@code maxRowsPerSeries} most recent bars.
     *
     * @return number of bars deleted
     */
    long deleteExcessPerSeries(int maxRowsPerSeries);

    /**
     * Deletes the oldest bars until the store holds at most {@code maxRows} rows and its
     * estimated size is at most {@code maxBytes}.
     *
     * @return number of bars deleted
     */
    long deleteOldestUntilWithinCap(long maxRows, long maxBytes);

    long count();

    long estimatedSizeBytes();

    /** Open time of the oldest stored bar, empty if the store is empty. */
    Optional<Long> oldestOpenTime();

    boolean isHealthy();
}
