package com.fintech.anomaly.retention;

/**
 * Outcome of one retention sweep.
 *
 * @param barsDeletedByAge Bars opened before the age cutoff
 * @param barsDeletedBySeriesCap Bars beyond the per-series cap
 * @param barsDeletedByGlobalCap Oldest bars evicted to respect the row and size caps
 * @param anomaliesDeleted Anomaly records removed by age or row cap
 * @param remainingBars Bars left after the sweep
 * @param success false if any step failed; counts cover the steps that completed
 */
public record SweepReport(
    long barsDeletedByAge,
    long barsDeletedBySeriesCap,
    long barsDeletedByGlobalCap,
    long anomaliesDeleted,
    long remainingBars,
    boolean success
) {

    public long totalBarsDeleted() {
        return barsDeletedByAge + barsDeletedBySeriesCap + barsDeletedByGlobalCap;
    }
}
