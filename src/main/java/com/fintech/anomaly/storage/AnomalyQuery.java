package com.fintech.anomaly.storage;

/**
 * Filter for anomaly record queries.
 *
 * @param instrument Restricts results to one instrument, null for all
 * @param minScore Minimum composite score (inclusive)
 * @param anomalyOnly Excludes records whose composite score is zero
 * @param sinceTimestamp Earliest bar open time included (epoch millis), 0 for no bound
 * @param limit Maximum number of records returned
 */
public record AnomalyQuery(
    String instrument,
    double minScore,
    boolean anomalyOnly,
    long sinceTimestamp,
    int limit
) {
}
