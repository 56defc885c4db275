package com.fintech.anomaly.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Scored bar. Identity is (instrument, interval, timestamp) where timestamp is the open
 * time of the scored bar. Never mutated after creation.
 *
 * @param instrument Trading instrument
 * @param interval Interval of the scored bar
 * @param timestamp Open time of the scored bar (epoch millis)
 * @param closePrice Close of the scored bar
 * @param currentReturn Return against the last window close
 * @param currentVolume Quote volume of the scored bar
 * @param currentVolatility (high - low) / close of the scored bar
 * @param priceZScore Return z-score against the window
 * @param volumeZScore Volume z-score against the window
 * @param volatilityZScore Volatility z-score against the window
 * @param returnPercentile Share of window |returns| strictly below |currentReturn|, in percent
 * @param compositeScore Weighted sum of |z| over triggered dimensions, 0 when nothing triggered
 * @param reasons Triggered dimensions
 * @param quoteVolume24h Instrument 24h quote volume at scoring time, 0 if unknown
 * @param detectedAt Wall-clock scoring time (epoch millis)
 */
public record AnomalyRecord(
    String instrument,
    Interval interval,
    long timestamp,
    double closePrice,
    double currentReturn,
    double currentVolume,
    double currentVolatility,
    double priceZScore,
    double volumeZScore,
    double volatilityZScore,
    double returnPercentile,
    double compositeScore,
    Set<AnomalyReason> reasons,
    double quoteVolume24h,
    long detectedAt
) {

    public AnomalyRecord {
        Objects.requireNonNull(instrument, "Instrument cannot be null");
        Objects.requireNonNull(interval, "Interval cannot be null");
        reasons = reasons == null || reasons.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(reasons));
    }

    /** Returns the identity key, shared with the scored bar. */
    public BarKey key() {
        return new BarKey(instrument, interval, timestamp);
    }

    /** Returns true if at least one dimension triggered. */
    public boolean isAnomaly() {
        return compositeScore > 0;
    }
}
