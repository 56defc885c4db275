package com.fintech.anomaly.domain;

import java.util.Objects;

/**
 * One OHLCV observation for a fixed interval, identified by (instrument, interval, openTime).
 * A non-final bar is still accumulating and may be replaced by a later update for the same key;
 * a final bar is closed and immutable.
 *
 * @param instrument Trading instrument (e.g., "BTCUSDT")
 * @param interval Bar interval
 * @param openTime Bar open time (epoch millis, interval-aligned)
 * @param closeTime Bar close time (epoch millis)
 * @param open First traded price
 * @param high Maximum price (must be >= open, close, low)
 * @param low Minimum price (must be <= open, close, high)
 * @param close Last traded price
 * @param volume Base asset volume
 * @param quoteVolume Quote asset (notional) volume
 * @param tradeCount Number of trades
 * @param isFinal true once the bar is closed
 */
public record Bar(
    String instrument,
    Interval interval,
    long openTime,
    long closeTime,
    double open,
    double high,
    double low,
    double close,
    double volume,
    double quoteVolume,
    long tradeCount,
    boolean isFinal
) {

    /**
     * Validates OHLC invariants and non-negative volumes.
     */
    public Bar {
        Objects.requireNonNull(instrument, "Instrument cannot be null");
        Objects.requireNonNull(interval, "Interval cannot be null");
        if (high < low) {
            throw new IllegalArgumentException(
                "High price (" + high + ") cannot be less than low price (" + low + ")"
            );
        }
        if (high < open || high < close || low > open || low > close) {
            throw new IllegalArgumentException(
                "Open (" + open + ") and close (" + close + ") must lie within [" + low + ", " + high + "]"
            );
        }
        if (volume < 0 || quoteVolume < 0 || tradeCount < 0) {
            throw new IllegalArgumentException("Volumes and trade count cannot be negative");
        }
    }

    /** Returns the identity key of this bar. */
    public BarKey key() {
        return new BarKey(instrument, interval, openTime);
    }

    /** Returns a copy of this bar marked final. */
    public Bar asFinal() {
        return isFinal ? this : new Bar(instrument, interval, openTime, closeTime,
            open, high, low, close, volume, quoteVolume, tradeCount, true);
    }

    /** Returns simple return (close - prevClose) / prevClose, 0.0 if prevClose is not positive. */
    public double simpleReturn(double prevClose) {
        return prevClose > 0 ? (close - prevClose) / prevClose : 0.0;
    }

    /** Returns the volatility proxy (high - low) / close, 0.0 if close is not positive. */
    public double volatilityProxy() {
        return close > 0 ? (high - low) / close : 0.0;
    }
}
