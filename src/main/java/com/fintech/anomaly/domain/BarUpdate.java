package com.fintech.anomaly.domain;

import java.util.Locale;

/**
 * Bar update as delivered by the live feed or the historical batch query.
 * Possibly non-final (still accumulating) or final (closed).
 */
public record BarUpdate(
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
     * Validates prices positive and finite, high >= low with open/close inside the range,
     * volumes finite and non-negative, and closeTime >= openTime.
     */
    public boolean isValid() {
        if (instrument == null || instrument.isBlank() || interval == null || openTime <= 0) {
            return false;
        }
        if (!isPositiveFinite(open) || !isPositiveFinite(high)
                || !isPositiveFinite(low) || !isPositiveFinite(close)) {
            return false;
        }
        return high >= low
            && open >= low && open <= high
            && close >= low && close <= high
            && isNonNegativeFinite(volume) && isNonNegativeFinite(quoteVolume) && tradeCount >= 0
            && closeTime >= openTime;
    }

    /** Normalizes the update into a storable bar (instrument upper-cased). */
    public Bar toBar() {
        return new Bar(
            instrument.trim().toUpperCase(Locale.ROOT),
            interval,
            openTime,
            closeTime,
            open,
            high,
            low,
            close,
            volume,
            quoteVolume,
            tradeCount,
            isFinal
        );
    }

    /** Creates an update carrying the same values as {@code bar}. */
    public static BarUpdate of(Bar bar) {
        return new BarUpdate(bar.instrument(), bar.interval(), bar.openTime(), bar.closeTime(),
            bar.open(), bar.high(), bar.low(), bar.close(), bar.volume(), bar.quoteVolume(),
            bar.tradeCount(), bar.isFinal());
    }

    private static boolean isPositiveFinite(double value) {
        return value > 0 && Double.isFinite(value);
    }

    private static boolean isNonNegativeFinite(double value) {
        return value >= 0 && Double.isFinite(value);
    }
}
