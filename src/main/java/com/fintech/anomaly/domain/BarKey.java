package com.fintech.anomaly.domain;

import java.util.Objects;

/**
 * Identity of a bar: instrument, interval and open time.
 * Implements natural ordering by instrument, then interval, then open time.
 */
public record BarKey(
    String instrument,
    Interval interval,
    long openTime
) implements Comparable<BarKey> {

    public BarKey {
        Objects.requireNonNull(instrument, "Instrument cannot be null");
        Objects.requireNonNull(interval, "Interval cannot be null");
    }

    @Override
    public int compareTo(BarKey other) {
        int instrumentCompare = this.instrument.compareTo(other.instrument);
        if (instrumentCompare != 0) {
            return instrumentCompare;
        }

        int intervalCompare = this.interval.compareTo(other.interval);
        if (intervalCompare != 0) {
            return intervalCompare;
        }

        return Long.compare(this.openTime, other.openTime);
    }

    /**
     * Storage identifier. Format: "INSTRUMENT_INTERVAL_OPENTIME", e.g. "BTCUSDT_15m_1733000000000".
     */
    public String toStorageId() {
        return instrument + "_" + interval.code() + "_" + openTime;
    }
}
