package com.fintech.anomaly.domain;

import java.util.Objects;

/**
 * One bar series: an (instrument, interval) pair.
 */
public record SeriesKey(String instrument, Interval interval) {

    public SeriesKey {
        Objects.requireNonNull(instrument, "Instrument cannot be null");
        Objects.requireNonNull(interval, "Interval cannot be null");
    }

    public static SeriesKey of(BarKey key) {
        return new SeriesKey(key.instrument(), key.interval());
    }

    @Override
    public String toString() {
        return instrument + "/" + interval.code();
    }
}
