package com.fintech.anomaly.feed;

import com.fintech.anomaly.domain.Interval;

/**
 * A live subscription dropped. Non-fatal; the pipeline resubscribes with backoff.
 */
public class FeedDisconnectedException extends RuntimeException {

    private final String instrument;
    private final Interval interval;

    public FeedDisconnectedException(String instrument, Interval interval, String message) {
        super(message);
        this.instrument = instrument;
        this.interval = interval;
    }

    public FeedDisconnectedException(String instrument, Interval interval, String message, Throwable cause) {
        super(message, cause);
        this.instrument = instrument;
        this.interval = interval;
    }

    public String getInstrument() {
        return instrument;
    }

    public Interval getInterval() {
        return interval;
    }
}
