package com.fintech.anomaly.ingestion;

import com.fintech.anomaly.domain.SeriesKey;

/**
 * Historical fetch exhausted its retries. The series is marked degraded.
 */
public class BackfillFailedException extends RuntimeException {

    private final SeriesKey series;

    public BackfillFailedException(SeriesKey series, Throwable cause) {
        super("Backfill failed for " + series + ": " + cause.getMessage(), cause);
        this.series = series;
    }

    public SeriesKey getSeries() {
        return series;
    }
}
