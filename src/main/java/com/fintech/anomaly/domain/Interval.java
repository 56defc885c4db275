package com.fintech.anomaly.domain;

/**
 * Bar intervals supported by the feed, with epoch-aligned window calculations.
 * Codes follow the exchange convention ("1m", "15m", "4h", ...).
 */
public enum Interval {

    M1("1m", 60_000L),
    M3("3m", 180_000L),
    M5("5m", 300_000L),
    M15("15m", 900_000L),
    M30("30m", 1_800_000L),
    H1("1h", 3_600_000L),
    H4("4h", 14_400_000L),
    D1("1d", 86_400_000L);

    private final String code;
    private final long milliseconds;

    Interval(String code, long milliseconds) {
        this.code = code;
        this.milliseconds = milliseconds;
    }

    /** Returns the exchange code, e.g. "15m". */
    public String code() {
        return code;
    }

    /** Returns interval duration in milliseconds. */
    public long toMillis() {
        return milliseconds;
    }

    /**
     * Aligns timestamp to bar open time: (timestamp / intervalMs) * intervalMs.
     * Integer division floors to nearest boundary.
     */
    public long alignTimestamp(long timestamp) {
        return (timestamp / milliseconds) * milliseconds;
    }

    /** Returns the close time of a bar opened at {@code openTime} (inclusive, exchange style). */
    public long closeTime(long openTime) {
        return openTime + milliseconds - 1;
    }

    /** Returns exclusive window end: openTime + intervalMs. */
    public long windowEnd(long openTime) {
        return openTime + milliseconds;
    }

    /**
     * Parses an exchange code ("15m") or enum name ("M15"), case-insensitive for names.
     *
     * @throws IllegalArgumentException if the code is unknown
     */
    public static Interval fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Interval cannot be blank");
        }
        String trimmed = value.trim();
        for (Interval interval : values()) {
            if (interval.code.equals(trimmed) || interval.name().equalsIgnoreCase(trimmed)) {
                return interval;
            }
        }
        throw new IllegalArgumentException("Unsupported interval: " + value);
    }

    @Override
    public String toString() {
        return code;
    }
}
