package com.fintech.anomaly.window;

/**
 * Mean and sample standard deviation (N-1) of a series.
 *
 * @param mean Arithmetic mean, 0 for an empty series
 * @param stdDev Sample standard deviation, 0 when fewer than two values
 * @param count Number of values
 */
public record SeriesStats(double mean, double stdDev, int count) {

    public static final SeriesStats EMPTY = new SeriesStats(0.0, 0.0, 0);

    /** Standard deviations at or below this are treated as zero. */
    public static final double ZERO_STD_DEV_EPSILON = 1e-12;

    public static SeriesStats of(double[] values) {
        int n = values.length;
        if (n == 0) {
            return EMPTY;
        }
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        double mean = sum / n;
        if (n < 2) {
            return new SeriesStats(mean, 0.0, n);
        }
        double squares = 0.0;
        for (double value : values) {
            double diff = value - mean;
            squares += diff * diff;
        }
        return new SeriesStats(mean, Math.sqrt(squares / (n - 1)), n);
    }

    /**
     * Returns (value - mean) / stdDev, or 0.0 when the standard deviation is effectively zero.
     */
    public double zScore(double value) {
        if (stdDev <= ZERO_STD_DEV_EPSILON) {
            return 0.0;
        }
        return (value - mean) / stdDev;
    }
}
