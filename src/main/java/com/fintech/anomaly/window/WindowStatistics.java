package com.fintech.anomaly.window;

import com.fintech.anomaly.domain.Bar;

import java.util.List;
import java.util.Optional;

/**
 * Pure window computation over a list of closed bars.
 */
public final class WindowStatistics {

    private WindowStatistics() {
    }

    /**
     * Builds a summary of the last {@code windowSize} bars.
     *
     * <p>{@code bars} holds up to W+1 closed bars, oldest first. With fewer than W bars the
     * window is not ready and the result is empty. With W+1 bars the extra leading bar
     * provides the previous close for the first window bar, so the window carries W returns;
     * with exactly W bars it carries W-1.
     */
    public static Optional<WindowSummary> compute(List<Bar> bars, int windowSize) {
        if (windowSize < 1 || bars.size() < windowSize) {
            return Optional.empty();
        }

        int offset = bars.size() - windowSize;
        List<Bar> window = bars.subList(offset, bars.size());

        int returnCount = offset > 0 ? windowSize : windowSize - 1;
        double[] returns = new double[returnCount];
        int r = 0;
        for (int i = bars.size() - returnCount; i < bars.size(); i++) {
            returns[r++] = bars.get(i).simpleReturn(bars.get(i - 1).close());
        }

        double[] volumes = new double[windowSize];
        double[] volatilities = new double[windowSize];
        for (int i = 0; i < windowSize; i++) {
            Bar bar = window.get(i);
            volumes[i] = bar.quoteVolume();
            volatilities[i] = bar.volatilityProxy();
        }

        return Optional.of(new WindowSummary(
            window,
            returns,
            SeriesStats.of(returns),
            SeriesStats.of(volumes),
            SeriesStats.of(volatilities)
        ));
    }
}
