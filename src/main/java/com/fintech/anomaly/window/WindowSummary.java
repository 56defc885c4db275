package com.fintech.anomaly.window;

import com.fintech.anomaly.domain.Bar;

import java.util.List;

/**
 * Baseline statistics over the last W closed bars of one (instrument, interval).
 * Derived on demand and never persisted.
 *
 * @param bars Window bars, oldest first
 * @param returns Simple returns inside the window, oldest first
 * @param returnStats Statistics of {@code returns}
 * @param volumeStats Statistics of window quote volumes
 * @param volatilityStats Statistics of window (high - low) / close
 */
public record WindowSummary(
    List<Bar> bars,
    double[] returns,
    SeriesStats returnStats,
    SeriesStats volumeStats,
    SeriesStats volatilityStats
) {

    public WindowSummary {
        bars = List.copyOf(bars);
        returns = returns.clone();
    }

    /** Close of the most recent window bar. */
    public double lastClose() {
        return bars.get(bars.size() - 1).close();
    }

    public int size() {
        return bars.size();
    }

    @Override
    public double[] returns() {
        return returns.clone();
    }
}
