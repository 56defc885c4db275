package com.fintech.anomaly.api;

import com.fintech.anomaly.window.SeriesStats;
import com.fintech.anomaly.window.WindowSummary;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Optional;

/**
 * API view of the baseline window new bars of a series are currently scored against.
 */
@Schema(description = "Current baseline window of a series")
public record WindowResponse(
    @Schema(example = "BTCUSDT") String instrument,
    @Schema(example = "15m") String interval,
    @Schema(example = "16") int windowSize,
    @Schema(description = "false until the series holds a full window of closed bars") boolean ready,
    @Schema(description = "Open time of the oldest window bar (epoch millis), 0 when not ready") long fromOpenTime,
    @Schema(description = "Open time of the newest window bar (epoch millis), 0 when not ready") long toOpenTime,
    Stats returns,
    Stats quoteVolume,
    Stats volatility
) {

    @Schema(description = "Mean and sample standard deviation")
    public record Stats(double mean, double stdDev, int count) {
        static Stats from(SeriesStats stats) {
            return new Stats(stats.mean(), stats.stdDev(), stats.count());
        }
    }

    public static WindowResponse from(String instrument, String interval, int windowSize,
                                      Optional<WindowSummary> summary) {
        if (summary.isEmpty()) {
            return new WindowResponse(instrument, interval, windowSize, false, 0L, 0L, null, null, null);
        }
        WindowSummary window = summary.get();
        return new WindowResponse(
            instrument,
            interval,
            windowSize,
            true,
            window.bars().get(0).openTime(),
            window.bars().get(window.size() - 1).openTime(),
            Stats.from(window.returnStats()),
            Stats.from(window.volumeStats()),
            Stats.from(window.volatilityStats())
        );
    }
}
