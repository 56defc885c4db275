package com.fintech.anomaly.monitoring;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Point-in-time view of the pipeline for operators.
 */
@Schema(description = "Pipeline health snapshot")
public record PipelineHealth(
    @Schema(description = "Bars currently stored", example = "24000")
    long storedRowCount,

    @Schema(description = "Age of the oldest stored bar in milliseconds, 0 when empty", example = "86100000")
    long oldestBarAgeMs,

    @Schema(description = "Instruments in the active universe", example = "150")
    int activeUniverseSize,

    @Schema(description = "Time of the last scoring pass (epoch millis), 0 if none", example = "1733529420000")
    long lastScoringPassTime,

    @Schema(description = "Time of the last successful retention sweep (epoch millis), 0 if none", example = "1733529000000")
    long lastRetentionSweepTime,

    @Schema(description = "Anomaly records stored", example = "312")
    long anomalyCount,

    @Schema(description = "Estimated bar store size in bytes", example = "4800000")
    long estimatedStoreBytes,

    @Schema(description = "Series whose backfill failed, e.g. BTCUSDT/15m")
    List<String> degradedSeries,

    @Schema(description = "Retention sweeps failed in a row", example = "0")
    int consecutiveRetentionFailures,

    @Schema(description = "Whether the bar store answers queries", example = "true")
    boolean storeHealthy
) {
}
