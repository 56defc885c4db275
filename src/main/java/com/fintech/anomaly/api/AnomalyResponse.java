package com.fintech.anomaly.api;

import com.fintech.anomaly.domain.AnomalyReason;
import com.fintech.anomaly.domain.AnomalyRecord;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * API view of an anomaly record.
 */
@Schema(description = "Scored bar with per-dimension z-scores and composite score")
public record AnomalyResponse(
    @Schema(example = "BTCUSDT") String instrument,
    @Schema(example = "15m") String interval,
    @Schema(description = "Open time of the scored bar (epoch millis)", example = "1733529300000") long timestamp,
    @Schema(example = "64850.5") double closePrice,
    @Schema(example = "0.031") double currentReturn,
    @Schema(description = "Quote volume of the bar") double currentVolume,
    @Schema(description = "(high - low) / close of the bar") double currentVolatility,
    @Schema(example = "3.4") double priceZScore,
    @Schema(example = "2.7") double volumeZScore,
    @Schema(example = "1.1") double volatilityZScore,
    @Schema(example = "100.0") double returnPercentile,
    @Schema(example = "2.17") double compositeScore,
    @Schema(example = "[\"price\", \"volume\"]") List<String> reasons,
    double quoteVolume24h,
    long detectedAt
) {

    public static AnomalyResponse from(AnomalyRecord record) {
        return new AnomalyResponse(
            record.instrument(),
            record.interval().code(),
            record.timestamp(),
            record.closePrice(),
            record.currentReturn(),
            record.currentVolume(),
            record.currentVolatility(),
            record.priceZScore(),
            record.volumeZScore(),
            record.volatilityZScore(),
            record.returnPercentile(),
            record.compositeScore(),
            record.reasons().stream().sorted().map(AnomalyReason::tag).toList(),
            record.quoteVolume24h(),
            record.detectedAt()
        );
    }
}
