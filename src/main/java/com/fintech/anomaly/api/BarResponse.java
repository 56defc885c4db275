package com.fintech.anomaly.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fintech.anomaly.domain.Bar;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * API view of a stored bar.
 */
@Schema(description = "OHLCV bar")
public record BarResponse(
    @Schema(example = "1733529300000") long openTime,
    @Schema(example = "1733530199999") long closeTime,
    double open,
    double high,
    double low,
    double close,
    double volume,
    double quoteVolume,
    long tradeCount,
    @JsonProperty("isFinal")
    @Schema(description = "false while the bar is still accumulating") boolean isFinal
) {

    public static BarResponse from(Bar bar) {
        return new BarResponse(
            bar.openTime(),
            bar.closeTime(),
            bar.open(),
            bar.high(),
            bar.low(),
            bar.close(),
            bar.volume(),
            bar.quoteVolume(),
            bar.tradeCount(),
            bar.isFinal()
        );
    }
}
