package com.fintech.anomaly.domain;

/**
 * One entry of the market-wide snapshot used for universe selection.
 *
 * @param instrument Trading instrument (e.g., "BTCUSDT")
 * @param quoteVolume24h Rolling 24h quote volume
 */
public record MarketTicker(
    String instrument,
    double quoteVolume24h
) {
}
