package com.fintech.anomaly.feed;

import com.fintech.anomaly.domain.BarUpdate;
import com.fintech.anomaly.domain.Interval;
import com.fintech.anomaly.domain.MarketTicker;

import java.util.List;

/**
 * Request/response market data: historical bars and the market-wide 24h snapshot.
 */
public interface MarketDataClient {

    /**
     * Returns up to {@code limit} most recent bars, oldest first. The last entry may be
     * the still-open bar (not final).
     */
    List<BarUpdate> fetchRecentBars(String instrument, Interval interval, int limit);

    /**
     * Returns 24h quote volume of every listed instrument.
     */
    List<MarketTicker> fetchMarketSnapshot();
}
