package com.fintech.anomaly.feed;

import com.fintech.anomaly.domain.Interval;

/**
 * Live bar stream of an exchange or other market-data source.
 */
public interface BarStreamClient {

    /**
     * Opens a stream of bar updates for one (instrument, interval).
     * Updates for the subscription are delivered in order on the listener.
     *
     * @return handle used to close the stream
     */
    FeedSubscription subscribe(String instrument, Interval interval, BarUpdateListener listener);
}
