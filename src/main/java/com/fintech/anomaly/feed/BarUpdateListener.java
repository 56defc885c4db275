package com.fintech.anomaly.feed;

import com.fintech.anomaly.domain.BarUpdate;

/**
 * Callback of a live subscription. Invoked on the feed's own threads; implementations
 * must not block.
 */
public interface BarUpdateListener {

    void onBar(BarUpdate update);

    /**
     * The subscription dropped. No further updates arrive on it.
     */
    void onDisconnect(FeedDisconnectedException cause);
}
