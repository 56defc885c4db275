package com.fintech.anomaly.feed;

/**
 * Handle of an open live subscription.
 */
public interface FeedSubscription extends AutoCloseable {

    boolean isOpen();

    /** Stops delivery. Idempotent. */
    @Override
    void close();
}
