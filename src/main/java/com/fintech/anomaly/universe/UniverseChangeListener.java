package com.fintech.anomaly.universe;

/**
 * Receives the outcome of every universe refresh.
 */
public interface UniverseChangeListener {

    void onUniverseChange(UniverseChange change);
}
