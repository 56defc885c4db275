package com.fintech.anomaly.scoring;

/**
 * Which scored bars are written to the anomaly sink.
 */
public enum PersistPolicy {

    /** Only bars with a composite score above zero. */
    ANOMALIES_ONLY,

    /** Every scored bar, including composite score zero, as an audit trail. */
    ALL_SCORED
}
