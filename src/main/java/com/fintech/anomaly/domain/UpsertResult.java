package com.fintech.anomaly.domain;

/**
 * Outcome of writing a bar into the bar store.
 */
public enum UpsertResult {

    /** New non-final bar stored. */
    INSERTED,

    /** New bar stored that was already closed when first observed. */
    INSERTED_FINAL,

    /** Existing non-final bar replaced by a newer non-final update. */
    UPDATED,

    /** Existing non-final bar replaced by its closing update. */
    FINALIZED,

    /** Existing bar is final; update rejected and stored row unchanged. */
    REJECTED_FINAL,

    /** Insert-if-absent found an existing row and left it untouched. */
    SKIPPED_EXISTING;

    /** Returns true if this write made a bar final (the bar is newly closed). */
    public boolean closedBar() {
        return this == INSERTED_FINAL || this == FINALIZED;
    }

    /** Returns true if the store content changed. */
    public boolean applied() {
        return this != REJECTED_FINAL && this != SKIPPED_EXISTING;
    }
}
