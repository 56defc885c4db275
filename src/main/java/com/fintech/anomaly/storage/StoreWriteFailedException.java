package com.fintech.anomaly.storage;

/**
 * A write could not be applied. The caller may drop the update; the next update
 * for the same key replaces it.
 */
public class StoreWriteFailedException extends StoreException {

    public StoreWriteFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
