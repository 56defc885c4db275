package com.fintech.anomaly.storage;

/**
 * Base exception for bar store and anomaly sink failures.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
