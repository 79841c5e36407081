package com.singularity.trading.store;

/**
 * Thrown when the document store is reachable but cannot serve a request: failed reads,
 * writes rejected for reasons other than a version conflict, or documents that cannot be decoded.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
